package win.ixuni.bkt.core.exception;

public class UnsupportedContentTypeException extends GatewayException {

    public UnsupportedContentTypeException(String contentType) {
        super("UnsupportedContentType", "Content type is not allowed: " + contentType, 415);
    }
}
