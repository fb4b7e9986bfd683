package win.ixuni.bkt.core.exception;

public class UploadNotFoundException extends GatewayException {

    public UploadNotFoundException(String uploadId) {
        super("NoSuchUpload", "Upload not found: " + uploadId, 404);
    }
}
