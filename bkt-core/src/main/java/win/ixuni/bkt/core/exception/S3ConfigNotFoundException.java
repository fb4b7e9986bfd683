package win.ixuni.bkt.core.exception;

public class S3ConfigNotFoundException extends GatewayException {

    public S3ConfigNotFoundException(String configRef) {
        super("NoSuchConfiguration", "S3 configuration not found: " + configRef, 404);
    }
}
