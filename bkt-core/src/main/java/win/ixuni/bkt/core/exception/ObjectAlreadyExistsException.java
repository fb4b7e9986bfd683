package win.ixuni.bkt.core.exception;

public class ObjectAlreadyExistsException extends GatewayException {

    public ObjectAlreadyExistsException(String bucketName, String key) {
        super("ObjectAlreadyExists", "Destination object already exists: " + bucketName + "/" + key, 409);
    }
}
