package win.ixuni.bkt.core.exception;

/**
 * Object not found exception
 */
public class ObjectNotFoundException extends GatewayException {

    public ObjectNotFoundException(String bucketName, String key) {
        super("NoSuchKey", "The specified key does not exist: " + bucketName + "/" + key, 404);
    }
}
