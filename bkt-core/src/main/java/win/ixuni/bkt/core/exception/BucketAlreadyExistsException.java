package win.ixuni.bkt.core.exception;

/**
 * Bucket already exists exception
 */
public class BucketAlreadyExistsException extends GatewayException {

    public BucketAlreadyExistsException(String bucketName) {
        super("BucketAlreadyExists", "The requested bucket name is not available: " + bucketName, 409);
    }
}
