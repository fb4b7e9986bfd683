package win.ixuni.bkt.core.exception;

/**
 * Bucket not found exception
 */
public class BucketNotFoundException extends GatewayException {

    public BucketNotFoundException(String bucketName) {
        super("NoSuchBucket", "The specified bucket does not exist: " + bucketName, 404);
    }
}
