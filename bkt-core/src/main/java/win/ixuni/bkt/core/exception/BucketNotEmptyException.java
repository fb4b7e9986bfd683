package win.ixuni.bkt.core.exception;

/**
 * Bucket not empty exception
 */
public class BucketNotEmptyException extends GatewayException {

    public BucketNotEmptyException(String bucketName) {
        super("BucketNotEmpty", "The bucket you tried to delete is not empty: " + bucketName, 409);
    }
}
