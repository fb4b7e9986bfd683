package win.ixuni.bkt.core.policy;

/**
 * Builds the ARNs presented to the evaluator
 */
public final class ResourceArns {

    private static final String S3_PREFIX = "arn:aws:s3:::";

    private ResourceArns() {
    }

    /**
     * @return {@code arn:aws:s3:::<bucket>}
     */
    public static String bucket(String bucketName) {
        return S3_PREFIX + bucketName;
    }

    /**
     * @return {@code arn:aws:s3:::<bucket>/<key>}
     */
    public static String object(String bucketName, String key) {
        return S3_PREFIX + bucketName + "/" + key;
    }

    /**
     * ARN that covers every bucket, used for account-level actions such as ListAllMyBuckets
     */
    public static String all() {
        return S3_PREFIX + "*";
    }
}
