package win.ixuni.bkt.core.policy;

/**
 * 网关识别的 action 名称
 */
public final class PolicyActions {

    public static final String LIST_ALL_MY_BUCKETS = "s3:ListAllMyBuckets";
    public static final String GET_BUCKET_LOCATION = "s3:GetBucketLocation";
    public static final String CREATE_BUCKET = "s3:CreateBucket";
    public static final String DELETE_BUCKET = "s3:DeleteBucket";
    public static final String LIST_BUCKET = "s3:ListBucket";
    public static final String GET_OBJECT = "s3:GetObject";
    public static final String PUT_OBJECT = "s3:PutObject";
    public static final String DELETE_OBJECT = "s3:DeleteObject";
    public static final String HEAD_OBJECT = "s3:HeadObject";
    public static final String GET_BUCKET_POLICY = "s3:GetBucketPolicy";
    public static final String PUT_BUCKET_POLICY = "s3:PutBucketPolicy";

    private PolicyActions() {
    }
}
