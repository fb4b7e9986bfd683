package win.ixuni.bkt.core.operation.bucket;

import lombok.Value;
import win.ixuni.bkt.core.operation.Operation;

/**
 * 创建物理 Bucket
 * <p>
 * Idempotent where the backend allows it.
 */
@Value
public class CreateBucketOperation implements Operation<Void> {

    String bucketName;

    /**
     * Region hint, ignored by the local backend
     */
    String region;
}
