package win.ixuni.bkt.core.operation.bucket;

import lombok.Value;
import win.ixuni.bkt.core.operation.Operation;

/**
 * 删除物理 Bucket
 */
@Value
public class DeleteBucketOperation implements Operation<Void> {

    String bucketName;
}
