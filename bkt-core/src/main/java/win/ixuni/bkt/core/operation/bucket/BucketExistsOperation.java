package win.ixuni.bkt.core.operation.bucket;

import lombok.Value;
import win.ixuni.bkt.core.operation.Operation;

/**
 * 检查物理 Bucket 是否存在
 * <p>
 * An access-denied answer from the backend is an error signal, never {@code false}.
 */
@Value
public class BucketExistsOperation implements Operation<Boolean> {

    String bucketName;
}
