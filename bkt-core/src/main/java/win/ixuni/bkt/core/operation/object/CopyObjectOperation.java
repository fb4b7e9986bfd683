package win.ixuni.bkt.core.operation.object;

import lombok.Value;
import win.ixuni.bkt.core.operation.Operation;

/**
 * 同一 Bucket 内复制对象
 */
@Value
public class CopyObjectOperation implements Operation<Void> {

    String bucketName;

    String sourceKey;

    String destinationKey;

    /**
     * Errors on a copy are reported against the source key
     */
    @Override
    public String getKey() {
        return sourceKey;
    }
}
