package win.ixuni.bkt.core.operation.object;

import lombok.Value;
import win.ixuni.bkt.core.model.ObjectInfo;
import win.ixuni.bkt.core.operation.Operation;

import java.util.List;

/**
 * 列出 Bucket 中的对象
 * <p>
 * The result is finite: backends cap it (the S3 backend stops after 10000 keys).
 */
@Value
public class ListObjectsOperation implements Operation<List<ObjectInfo>> {

    String bucketName;

    /**
     * Key prefix, null or empty lists everything
     */
    String prefix;
}
