package win.ixuni.bkt.core.operation.object;

import lombok.Value;
import win.ixuni.bkt.core.operation.Operation;

/**
 * 删除对象，对象不存在时视为成功
 */
@Value
public class DeleteObjectOperation implements Operation<Void> {

    String bucketName;

    String key;
}
