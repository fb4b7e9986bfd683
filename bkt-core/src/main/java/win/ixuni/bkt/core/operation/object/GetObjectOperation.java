package win.ixuni.bkt.core.operation.object;

import lombok.Value;
import win.ixuni.bkt.core.model.ObjectContent;
import win.ixuni.bkt.core.operation.Operation;

/**
 * 读取对象内容
 */
@Value
public class GetObjectOperation implements Operation<ObjectContent> {

    String bucketName;

    String key;
}
