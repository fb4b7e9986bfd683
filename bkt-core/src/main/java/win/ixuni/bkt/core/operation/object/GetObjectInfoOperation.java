package win.ixuni.bkt.core.operation.object;

import lombok.Value;
import win.ixuni.bkt.core.model.ObjectInfo;
import win.ixuni.bkt.core.operation.Operation;

/**
 * 读取对象元数据 (size, etag, content type, last modified)
 */
@Value
public class GetObjectInfoOperation implements Operation<ObjectInfo> {

    String bucketName;

    String key;
}
