package win.ixuni.bkt.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 后端对象元数据
 * <p>
 * What a storage backend reports about one physical object. ETags are unquoted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObjectInfo {

    private String key;

    /**
     * 对象大小(字节)
     */
    private long size;

    /**
     * MD5 hex, no quotes
     */
    private String etag;

    private String contentType;

    private Instant lastModified;
}
