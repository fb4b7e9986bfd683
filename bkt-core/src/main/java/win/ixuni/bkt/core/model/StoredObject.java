package win.ixuni.bkt.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 对象元数据记录，(bucketId, key) 唯一
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StoredObject {

    private String id;

    private String bucketId;

    private String key;

    private long size;

    private String contentType;

    /**
     * MD5 hex
     */
    private String etag;

    /**
     * SHA-256 hex, empty when not computed
     */
    private String sha256;

    /**
     * {@code s3://bucket/key} for remote buckets, the key itself for local ones
     */
    private String storagePath;

    private Instant createdAt;

    private Instant updatedAt;
}
