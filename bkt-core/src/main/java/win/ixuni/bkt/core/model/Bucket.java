package win.ixuni.bkt.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Bucket 元数据记录
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Bucket {

    private String id;

    /**
     * 全局唯一、符合 S3 命名规则
     */
    private String name;

    private String ownerId;

    @JsonProperty("is_public")
    private boolean isPublic;

    private String region;

    @Builder.Default
    private StorageBackendType storageBackend = StorageBackendType.LOCAL;

    /**
     * Explicit S3 configuration, null means "use the default"
     */
    private String s3ConfigId;

    private Instant createdAt;

    private Instant updatedAt;
}
