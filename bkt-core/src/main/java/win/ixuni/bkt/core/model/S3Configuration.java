package win.ixuni.bkt.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * 远程 S3 端点配置
 * <p>
 * Credentials are stored encrypted and never serialized.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class S3Configuration {

    private String id;

    private String name;

    private String endpoint;

    private String region;

    /**
     * Encrypted access key id
     */
    @JsonIgnore
    @ToString.Exclude
    private String accessKeyId;

    /**
     * Encrypted secret access key
     */
    @JsonIgnore
    @ToString.Exclude
    private String secretAccessKey;

    private String bucketPrefix;

    @Builder.Default
    private boolean useSsl = true;

    private boolean forcePathStyle;

    @JsonProperty("is_default")
    private boolean isDefault;

    private Instant createdAt;

    private Instant updatedAt;
}
