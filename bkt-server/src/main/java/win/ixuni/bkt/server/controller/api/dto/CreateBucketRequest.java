package win.ixuni.bkt.server.controller.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param storageBackend local or s3, empty for the configured default
 * @param s3ConfigId     stored S3 configuration, empty for the default one
 */
public record CreateBucketRequest(String name, String region,
                                  @JsonProperty("is_public") Boolean isPublic,
                                  @JsonProperty("storage_backend") String storageBackend,
                                  @JsonProperty("s3_config_id") String s3ConfigId) {
}
