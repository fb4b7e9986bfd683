package win.ixuni.bkt.server.controller.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import win.ixuni.bkt.server.service.S3ConfigService;

/**
 * S3 configuration fields, credentials in plaintext. Null fields are left unchanged on update.
 */
public record S3ConfigRequest(String name, String endpoint, String region,
                              @JsonProperty("access_key_id") String accessKeyId,
                              @JsonProperty("secret_access_key") String secretAccessKey,
                              @JsonProperty("bucket_prefix") String bucketPrefix,
                              @JsonProperty("use_ssl") Boolean useSsl,
                              @JsonProperty("force_path_style") Boolean forcePathStyle,
                              @JsonProperty("is_default") Boolean isDefault) {

    public S3ConfigService.Changes toChanges() {
        return new S3ConfigService.Changes(name, endpoint, region, accessKeyId, secretAccessKey, bucketPrefix,
                useSsl, forcePathStyle, isDefault);
    }
}
