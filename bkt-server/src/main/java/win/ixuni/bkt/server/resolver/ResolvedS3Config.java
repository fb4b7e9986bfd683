package win.ixuni.bkt.server.resolver;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import win.ixuni.bkt.backend.s3.S3StorageBackend;
import win.ixuni.bkt.core.config.BackendConfig;

/**
 * S3 configuration with decrypted credentials, ready to build a backend
 */
@Value
@Builder
public class ResolvedS3Config {

    /**
     * Configuration id, or "env" for the environment fallback
     */
    String source;

    String endpoint;

    String region;

    @ToString.Exclude
    String accessKey;

    @ToString.Exclude
    String secretKey;

    String bucketPrefix;

    boolean useSsl;

    boolean forcePathStyle;

    /**
     * Name of the pooled backend built from the configuration {@code source}
     */
    public static String backendName(String source) {
        return "s3-" + source;
    }

    public BackendConfig toBackendConfig() {
        return new BackendConfig(backendName(source), "s3")
                .with(S3StorageBackend.ENDPOINT, endpoint)
                .with(S3StorageBackend.REGION, region)
                .with(S3StorageBackend.ACCESS_KEY, accessKey)
                .with(S3StorageBackend.SECRET_KEY, secretKey)
                .with(S3StorageBackend.BUCKET_PREFIX, bucketPrefix)
                .with(S3StorageBackend.USE_SSL, useSsl)
                .with(S3StorageBackend.FORCE_PATH_STYLE, forcePathStyle);
    }
}
