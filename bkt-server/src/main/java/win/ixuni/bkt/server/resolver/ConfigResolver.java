package win.ixuni.bkt.server.resolver;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.backend.StorageBackend;
import win.ixuni.bkt.core.exception.BackendException;
import win.ixuni.bkt.core.exception.GatewayException;
import win.ixuni.bkt.core.model.Bucket;
import win.ixuni.bkt.core.model.S3Configuration;
import win.ixuni.bkt.core.model.StorageBackendType;
import win.ixuni.bkt.core.store.S3ConfigStore;
import win.ixuni.bkt.server.config.GatewayProperties;
import win.ixuni.bkt.server.registry.BackendRegistry;
import win.ixuni.bkt.server.security.CredentialCipher;

/**
 * 存储后端解析
 * <p>
 * S3 configuration lookup order: the bucket's own configuration, then the stored default,
 * then the environment ({@code bkt.s3.*}). Stored configurations are cached decrypted; the
 * environment fallback is not cached. A bucket recorded as {@code s3} never silently lands on
 * local disk: failing to build its backend is an error.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigResolver {

    static final String ENV_SOURCE = "env";

    private final S3ConfigStore s3ConfigStore;
    private final ConfigCache cache;
    private final CredentialCipher cipher;
    private final BackendRegistry registry;
    private final GatewayProperties properties;

    /**
     * Backend of an existing bucket
     */
    public Mono<StorageBackend> resolve(Bucket bucket) {
        if (bucket.getStorageBackend() != StorageBackendType.S3) {
            return Mono.just(registry.getLocalBackend());
        }
        return resolveS3(bucket.getS3ConfigId());
    }

    /**
     * Backend of an explicit choice made at bucket creation
     */
    public Mono<StorageBackend> resolve(StorageBackendType type, String s3ConfigId) {
        if (type != StorageBackendType.S3) {
            return Mono.just(registry.getLocalBackend());
        }
        return resolveS3(s3ConfigId);
    }

    /**
     * Backend for a bucket created without an explicit choice.
     * <p>
     * Uses {@code bkt.storage.default-backend}; when that is s3 and the backend cannot be
     * built, falls back to local storage with a warning.
     */
    public Mono<ResolvedBackend> resolveDefault() {
        StorageBackendType type = StorageBackendType.fromValue(properties.getStorage().getDefaultBackend());
        if (type != StorageBackendType.S3) {
            return Mono.just(new ResolvedBackend(StorageBackendType.LOCAL, registry.getLocalBackend()));
        }
        return resolveS3(null)
                .map(backend -> new ResolvedBackend(StorageBackendType.S3, backend))
                .onErrorResume(e -> {
                    log.warn("Default s3 backend unavailable, falling back to local storage: {}", e.getMessage());
                    return Mono.just(new ResolvedBackend(StorageBackendType.LOCAL, registry.getLocalBackend()));
                });
    }

    /**
     * Decrypted S3 configuration, from cache when fresh
     */
    public Mono<ResolvedS3Config> resolveS3Config(String s3ConfigId) {
        String cacheKey = s3ConfigId != null ? s3ConfigId : ConfigCache.DEFAULT_KEY;
        return Mono.defer(() -> cache.get(cacheKey)
                .map(Mono::just)
                .orElseGet(() -> {
                    Mono<S3Configuration> stored = s3ConfigId != null
                            ? s3ConfigStore.findById(s3ConfigId)
                            : s3ConfigStore.findDefault();
                    return stored
                            .map(configuration -> {
                                ResolvedS3Config resolved = decrypt(configuration);
                                cache.put(cacheKey, resolved);
                                return resolved;
                            })
                            .switchIfEmpty(Mono.fromSupplier(this::environmentFallback));
                }));
    }

    private Mono<StorageBackend> resolveS3(String s3ConfigId) {
        return resolveS3Config(s3ConfigId)
                .flatMap(config -> registry.obtain(config.toBackendConfig()))
                .onErrorMap(e -> !(e instanceof GatewayException),
                        e -> new BackendException("S3 storage backend configuration error: " + e.getMessage(), e));
    }

    private ResolvedS3Config decrypt(S3Configuration configuration) {
        return ResolvedS3Config.builder()
                .source(configuration.getId())
                .endpoint(configuration.getEndpoint())
                .region(configuration.getRegion())
                .accessKey(cipher.decrypt(configuration.getAccessKeyId()))
                .secretKey(cipher.decrypt(configuration.getSecretAccessKey()))
                .bucketPrefix(configuration.getBucketPrefix())
                .useSsl(configuration.isUseSsl())
                .forcePathStyle(configuration.isForcePathStyle())
                .build();
    }

    private ResolvedS3Config environmentFallback() {
        GatewayProperties.S3 env = properties.getS3();
        log.debug("No stored S3 configuration applies, using environment settings");
        return ResolvedS3Config.builder()
                .source(ENV_SOURCE)
                .endpoint(env.getEndpoint())
                .region(env.getRegion())
                .accessKey(env.getAccessKey())
                .secretKey(env.getSecretKey())
                .bucketPrefix(env.getBucketPrefix())
                .useSsl(env.isUseSsl())
                .forcePathStyle(env.isForcePathStyle())
                .build();
    }

    /**
     * Backend plus the type the bucket is recorded with
     */
    public record ResolvedBackend(StorageBackendType type, StorageBackend backend) {
    }
}
