package win.ixuni.bkt.server.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.exception.S3ConfigNotFoundException;
import win.ixuni.bkt.core.exception.ValidationException;
import win.ixuni.bkt.core.model.S3Configuration;
import win.ixuni.bkt.core.policy.Identity;
import win.ixuni.bkt.core.store.S3ConfigStore;
import win.ixuni.bkt.core.util.ValidationUtils;
import win.ixuni.bkt.server.registry.BackendRegistry;
import win.ixuni.bkt.server.resolver.ConfigCache;
import win.ixuni.bkt.server.resolver.ResolvedS3Config;
import win.ixuni.bkt.server.security.AuthorizationService;
import win.ixuni.bkt.server.security.CredentialCipher;

/**
 * S3 配置管理服务
 * <p>
 * Admin only. Credentials are encrypted before they reach the store and never leave it in
 * plaintext. Every write empties the resolver cache; updates and deletes also close the pooled
 * backends built from the old settings.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class S3ConfigService {

    private final S3ConfigStore s3ConfigStore;
    private final CredentialCipher cipher;
    private final ConfigCache configCache;
    private final BackendRegistry backendRegistry;
    private final AuthorizationService authorization;

    public Flux<S3Configuration> list(Identity identity) {
        return authorization.requireAdmin(identity)
                .thenMany(s3ConfigStore.findAll());
    }

    public Mono<S3Configuration> get(Identity identity, String id) {
        return authorization.requireAdmin(identity)
                .then(find(id));
    }

    public Mono<S3Configuration> create(Identity identity, Changes changes) {
        return authorization.requireAdmin(identity)
                .then(Mono.fromCallable(() -> {
                    if (isBlank(changes.name()) || isBlank(changes.endpoint())) {
                        throw new ValidationException("name and endpoint are required");
                    }
                    if (isBlank(changes.accessKeyId()) || isBlank(changes.secretAccessKey())) {
                        throw new ValidationException("access_key_id and secret_access_key are required");
                    }
                    return S3Configuration.builder()
                            .name(changes.name().trim())
                            .endpoint(changes.endpoint().trim())
                            .region(ValidationUtils.normalizeRegion(changes.region()))
                            .accessKeyId(cipher.encrypt(changes.accessKeyId()))
                            .secretAccessKey(cipher.encrypt(changes.secretAccessKey()))
                            .bucketPrefix(changes.bucketPrefix() == null ? "" : changes.bucketPrefix())
                            .useSsl(changes.useSsl() == null || changes.useSsl())
                            .forcePathStyle(Boolean.TRUE.equals(changes.forcePathStyle()))
                            .isDefault(Boolean.TRUE.equals(changes.isDefault()))
                            .build();
                }))
                .flatMap(s3ConfigStore::insert)
                .doOnSuccess(created -> {
                    configCache.invalidateAll();
                    log.info("Created S3 configuration {} ({})", created.getName(), created.getId());
                });
    }

    /**
     * Null fields keep their current value; a missing key keeps the stored ciphertext
     */
    public Mono<S3Configuration> update(Identity identity, String id, Changes changes) {
        return authorization.requireAdmin(identity)
                .then(find(id))
                .flatMap(existing -> Mono.fromCallable(() -> {
                    S3Configuration.S3ConfigurationBuilder updated = existing.toBuilder();
                    if (changes.name() != null) {
                        if (changes.name().isBlank()) {
                            throw new ValidationException("name cannot be empty");
                        }
                        updated.name(changes.name().trim());
                    }
                    if (changes.endpoint() != null) {
                        updated.endpoint(changes.endpoint().trim());
                    }
                    if (changes.region() != null) {
                        updated.region(ValidationUtils.normalizeRegion(changes.region()));
                    }
                    if (!isBlank(changes.accessKeyId())) {
                        updated.accessKeyId(cipher.encrypt(changes.accessKeyId()));
                    }
                    if (!isBlank(changes.secretAccessKey())) {
                        updated.secretAccessKey(cipher.encrypt(changes.secretAccessKey()));
                    }
                    if (changes.bucketPrefix() != null) {
                        updated.bucketPrefix(changes.bucketPrefix());
                    }
                    if (changes.useSsl() != null) {
                        updated.useSsl(changes.useSsl());
                    }
                    if (changes.forcePathStyle() != null) {
                        updated.forcePathStyle(changes.forcePathStyle());
                    }
                    if (changes.isDefault() != null) {
                        updated.isDefault(changes.isDefault());
                    }
                    return updated.build();
                }))
                .flatMap(s3ConfigStore::update)
                .doOnSuccess(saved -> {
                    configCache.invalidateAll();
                    log.info("Updated S3 configuration {} ({})", saved.getName(), saved.getId());
                })
                .flatMap(saved -> backendRegistry.evict(ResolvedS3Config.backendName(saved.getId()))
                        .thenReturn(saved));
    }

    public Mono<Void> delete(Identity identity, String id) {
        return authorization.requireAdmin(identity)
                .then(find(id))
                .flatMap(existing -> s3ConfigStore.delete(existing.getId()))
                .doOnSuccess(v -> {
                    configCache.invalidateAll();
                    log.info("Deleted S3 configuration {}", id);
                })
                .then(Mono.defer(() -> backendRegistry.evict(ResolvedS3Config.backendName(id))))
                .then();
    }

    private Mono<S3Configuration> find(String id) {
        return s3ConfigStore.findById(id)
                .switchIfEmpty(Mono.error(() -> new S3ConfigNotFoundException(id)));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Requested field values, credentials in plaintext
     */
    public record Changes(String name, String endpoint, String region, String accessKeyId,
                          String secretAccessKey, String bucketPrefix, Boolean useSsl,
                          Boolean forcePathStyle, Boolean isDefault) {
    }
}
