package win.ixuni.bkt.server.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.exception.BucketAlreadyExistsException;
import win.ixuni.bkt.core.exception.BucketNotEmptyException;
import win.ixuni.bkt.core.exception.BucketNotFoundException;
import win.ixuni.bkt.core.exception.PolicyNotFoundException;
import win.ixuni.bkt.core.exception.S3ConfigNotFoundException;
import win.ixuni.bkt.core.exception.ValidationException;
import win.ixuni.bkt.core.model.Bucket;
import win.ixuni.bkt.core.model.BucketPolicy;
import win.ixuni.bkt.core.model.StorageBackendType;
import win.ixuni.bkt.core.policy.Identity;
import win.ixuni.bkt.core.policy.PolicyActions;
import win.ixuni.bkt.core.policy.PolicyDocument;
import win.ixuni.bkt.core.policy.PolicyValidator;
import win.ixuni.bkt.core.policy.ResourceArns;
import win.ixuni.bkt.core.store.BucketStore;
import win.ixuni.bkt.core.store.ObjectStore;
import win.ixuni.bkt.core.store.PolicyStore;
import win.ixuni.bkt.core.store.S3ConfigStore;
import win.ixuni.bkt.core.util.ValidationUtils;
import win.ixuni.bkt.server.resolver.ConfigResolver;
import win.ixuni.bkt.server.security.AuthorizationService;

/**
 * Bucket 服务
 * <p>
 * Validation and authorization run before anything touches a backend or the store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BucketService {

    private final BucketStore bucketStore;
    private final ObjectStore objectStore;
    private final PolicyStore policyStore;
    private final S3ConfigStore s3ConfigStore;
    private final ConfigResolver configResolver;
    private final AuthorizationService authorization;
    private final PolicyValidator policyValidator;

    /**
     * Create a bucket record and its physical bucket.
     * <p>
     * When the physical bucket already exists (link-or-create) the record is linked to it.
     *
     * @param storageBackend local, s3, or null for the configured default
     */
    public Mono<Bucket> createBucket(Identity identity, String name, String region, boolean isPublic,
                                     String storageBackend, String s3ConfigId) {
        return Mono.fromCallable(() -> {
                    ValidationUtils.validateBucketName(name);
                    return ValidationUtils.normalizeRegion(region);
                })
                .flatMap(normalizedRegion -> authorization.checkBucket(identity, PolicyActions.CREATE_BUCKET, name)
                        .then(bucketStore.findByName(name)
                                .flatMap(existing -> Mono.<Bucket>error(new BucketAlreadyExistsException(name)))
                                .switchIfEmpty(Mono.defer(() -> checkS3Config(s3ConfigId)
                                        .then(provision(identity, name, normalizedRegion, isPublic,
                                                storageBackend, emptyToNull(s3ConfigId)))))));
    }

    public Flux<Bucket> listBuckets(Identity identity) {
        if (identity.isAnonymous()) {
            return Flux.empty();
        }
        return authorization.isAllowed(identity, PolicyActions.LIST_ALL_MY_BUCKETS, ResourceArns.all(), null)
                .flatMapMany(all -> all ? bucketStore.findAll() : bucketStore.findByOwner(identity.getUserId()));
    }

    public Mono<Bucket> getBucket(Identity identity, String name) {
        return findBucket(name)
                .flatMap(bucket -> authorization.checkBucket(identity, PolicyActions.GET_BUCKET_LOCATION, bucket)
                        .thenReturn(bucket));
    }

    /**
     * HeadBucket: existence for callers allowed to list the bucket
     */
    public Mono<Bucket> headBucket(Identity identity, String name) {
        return findBucket(name)
                .flatMap(bucket -> authorization.checkBucket(identity, PolicyActions.LIST_BUCKET, bucket)
                        .thenReturn(bucket));
    }

    /**
     * Bucket record without authorization, for callers that check themselves
     */
    public Mono<Bucket> findBucket(String name) {
        return bucketStore.findByName(name)
                .switchIfEmpty(Mono.error(() -> new BucketNotFoundException(name)));
    }

    /**
     * Delete an empty bucket: physical bucket first, then the record in one emptiness-checked
     * transaction
     */
    public Mono<Void> deleteBucket(Identity identity, String name) {
        return findBucket(name)
                .flatMap(bucket -> authorization.checkBucket(identity, PolicyActions.DELETE_BUCKET, bucket)
                        .then(objectStore.countByBucket(bucket.getId()))
                        .flatMap(count -> {
                            if (count > 0) {
                                return Mono.error(new BucketNotEmptyException(name));
                            }
                            return configResolver.resolve(bucket)
                                    .flatMap(backend -> backend.deleteBucket(name))
                                    .then(bucketStore.deleteIfEmpty(bucket))
                                    .then(policyStore.deleteBucketPolicy(bucket.getId()))
                                    .then();
                        }))
                .doOnSuccess(v -> log.info("Deleted bucket {}", name));
    }

    public Mono<BucketPolicy> getBucketPolicy(Identity identity, String name) {
        return findBucket(name)
                .flatMap(bucket -> authorization.checkBucket(identity, PolicyActions.GET_BUCKET_POLICY, bucket)
                        .then(policyStore.findBucketPolicy(bucket.getId()))
                        .switchIfEmpty(Mono.error(() -> new PolicyNotFoundException("bucket policy of " + name))));
    }

    /**
     * Replace the bucket policy; the stored document is the validated, re-serialized form
     */
    public Mono<BucketPolicy> putBucketPolicy(Identity identity, String name, String documentJson) {
        return findBucket(name)
                .flatMap(bucket -> authorization.checkBucket(identity, PolicyActions.PUT_BUCKET_POLICY, bucket)
                        .then(Mono.fromCallable(() -> {
                            PolicyDocument document = policyValidator.parse(documentJson);
                            return policyValidator.toJson(document);
                        }))
                        .flatMap(canonical -> policyStore.putBucketPolicy(BucketPolicy.builder()
                                .bucketId(bucket.getId())
                                .document(canonical)
                                .build())));
    }

    public Mono<Void> deleteBucketPolicy(Identity identity, String name) {
        return findBucket(name)
                .flatMap(bucket -> authorization.checkBucket(identity, PolicyActions.PUT_BUCKET_POLICY, bucket)
                        .then(policyStore.deleteBucketPolicy(bucket.getId())))
                .then();
    }

    private Mono<Bucket> provision(Identity identity, String name, String region, boolean isPublic,
                                   String storageBackend, String s3ConfigId) {
        Mono<ConfigResolver.ResolvedBackend> resolved;
        if (storageBackend == null || storageBackend.isBlank()) {
            resolved = configResolver.resolveDefault();
        } else {
            StorageBackendType type;
            try {
                type = StorageBackendType.fromValue(storageBackend);
            } catch (IllegalArgumentException e) {
                return Mono.error(new ValidationException(
                        "storage_backend must be 'local' or 's3'"));
            }
            resolved = configResolver.resolve(type, s3ConfigId)
                    .map(backend -> new ConfigResolver.ResolvedBackend(type, backend));
        }

        return resolved.flatMap(target -> target.backend().createBucket(name, region)
                .then(bucketStore.insert(Bucket.builder()
                        .name(name)
                        .ownerId(identity.getUserId())
                        .isPublic(isPublic)
                        .region(region)
                        .storageBackend(target.type())
                        .s3ConfigId(target.type() == StorageBackendType.S3 ? s3ConfigId : null)
                        .build())))
                .doOnSuccess(bucket -> log.info("Created bucket {} on {} backend (region {})",
                        name, bucket.getStorageBackend().getValue(), region));
    }

    private Mono<Void> checkS3Config(String s3ConfigId) {
        if (s3ConfigId == null || s3ConfigId.isEmpty()) {
            return Mono.empty();
        }
        return s3ConfigStore.findById(s3ConfigId)
                .switchIfEmpty(Mono.error(() -> new S3ConfigNotFoundException(s3ConfigId)))
                .then();
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
