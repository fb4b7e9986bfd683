package win.ixuni.bkt.server.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.exception.AccessDeniedException;
import win.ixuni.bkt.core.exception.ObjectNotFoundException;
import win.ixuni.bkt.core.model.Bucket;
import win.ixuni.bkt.core.model.ObjectContent;
import win.ixuni.bkt.core.model.ObjectInfo;
import win.ixuni.bkt.core.model.StorageBackendType;
import win.ixuni.bkt.core.model.StoredObject;
import win.ixuni.bkt.core.policy.Identity;
import win.ixuni.bkt.core.policy.PolicyActions;
import win.ixuni.bkt.core.policy.ResourceArns;
import win.ixuni.bkt.core.store.ObjectStore;
import win.ixuni.bkt.core.util.ValidationUtils;
import win.ixuni.bkt.server.resolver.ConfigResolver;
import win.ixuni.bkt.server.security.AuthorizationService;

import java.nio.ByteBuffer;
import java.time.Clock;
import java.util.List;

/**
 * 对象服务
 * <p>
 * Entry point for object operations of both HTTP surfaces.
 */
@Slf4j
@Service
public class ObjectService {

    public static final int DEFAULT_MAX_KEYS = 1000;

    public static final String DIRECTORY_CONTENT_TYPE = "application/x-directory";

    private final BucketService bucketService;
    private final ObjectStore objectStore;
    private final ConfigResolver configResolver;
    private final AuthorizationService authorization;
    private final ObjectMetadataCoordinator coordinator;
    private final UploadPipeline uploadPipeline;
    private final Clock clock;

    public ObjectService(BucketService bucketService, ObjectStore objectStore, ConfigResolver configResolver,
                         AuthorizationService authorization, ObjectMetadataCoordinator coordinator,
                         UploadPipeline uploadPipeline, Clock clock) {
        this.bucketService = bucketService;
        this.objectStore = objectStore;
        this.configResolver = configResolver;
        this.authorization = authorization;
        this.coordinator = coordinator;
        this.uploadPipeline = uploadPipeline;
        this.clock = clock;
    }

    /**
     * 1..1000, anything else (missing, unparsable, out of range) becomes 1000
     */
    public static int normalizeMaxKeys(String maxKeys) {
        if (maxKeys == null || maxKeys.isBlank()) {
            return DEFAULT_MAX_KEYS;
        }
        try {
            int value = Integer.parseInt(maxKeys.trim());
            return value >= 1 && value <= DEFAULT_MAX_KEYS ? value : DEFAULT_MAX_KEYS;
        } catch (NumberFormatException e) {
            return DEFAULT_MAX_KEYS;
        }
    }

    /**
     * One page of objects ordered by key. For s3 buckets the page is reconciled with the
     * backend listing first.
     */
    public Mono<List<StoredObject>> listObjects(Identity identity, String bucketName, String prefix, int maxKeys) {
        String normalizedPrefix = prefix == null ? "" : prefix;
        return bucketService.findBucket(bucketName)
                .flatMap(bucket -> authorization.checkBucket(identity, PolicyActions.LIST_BUCKET, bucket)
                        .then(objectStore.list(bucket.getId(), normalizedPrefix, maxKeys).collectList())
                        .flatMap(stored -> bucket.getStorageBackend() == StorageBackendType.S3
                                ? reconciled(bucket, normalizedPrefix, stored, maxKeys)
                                : Mono.just(stored)));
    }

    public Mono<StoredObject> upload(Identity identity, String bucketName, String key,
                                     Flux<ByteBuffer> content, long size) {
        return Mono.fromRunnable(() -> ValidationUtils.validateObjectKey(key))
                .then(bucketService.findBucket(bucketName))
                .flatMap(bucket -> authorization.checkObject(identity, PolicyActions.PUT_OBJECT, bucket, key)
                        .then(configResolver.resolve(bucket))
                        .flatMap(backend -> uploadPipeline.upload(bucket, backend, key, content, size)));
    }

    public Mono<ObjectContent> getObject(Identity identity, String bucketName, String key) {
        return bucketService.findBucket(bucketName)
                .flatMap(bucket -> authorization.checkObject(identity, PolicyActions.GET_OBJECT, bucket, key)
                        .then(configResolver.resolve(bucket))
                        .flatMap(backend -> backend.getObject(bucket.getName(), key)));
    }

    /**
     * Object metadata. Keys ending in {@code /} that have objects under them answer as a
     * directory marker.
     */
    public Mono<ObjectInfo> headObject(Identity identity, String bucketName, String key) {
        return bucketService.findBucket(bucketName)
                .flatMap(bucket -> checkHead(identity, bucket, key)
                        .then(objectStore.find(bucket.getId(), key))
                        .map(ObjectService::toInfo)
                        .switchIfEmpty(Mono.defer(() -> key.endsWith("/")
                                ? directory(bucket, key)
                                : configResolver.resolve(bucket)
                                        .flatMap(backend -> backend.getObjectInfo(bucket.getName(), key)))));
    }

    public Mono<Void> deleteObject(Identity identity, String bucketName, String key) {
        return bucketService.findBucket(bucketName)
                .flatMap(bucket -> authorization.checkObject(identity, PolicyActions.DELETE_OBJECT, bucket, key)
                        .then(configResolver.resolve(bucket))
                        .flatMap(backend -> coordinator.delete(bucket, backend, key)))
                .doOnSuccess(v -> log.info("Deleted {}/{}", bucketName, key));
    }

    public Mono<StoredObject> moveObject(Identity identity, String bucketName, String sourceKey,
                                         String destinationKey) {
        return Mono.fromRunnable(() -> {
                    ValidationUtils.validateObjectKey(sourceKey);
                    ValidationUtils.validateObjectKey(destinationKey);
                })
                .then(bucketService.findBucket(bucketName))
                .flatMap(bucket -> checkMove(identity, bucket, sourceKey, destinationKey)
                        .then(configResolver.resolve(bucket))
                        .flatMap(backend -> coordinator.move(bucket, backend, sourceKey, destinationKey)));
    }

    public Mono<StoredObject> renameObject(Identity identity, String bucketName, String key, String newName) {
        return Mono.fromCallable(() -> {
                    ValidationUtils.validateObjectKey(key);
                    String destination = ObjectMetadataCoordinator.renameTarget(key, newName);
                    ValidationUtils.validateObjectKey(destination);
                    return destination;
                })
                .flatMap(destination -> moveObject(identity, bucketName, key, destination));
    }

    public Mono<ObjectMetadataCoordinator.FolderMoveResult> moveFolder(Identity identity, String bucketName,
                                                                      String sourcePrefix, String destinationPrefix) {
        String source = ValidationUtils.normalizeFolder(sourcePrefix);
        String destination = ValidationUtils.normalizeFolder(destinationPrefix);
        return bucketService.findBucket(bucketName)
                .flatMap(bucket -> checkMove(identity, bucket, source + "*", destination + "*")
                        .then(configResolver.resolve(bucket))
                        .flatMap(backend -> coordinator.moveFolder(bucket, backend, source, destination)));
    }

    private Mono<List<StoredObject>> reconciled(Bucket bucket, String prefix, List<StoredObject> stored, int limit) {
        return configResolver.resolve(bucket)
                .flatMap(backend -> backend.listObjects(bucket.getName(), prefix))
                .map(actual -> coordinator.reconcile(bucket, stored, actual, limit))
                .onErrorResume(e -> {
                    log.warn("Backend listing of {} failed, serving stored metadata only: {}",
                            bucket.getName(), e.getMessage());
                    return Mono.just(stored);
                });
    }

    /**
     * HeadObject is allowed by either s3:GetObject or s3:HeadObject
     */
    private Mono<Void> checkHead(Identity identity, Bucket bucket, String key) {
        String resource = ResourceArns.object(bucket.getName(), key);
        return authorization.isAllowed(identity, PolicyActions.GET_OBJECT, resource, bucket)
                .flatMap(allowed -> allowed
                        ? Mono.just(true)
                        : authorization.isAllowed(identity, PolicyActions.HEAD_OBJECT, resource, bucket))
                .flatMap(allowed -> allowed
                        ? Mono.<Void>empty()
                        : Mono.error(AccessDeniedException.forAction(PolicyActions.GET_OBJECT, resource)));
    }

    private Mono<Void> checkMove(Identity identity, Bucket bucket, String source, String destination) {
        return authorization.checkObject(identity, PolicyActions.GET_OBJECT, bucket, source)
                .then(authorization.checkObject(identity, PolicyActions.DELETE_OBJECT, bucket, source))
                .then(authorization.checkObject(identity, PolicyActions.PUT_OBJECT, bucket, destination));
    }

    private Mono<ObjectInfo> directory(Bucket bucket, String key) {
        Mono<Boolean> hasChildren = objectStore.list(bucket.getId(), key, 1).hasElements()
                .flatMap(found -> found
                        ? Mono.just(true)
                        : configResolver.resolve(bucket)
                                .flatMap(backend -> backend.listObjects(bucket.getName(), key))
                                .map(list -> !list.isEmpty())
                                .onErrorReturn(false));
        return hasChildren.flatMap(found -> found
                ? Mono.just(new ObjectInfo(key, 0, "", DIRECTORY_CONTENT_TYPE, clock.instant()))
                : Mono.error(new ObjectNotFoundException(bucket.getName(), key)));
    }

    private static ObjectInfo toInfo(StoredObject object) {
        return new ObjectInfo(object.getKey(), object.getSize(), object.getEtag(), object.getContentType(),
                object.getUpdatedAt() != null ? object.getUpdatedAt() : object.getCreatedAt());
    }
}
