package win.ixuni.bkt.server.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.backend.StorageBackend;
import win.ixuni.bkt.core.exception.ObjectAlreadyExistsException;
import win.ixuni.bkt.core.exception.ObjectNotFoundException;
import win.ixuni.bkt.core.exception.PartialFailureException;
import win.ixuni.bkt.core.exception.ValidationException;
import win.ixuni.bkt.core.model.Bucket;
import win.ixuni.bkt.core.model.ObjectInfo;
import win.ixuni.bkt.core.model.StorageBackendType;
import win.ixuni.bkt.core.model.StoredObject;
import win.ixuni.bkt.core.store.ObjectStore;
import win.ixuni.bkt.core.util.KeyLockManager;
import win.ixuni.bkt.core.util.ValidationUtils;
import win.ixuni.bkt.server.config.GatewayConfiguration;
import win.ixuni.bkt.server.config.GatewayProperties;
import win.ixuni.bkt.server.task.BackgroundTaskQueue;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 对象元数据协调器
 * <p>
 * Keeps the metadata store in line with the physical backend for operations that touch both.
 * Moves copy, then delete the source, then rewrite the metadata key; a failed source delete
 * removes the copy once and reports the original failure. Moves hold the per-key locks of
 * source and destination for their whole duration.
 */
@Slf4j
@Service
public class ObjectMetadataCoordinator {

    /**
     * Backend listings stop at this many keys
     */
    static final int LISTING_CAP = 10_000;

    static final int MAX_FOLDER_OBJECTS = 10_000;

    private final ObjectStore objectStore;
    private final KeyLockManager lockManager;
    private final BackgroundTaskQueue reconciliationQueue;
    private final int insertCeiling;

    public ObjectMetadataCoordinator(ObjectStore objectStore, KeyLockManager lockManager,
                                     @Qualifier(GatewayConfiguration.RECONCILIATION_QUEUE) BackgroundTaskQueue reconciliationQueue,
                                     GatewayProperties properties) {
        this.objectStore = objectStore;
        this.lockManager = lockManager;
        this.reconciliationQueue = reconciliationQueue;
        this.insertCeiling = properties.getReconciliation().getInsertCeiling();
    }

    /**
     * {@code s3://bucket/key} for s3 buckets, the key itself for local ones
     */
    public static String storagePath(Bucket bucket, String key) {
        if (bucket.getStorageBackend() == StorageBackendType.S3) {
            return "s3://" + bucket.getName() + "/" + key;
        }
        return key;
    }

    /**
     * Destination of a rename: same folder, new file name
     */
    public static String renameTarget(String sourceKey, String newName) {
        if (newName == null || newName.isEmpty()) {
            throw new ValidationException("new_name is required");
        }
        if (newName.contains("/")) {
            throw ValidationException.invalidKey("new name cannot contain '/'");
        }
        int lastSlash = sourceKey.lastIndexOf('/');
        return lastSlash >= 0 ? sourceKey.substring(0, lastSlash + 1) + newName : newName;
    }

    public Mono<StoredObject> move(Bucket bucket, StorageBackend backend, String sourceKey, String destinationKey) {
        if (sourceKey.equals(destinationKey)) {
            return Mono.error(new ValidationException("Source and destination keys cannot be the same"));
        }
        List<String> lockKeys = List.of(lockKey(bucket, sourceKey), lockKey(bucket, destinationKey));
        return lockManager.withLocks(lockKeys, Mono.defer(() -> objectStore.find(bucket.getId(), sourceKey)
                .switchIfEmpty(Mono.error(() -> new ObjectNotFoundException(bucket.getName(), sourceKey)))
                .flatMap(source -> objectStore.find(bucket.getId(), destinationKey)
                        .flatMap(existing -> Mono.<StoredObject>error(
                                new ObjectAlreadyExistsException(bucket.getName(), destinationKey)))
                        .switchIfEmpty(Mono.defer(() -> relocate(bucket, backend, sourceKey, destinationKey))))));
    }

    public Mono<StoredObject> rename(Bucket bucket, StorageBackend backend, String sourceKey, String newName) {
        return Mono.fromCallable(() -> renameTarget(sourceKey, newName))
                .flatMap(destinationKey -> move(bucket, backend, sourceKey, destinationKey));
    }

    /**
     * Move every object under {@code sourcePrefix}, in key order, stopping at the first failure
     */
    public Mono<FolderMoveResult> moveFolder(Bucket bucket, StorageBackend backend,
                                             String sourcePrefix, String destinationPrefix) {
        String source = ValidationUtils.normalizeFolder(sourcePrefix);
        String destination = ValidationUtils.normalizeFolder(destinationPrefix);
        if (source.isEmpty()) {
            return Mono.error(new ValidationException("source_prefix is required"));
        }
        if (source.equals(destination)) {
            return Mono.error(new ValidationException("Source and destination folders cannot be the same"));
        }
        if (destination.startsWith(source)) {
            return Mono.error(new ValidationException("Cannot move a folder into itself"));
        }

        return objectStore.list(bucket.getId(), source, MAX_FOLDER_OBJECTS)
                .map(StoredObject::getKey)
                .collectList()
                .flatMap(keys -> {
                    if (keys.isEmpty()) {
                        return Mono.error(new ObjectNotFoundException(bucket.getName(), source));
                    }
                    AtomicInteger moved = new AtomicInteger();
                    return Flux.fromIterable(keys)
                            .concatMap(key -> move(bucket, backend, key, destination + key.substring(source.length()))
                                    .doOnSuccess(object -> moved.incrementAndGet()))
                            .then(Mono.fromSupplier(() -> new FolderMoveResult(source, destination, moved.get(), keys.size())))
                            .onErrorMap(e -> moved.get() > 0 || e instanceof PartialFailureException,
                                    e -> new PartialFailureException("Folder move stopped after " + moved.get()
                                            + " of " + keys.size() + " object(s): " + e.getMessage(),
                                            !(e instanceof PartialFailureException partial) || partial.isCompensated(), e));
                })
                .doOnSuccess(result -> log.info("Moved folder {}/{} -> {} ({} objects)",
                        bucket.getName(), source, destination, result.moved()));
    }

    /**
     * Physical delete first, metadata only once it succeeded
     */
    public Mono<Void> delete(Bucket bucket, StorageBackend backend, String key) {
        return backend.deleteObject(bucket.getName(), key)
                .then(objectStore.delete(bucket.getId(), key))
                .then();
    }

    /**
     * Merge one page of metadata with the backend listing of the same prefix.
     * <p>
     * Rows whose key is gone from the backend are dropped; backend keys without a row are
     * added, at most {@code insertCeiling} per call. The merged page is computed first; the
     * store writes are queued to the reconciliation workers afterwards. An empty backend listing
     * changes nothing and the stored page is served as is.
     */
    public List<StoredObject> reconcile(Bucket bucket, List<StoredObject> stored, List<ObjectInfo> actual, int limit) {
        if (actual.isEmpty()) {
            if (!stored.isEmpty()) {
                log.debug("Backend listing of {} is empty, keeping {} stored row(s)", bucket.getName(), stored.size());
            }
            return stored;
        }
        Map<String, ObjectInfo> actualByKey = new HashMap<>();
        String lastActualKey = null;
        for (ObjectInfo info : actual) {
            actualByKey.put(info.getKey(), info);
            if (lastActualKey == null || info.getKey().compareTo(lastActualKey) > 0) {
                lastActualKey = info.getKey();
            }
        }
        boolean actualTruncated = actual.size() >= LISTING_CAP;
        String storedBoundary = stored.size() >= limit && !stored.isEmpty()
                ? stored.get(stored.size() - 1).getKey()
                : null;

        List<StoredObject> merged = new ArrayList<>();
        List<String> stale = new ArrayList<>();
        Set<String> storedKeys = new HashSet<>();
        for (StoredObject object : stored) {
            storedKeys.add(object.getKey());
            if (actualByKey.containsKey(object.getKey())) {
                merged.add(object);
            } else if (actualTruncated && (lastActualKey == null || object.getKey().compareTo(lastActualKey) > 0)) {
                // beyond the backend listing, unknown
                merged.add(object);
            } else {
                stale.add(object.getKey());
            }
        }

        List<StoredObject> missing = new ArrayList<>();
        for (ObjectInfo info : actual) {
            if (storedKeys.contains(info.getKey())) {
                continue;
            }
            if (storedBoundary != null && info.getKey().compareTo(storedBoundary) > 0) {
                continue;
            }
            if (missing.size() >= insertCeiling) {
                break;
            }
            missing.add(StoredObject.builder()
                    .bucketId(bucket.getId())
                    .key(info.getKey())
                    .size(info.getSize())
                    .etag(info.getEtag())
                    .contentType(info.getContentType())
                    .storagePath(storagePath(bucket, info.getKey()))
                    .build());
        }

        merged.addAll(missing);
        merged.sort(Comparator.comparing(StoredObject::getKey));
        List<StoredObject> page = merged.size() > limit ? new ArrayList<>(merged.subList(0, limit)) : merged;

        if (!stale.isEmpty()) {
            reconciliationQueue.submit("drop stale rows of " + bucket.getName(), () -> {
                Long removed = objectStore.deleteKeys(bucket.getId(), stale).block();
                log.warn("Reconciliation removed {} metadata row(s) of {} no longer present in the backend",
                        removed, bucket.getName());
            });
        }
        if (!missing.isEmpty()) {
            reconciliationQueue.submit("insert missing rows of " + bucket.getName(), () -> {
                Flux.fromIterable(missing)
                        .concatMap(objectStore::upsert)
                        .then()
                        .block();
                log.info("Reconciliation added {} metadata row(s) to {}", missing.size(), bucket.getName());
            });
        }
        return page;
    }

    private static String lockKey(Bucket bucket, String key) {
        return bucket.getId() + "/" + key;
    }

    private Mono<StoredObject> relocate(Bucket bucket, StorageBackend backend, String sourceKey, String destinationKey) {
        String name = bucket.getName();
        return backend.copyObject(name, sourceKey, destinationKey)
                .then(backend.deleteObject(name, sourceKey)
                        .onErrorResume(deleteError -> compensate(backend, name, destinationKey)
                                .flatMap(compensated -> Mono.<Void>error(new PartialFailureException(
                                        "Failed to delete source '" + sourceKey + "' after copying it to '"
                                                + destinationKey + "'", compensated, deleteError)))))
                .then(objectStore.rename(bucket.getId(), sourceKey, destinationKey, storagePath(bucket, destinationKey)))
                .switchIfEmpty(Mono.error(() -> new ObjectNotFoundException(name, sourceKey)))
                .doOnSuccess(object -> log.info("Moved {}/{} -> {}", name, sourceKey, destinationKey));
    }

    private Mono<Boolean> compensate(StorageBackend backend, String bucketName, String copiedKey) {
        return backend.deleteObject(bucketName, copiedKey)
                .thenReturn(true)
                .onErrorResume(e -> {
                    log.error("Rollback failed, copy {}/{} left behind: {}", bucketName, copiedKey, e.getMessage());
                    return Mono.just(false);
                });
    }

    /**
     * Outcome of a folder move
     */
    public record FolderMoveResult(String sourcePrefix, String destinationPrefix, int moved, int total) {
    }
}
