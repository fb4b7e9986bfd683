package win.ixuni.bkt.server.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import win.ixuni.bkt.core.backend.StorageBackend;
import win.ixuni.bkt.core.exception.UploadTimeoutException;
import win.ixuni.bkt.core.model.Bucket;
import win.ixuni.bkt.core.model.ObjectInfo;
import win.ixuni.bkt.core.model.StoredObject;
import win.ixuni.bkt.core.store.ObjectStore;
import win.ixuni.bkt.core.upload.ContentPolicy;
import win.ixuni.bkt.core.upload.ContentSniffer;
import win.ixuni.bkt.server.config.GatewayProperties;

import java.nio.ByteBuffer;
import java.time.Duration;

/**
 * 同步上传流水线
 * <p>
 * Size check, then content sniffing of the first 512 bytes (the client's Content-Type is
 * ignored), then the allow-list, all before a single byte reaches the backend. The write runs
 * detached from the caller: the caller waits at most {@code syncTimeout} and gets a 408 after
 * that, while the write goes on and its outcome only shows in the stored metadata.
 */
@Slf4j
@Service
public class UploadPipeline {

    private final ObjectStore objectStore;
    private final ContentPolicy contentPolicy;
    private final Duration syncTimeout;

    @Autowired
    public UploadPipeline(ObjectStore objectStore, ContentPolicy contentPolicy, GatewayProperties properties) {
        this(objectStore, contentPolicy, properties.getStorage().getSyncTimeout());
    }

    public UploadPipeline(ObjectStore objectStore, ContentPolicy contentPolicy, Duration syncTimeout) {
        this.objectStore = objectStore;
        this.contentPolicy = contentPolicy;
        this.syncTimeout = syncTimeout;
    }

    public Mono<StoredObject> upload(Bucket bucket, StorageBackend backend, String key,
                                     Flux<ByteBuffer> content, long size) {
        return Mono.fromRunnable(() -> contentPolicy.checkSize(size))
                .then(Mono.defer(() -> detach(bucket, key, ContentSniffer.sniff(content,
                        (contentType, replay) -> Mono.fromRunnable(() -> contentPolicy.checkContentType(contentType))
                                .then(store(bucket, backend, key, replay, size, contentType))))));
    }

    /**
     * Write, read back the backend's view of the object, upsert the metadata. A failed upsert
     * removes the physical object again.
     */
    Mono<StoredObject> store(Bucket bucket, StorageBackend backend, String key,
                             Flux<ByteBuffer> content, long size, String contentType) {
        String name = bucket.getName();
        return backend.putObject(name, key, content, size, contentType)
                .then(Mono.defer(() -> backend.getObjectInfo(name, key)))
                .flatMap(info -> objectStore.upsert(toStoredObject(bucket, key, info, contentType))
                        .onErrorResume(e -> {
                            log.error("Metadata upsert failed for {}/{}, removing the stored object", name, key, e);
                            return backend.deleteObject(name, key)
                                    .onErrorResume(cleanup -> {
                                        log.warn("Cleanup of {}/{} failed: {}", name, key, cleanup.getMessage());
                                        return Mono.empty();
                                    })
                                    .then(Mono.error(e));
                        }));
    }

    private Mono<StoredObject> detach(Bucket bucket, String key, Mono<StoredObject> work) {
        Sinks.One<StoredObject> outcome = Sinks.one();
        work.doOnSuccess(object -> log.info("Stored {}/{} ({} bytes, etag {})",
                        bucket.getName(), key, object.getSize(), object.getEtag()))
                .doOnError(e -> log.debug("Upload of {}/{} failed: {}", bucket.getName(), key, e.getMessage()))
                .subscribe(outcome::tryEmitValue, outcome::tryEmitError);
        return outcome.asMono()
                .timeout(syncTimeout, Mono.error(() -> {
                    log.warn("Upload of {}/{} still running after {}, answering the caller with a timeout",
                            bucket.getName(), key, syncTimeout);
                    return new UploadTimeoutException(bucket.getName(), key, syncTimeout);
                }));
    }

    private static StoredObject toStoredObject(Bucket bucket, String key, ObjectInfo info, String sniffedType) {
        return StoredObject.builder()
                .bucketId(bucket.getId())
                .key(key)
                .size(info.getSize())
                .etag(info.getEtag())
                .contentType(info.getContentType() != null ? info.getContentType() : sniffedType)
                .storagePath(ObjectMetadataCoordinator.storagePath(bucket, key))
                .build();
    }
}
