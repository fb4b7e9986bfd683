package win.ixuni.bkt.server.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.bkt.core.backend.StorageBackend;
import win.ixuni.bkt.core.exception.EntityTooLargeException;
import win.ixuni.bkt.core.exception.GatewayException;
import win.ixuni.bkt.core.exception.UploadNotFoundException;
import win.ixuni.bkt.core.exception.ValidationException;
import win.ixuni.bkt.core.model.Bucket;
import win.ixuni.bkt.core.model.StoredObject;
import win.ixuni.bkt.core.model.Upload;
import win.ixuni.bkt.core.model.UploadStatus;
import win.ixuni.bkt.core.policy.Identity;
import win.ixuni.bkt.core.policy.PolicyActions;
import win.ixuni.bkt.core.store.ObjectStore;
import win.ixuni.bkt.core.store.UploadStore;
import win.ixuni.bkt.core.upload.ContentPolicy;
import win.ixuni.bkt.core.upload.ContentSniffer;
import win.ixuni.bkt.core.upload.ProgressTrackingChannel;
import win.ixuni.bkt.core.util.ChannelFluxes;
import win.ixuni.bkt.core.util.Digests;
import win.ixuni.bkt.core.util.ValidationUtils;
import win.ixuni.bkt.server.config.GatewayConfiguration;
import win.ixuni.bkt.server.config.GatewayProperties;
import win.ixuni.bkt.server.resolver.ConfigResolver;
import win.ixuni.bkt.server.security.AuthorizationService;
import win.ixuni.bkt.server.task.BackgroundTaskQueue;

import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 异步上传服务
 * <p>
 * The request body is staged to {@code <staging>/bkt-uploads/<uploadId>/<filename>} and the
 * request answers with a pending upload record. A worker of the upload queue then streams the
 * staged file to the backend, persisting progress while it reads, and records the outcome.
 * The staged file is removed whatever the outcome.
 */
@Slf4j
@Service
public class AsyncUploadService {

    public static final int DEFAULT_LIST_LIMIT = 50;

    public static final int MAX_LIST_LIMIT = 100;

    private final UploadStore uploadStore;
    private final ObjectStore objectStore;
    private final BucketService bucketService;
    private final ConfigResolver configResolver;
    private final AuthorizationService authorization;
    private final ContentPolicy contentPolicy;
    private final BackgroundTaskQueue uploadQueue;
    private final Path stagingRoot;
    private final Duration progressInterval;
    private final Clock clock;

    @Autowired
    public AsyncUploadService(UploadStore uploadStore, ObjectStore objectStore, BucketService bucketService,
                              ConfigResolver configResolver, AuthorizationService authorization,
                              ContentPolicy contentPolicy,
                              @Qualifier(GatewayConfiguration.UPLOAD_QUEUE) BackgroundTaskQueue uploadQueue,
                              GatewayProperties properties, Clock clock) {
        this(uploadStore, objectStore, bucketService, configResolver, authorization, contentPolicy, uploadQueue,
                Paths.get(properties.getStorage().getUploadTempDir(), "bkt-uploads"),
                properties.getUploads().getProgressInterval(), clock);
    }

    public AsyncUploadService(UploadStore uploadStore, ObjectStore objectStore, BucketService bucketService,
                              ConfigResolver configResolver, AuthorizationService authorization,
                              ContentPolicy contentPolicy, BackgroundTaskQueue uploadQueue,
                              Path stagingRoot, Duration progressInterval, Clock clock) {
        this.uploadStore = uploadStore;
        this.objectStore = objectStore;
        this.bucketService = bucketService;
        this.configResolver = configResolver;
        this.authorization = authorization;
        this.contentPolicy = contentPolicy;
        this.uploadQueue = uploadQueue;
        this.stagingRoot = stagingRoot;
        this.progressInterval = progressInterval;
        this.clock = clock;
    }

    /**
     * Stage the body and queue the upload.
     *
     * @param declaredSize Content-Length of the body; an unknown length is refused with 411
     * @return the pending upload record
     */
    public Mono<Upload> accept(Identity identity, String bucketName, String key, String filename,
                               Flux<DataBuffer> body, long declaredSize) {
        return Mono.fromRunnable(() -> {
                    ValidationUtils.validateObjectKey(key);
                    if (declaredSize < 0) {
                        throw new GatewayException("MissingContentLength", "Content-Length is required", 411);
                    }
                    contentPolicy.checkSize(declaredSize);
                })
                .then(bucketService.findBucket(bucketName))
                .flatMap(bucket -> authorization.checkObject(identity, PolicyActions.PUT_OBJECT, bucket, key)
                        .then(Mono.defer(() -> {
                            String uploadId = UUID.randomUUID().toString();
                            Path staged = stagingRoot.resolve(uploadId).resolve(sanitizeFilename(filename, key));
                            return stage(body, staged)
                                    .then(Mono.fromCallable(() -> inspect(staged, declaredSize))
                                            .subscribeOn(Schedulers.boundedElastic()))
                                    .flatMap(inspected -> uploadStore.insert(Upload.builder()
                                            .id(uploadId)
                                            .userId(identity.getUserId())
                                            .bucketName(bucket.getName())
                                            .objectKey(key)
                                            .filename(staged.getFileName().toString())
                                            .contentType(inspected.contentType())
                                            .totalSize(inspected.size())
                                            .status(UploadStatus.PENDING)
                                            .build()))
                                    .flatMap(upload -> enqueue(upload, bucket, staged))
                                    .onErrorResume(e -> Mono.fromRunnable(() -> cleanup(staged))
                                            .subscribeOn(Schedulers.boundedElastic())
                                            .then(Mono.error(e)));
                        })));
    }

    public Mono<Upload> getStatus(Identity identity, String uploadId) {
        Mono<Upload> upload = identity.isAdmin()
                ? uploadStore.findById(uploadId)
                : uploadStore.findByIdAndUser(uploadId, identity.getUserId());
        return upload.switchIfEmpty(Mono.error(() -> new UploadNotFoundException(uploadId)));
    }

    /**
     * The caller's uploads, newest first
     *
     * @param status null for every status
     * @param limit  non-positive for the default, capped at {@value #MAX_LIST_LIMIT}
     */
    public Flux<Upload> listUploads(Identity identity, UploadStatus status, int limit) {
        if (identity.isAnonymous()) {
            return Flux.empty();
        }
        int effective = limit <= 0 ? DEFAULT_LIST_LIMIT : Math.min(limit, MAX_LIST_LIMIT);
        return uploadStore.findByUser(identity.getUserId(), status, effective);
    }

    /**
     * Worker body: pending → processing → completed | failed. Runs on an upload queue thread.
     */
    void process(Upload upload, Bucket bucket, Path staged) {
        String uploadId = upload.getId();
        try {
            uploadStore.update(upload.toBuilder()
                    .status(UploadStatus.PROCESSING)
                    .uploadedSize(0)
                    .build()).block();

            String contentType = sniff(staged);
            contentPolicy.checkContentType(contentType);

            StorageBackend backend = configResolver.resolve(bucket).block();
            long total = Files.size(staged);
            try (FileChannel file = FileChannel.open(staged, StandardOpenOption.READ);
                 ProgressTrackingChannel channel = new ProgressTrackingChannel(file,
                         bytes -> uploadStore.updateProgress(uploadId, bytes)
                                 .subscribe(null, e -> log.warn("Progress update of upload {} failed: {}",
                                         uploadId, e.getMessage())),
                         progressInterval, clock)) {
                backend.putObject(bucket.getName(), upload.getObjectKey(),
                        ChannelFluxes.readFromStart(channel, ChannelFluxes.DEFAULT_BUFFER_SIZE),
                        total, contentType).block();
            }
            uploadStore.updateProgress(uploadId, total).block();

            StoredObject stored = objectStore.upsert(StoredObject.builder()
                    .bucketId(bucket.getId())
                    .key(upload.getObjectKey())
                    .size(total)
                    .contentType(contentType)
                    .etag(hash(staged, uploadId, false))
                    .sha256(hash(staged, uploadId, true))
                    .storagePath(ObjectMetadataCoordinator.storagePath(bucket, upload.getObjectKey()))
                    .build()).block();

            Upload current = uploadStore.findById(uploadId).blockOptional().orElse(upload);
            uploadStore.update(current.toBuilder()
                    .status(UploadStatus.COMPLETED)
                    .uploadedSize(total)
                    .contentType(contentType)
                    .objectId(stored != null ? stored.getId() : null)
                    .completedAt(clock.instant())
                    .build()).block();
            log.info("Upload {} completed: {}/{} ({} bytes)", uploadId, bucket.getName(),
                    upload.getObjectKey(), total);
        } catch (Exception e) {
            log.error("Upload {} of {}/{} failed: {}", uploadId, bucket.getName(), upload.getObjectKey(),
                    e.getMessage(), e);
            markFailed(upload, e.getMessage());
        } finally {
            cleanup(staged);
        }
    }

    private Mono<Upload> enqueue(Upload upload, Bucket bucket, Path staged) {
        boolean queued = uploadQueue.submit("upload " + upload.getId(), () -> process(upload, bucket, staged));
        if (queued) {
            log.info("Accepted upload {} for {}/{} ({} bytes)", upload.getId(), bucket.getName(),
                    upload.getObjectKey(), upload.getTotalSize());
            return Mono.just(upload);
        }
        return Mono.fromRunnable(() -> markFailed(upload, "upload queue is full"))
                .subscribeOn(Schedulers.boundedElastic())
                .then(Mono.error(new GatewayException("SlowDown",
                        "Too many uploads in progress, retry later", 503)));
    }

    /**
     * Write the body to the staging file, failing as soon as it grows past the maximum size
     */
    private Mono<Void> stage(Flux<DataBuffer> body, Path staged) {
        long maxSize = contentPolicy.getMaxSize();
        AtomicLong received = new AtomicLong();
        Flux<DataBuffer> bounded = body.<DataBuffer>handle((buffer, sink) -> {
            long total = received.addAndGet(buffer.readableByteCount());
            if (total > maxSize) {
                DataBufferUtils.release(buffer);
                sink.error(new EntityTooLargeException(total, maxSize));
            } else {
                sink.next(buffer);
            }
        });
        return Mono.fromCallable(() -> Files.createDirectories(staged.getParent()))
                .subscribeOn(Schedulers.boundedElastic())
                .then(DataBufferUtils.write(bounded, staged,
                        StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE));
    }

    private StagedFile inspect(Path staged, long declaredSize) throws IOException {
        long size = Files.size(staged);
        if (size != declaredSize) {
            throw new ValidationException("IncompleteBody",
                    "Received " + size + " bytes, expected " + declaredSize);
        }
        contentPolicy.checkSize(size);
        String contentType = sniff(staged);
        contentPolicy.checkContentType(contentType);
        return new StagedFile(size, contentType);
    }

    private static String sniff(Path staged) throws IOException {
        try (InputStream in = Files.newInputStream(staged)) {
            byte[] head = in.readNBytes(ContentSniffer.SNIFF_LENGTH);
            return ContentSniffer.detect(head);
        }
    }

    private static String hash(Path staged, String uploadId, boolean sha256) {
        try {
            return sha256 ? Digests.sha256Hex(staged) : Digests.md5Hex(staged);
        } catch (IOException e) {
            log.warn("Hashing upload {} failed, storing it without {}: {}", uploadId,
                    sha256 ? "sha256" : "md5", e.getMessage());
            return "";
        }
    }

    private void markFailed(Upload upload, String message) {
        try {
            Upload current = uploadStore.findById(upload.getId()).blockOptional().orElse(upload);
            uploadStore.update(current.toBuilder()
                    .status(UploadStatus.FAILED)
                    .errorMessage(message)
                    .completedAt(clock.instant())
                    .build()).block();
        } catch (RuntimeException e) {
            log.error("Could not record failure of upload {}: {}", upload.getId(), e.getMessage());
        }
    }

    private static void cleanup(Path staged) {
        try {
            Files.deleteIfExists(staged);
            Path dir = staged.getParent();
            if (dir != null) {
                Files.deleteIfExists(dir);
            }
        } catch (IOException e) {
            log.warn("Failed to remove staged file {}: {}", staged, e.getMessage());
        }
    }

    /**
     * Last path segment of the client's file name, or of the key when none was given
     */
    static String sanitizeFilename(String filename, String key) {
        String candidate = filename == null || filename.isBlank() ? key : filename;
        candidate = candidate.replace('\\', '/');
        int slash = candidate.lastIndexOf('/');
        if (slash >= 0) {
            candidate = candidate.substring(slash + 1);
        }
        candidate = candidate.replaceAll("[\\x00-\\x1f]", "").trim();
        if (candidate.isEmpty() || candidate.equals(".") || candidate.equals("..")) {
            return "upload.bin";
        }
        return candidate;
    }

    private record StagedFile(long size, String contentType) {
    }
}
