package win.ixuni.bkt.backend.local.handler.object;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.bkt.backend.local.context.LocalBackendContext;
import win.ixuni.bkt.backend.local.handler.LocalFileUtils;
import win.ixuni.bkt.backend.local.handler.LocalSidecar;
import win.ixuni.bkt.core.exception.BucketNotFoundException;
import win.ixuni.bkt.core.exception.ValidationException;
import win.ixuni.bkt.core.operation.BackendContext;
import win.ixuni.bkt.core.operation.OperationHandler;
import win.ixuni.bkt.core.operation.object.PutObjectOperation;
import win.ixuni.bkt.core.util.Digests;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 本地文件系统上传对象处理器
 * <p>
 * 流式写入临时文件，完成后原子移动到目标位置；读者永远看不到写了一半的对象。
 */
@Slf4j
public class LocalPutObjectHandler implements OperationHandler<PutObjectOperation, Void> {

    @Override
    public Mono<Void> handle(PutObjectOperation operation, BackendContext context) {
        LocalBackendContext ctx = (LocalBackendContext) context;
        String bucketName = operation.getBucketName();
        String key = operation.getKey();

        return Mono.fromCallable(() -> {
            if (key.endsWith("/")) {
                throw ValidationException.invalidKey("local backend cannot store directory keys: " + key);
            }
            if (!Files.isDirectory(ctx.getBucketPath(bucketName))) {
                throw new BucketNotFoundException(bucketName);
            }
            // resolves (and rejects) the key before anything is written
            ctx.getObjectPath(bucketName, key);
            Files.createDirectories(ctx.getTmpRoot());
            return ctx.getTmpRoot().resolve(UUID.randomUUID() + ".part");
        }).subscribeOn(Schedulers.boundedElastic()).flatMap(tmp -> writeTemp(operation, tmp)
                .flatMap(written -> Mono.fromCallable(() -> {
                    commit(ctx, operation, tmp, written);
                    return Boolean.TRUE;
                }).subscribeOn(Schedulers.boundedElastic()))
                .doOnError(e -> deleteQuietly(tmp))
                .doOnCancel(() -> deleteQuietly(tmp))
                .then());
    }

    private Mono<Written> writeTemp(PutObjectOperation operation, Path tmp) {
        MessageDigest md5 = Digests.md5();
        AtomicLong total = new AtomicLong();

        return Mono.using(
                () -> FileChannel.open(tmp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE),
                channel -> operation.getContent()
                        .publishOn(Schedulers.boundedElastic())
                        .doOnNext(buffer -> {
                            md5.update(buffer.duplicate());
                            total.addAndGet(writeFully(channel, buffer));
                        })
                        .then(Mono.fromCallable(() -> new Written(total.get(), Digests.hex(md5)))),
                channel -> {
                    try {
                        channel.close();
                    } catch (IOException e) {
                        log.warn("Failed to close temp file {}: {}", tmp, e.getMessage());
                    }
                });
    }

    private void commit(LocalBackendContext ctx, PutObjectOperation operation, Path tmp, Written written)
            throws IOException {
        String bucketName = operation.getBucketName();
        String key = operation.getKey();

        if (operation.getSize() >= 0 && operation.getSize() != written.size()) {
            throw new ValidationException("IncompleteBody", String.format(
                    "expected %d bytes but received %d", operation.getSize(), written.size()));
        }

        Path objectPath = ctx.getObjectPath(bucketName, key);
        Files.createDirectories(objectPath.getParent());
        Files.move(tmp, objectPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

        String contentType = operation.getContentType() != null
                ? operation.getContentType()
                : LocalFileUtils.guessContentType(key);
        LocalFileUtils.writeSidecar(ctx.getMetadataPath(bucketName, key), LocalSidecar.builder()
                .etag(written.etag())
                .contentType(contentType)
                .size(written.size())
                .lastModified(Instant.now().toEpochMilli())
                .build());
    }

    private static int writeFully(FileChannel channel, ByteBuffer buffer) {
        int count = 0;
        try {
            while (buffer.hasRemaining()) {
                count += channel.write(buffer);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return count;
    }

    private static void deleteQuietly(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Failed to remove temp file {}: {}", tmp, e.getMessage());
        }
    }

    private record Written(long size, String etag) {
    }

    @Override
    public Class<PutObjectOperation> getOperationType() {
        return PutObjectOperation.class;
    }
}
