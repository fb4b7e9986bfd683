package win.ixuni.bkt.backend.local.handler.bucket;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.bkt.backend.local.context.LocalBackendContext;
import win.ixuni.bkt.core.operation.BackendContext;
import win.ixuni.bkt.core.operation.OperationHandler;
import win.ixuni.bkt.core.operation.bucket.CreateBucketOperation;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;

/**
 * 本地文件系统创建 Bucket 处理器
 * <p>
 * Idempotent: an existing directory is kept as is. The region has no meaning on disk.
 */
public class LocalCreateBucketHandler implements OperationHandler<CreateBucketOperation, Void> {

    @Override
    public Mono<Void> handle(CreateBucketOperation operation, BackendContext context) {
        LocalBackendContext ctx = (LocalBackendContext) context;

        return Mono.fromRunnable(() -> {
            try {
                Files.createDirectories(ctx.getBucketPath(operation.getBucketName()));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }

    @Override
    public Class<CreateBucketOperation> getOperationType() {
        return CreateBucketOperation.class;
    }
}
