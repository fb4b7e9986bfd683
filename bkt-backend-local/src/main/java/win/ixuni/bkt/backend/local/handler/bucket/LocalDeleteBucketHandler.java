package win.ixuni.bkt.backend.local.handler.bucket;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.bkt.backend.local.context.LocalBackendContext;
import win.ixuni.bkt.backend.local.handler.LocalFileUtils;
import win.ixuni.bkt.core.exception.BucketNotEmptyException;
import win.ixuni.bkt.core.operation.BackendContext;
import win.ixuni.bkt.core.operation.OperationHandler;
import win.ixuni.bkt.core.operation.bucket.DeleteBucketOperation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * 本地文件系统删除 Bucket 处理器
 * <p>
 * A bucket holding any regular file is not empty; leftover empty directories are removed
 * together with the bucket. Deleting a missing bucket succeeds.
 */
public class LocalDeleteBucketHandler implements OperationHandler<DeleteBucketOperation, Void> {

    @Override
    public Mono<Void> handle(DeleteBucketOperation operation, BackendContext context) {
        LocalBackendContext ctx = (LocalBackendContext) context;
        String bucketName = operation.getBucketName();

        return Mono.fromCallable(() -> {
            Path bucketPath = ctx.getBucketPath(bucketName);
            if (!Files.exists(bucketPath)) {
                return Boolean.TRUE;
            }
            try (Stream<Path> paths = Files.walk(bucketPath)) {
                if (paths.anyMatch(Files::isRegularFile)) {
                    throw new BucketNotEmptyException(bucketName);
                }
            }
            LocalFileUtils.deleteDirectoryRecursively(bucketPath);
            LocalFileUtils.deleteDirectoryRecursively(ctx.getBucketMetaPath(bucketName));
            return Boolean.TRUE;
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }

    @Override
    public Class<DeleteBucketOperation> getOperationType() {
        return DeleteBucketOperation.class;
    }
}
