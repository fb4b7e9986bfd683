package win.ixuni.bkt.backend.local.handler.bucket;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.bkt.backend.local.context.LocalBackendContext;
import win.ixuni.bkt.core.operation.BackendContext;
import win.ixuni.bkt.core.operation.OperationHandler;
import win.ixuni.bkt.core.operation.bucket.BucketExistsOperation;

import java.nio.file.Files;

/**
 * 本地文件系统检查 Bucket 是否存在处理器
 */
public class LocalBucketExistsHandler implements OperationHandler<BucketExistsOperation, Boolean> {

    @Override
    public Mono<Boolean> handle(BucketExistsOperation operation, BackendContext context) {
        LocalBackendContext ctx = (LocalBackendContext) context;

        return Mono.fromCallable(() -> Files.isDirectory(ctx.getBucketPath(operation.getBucketName())))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Class<BucketExistsOperation> getOperationType() {
        return BucketExistsOperation.class;
    }
}
