package win.ixuni.bkt.backend.local.handler.object;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.bkt.backend.local.context.LocalBackendContext;
import win.ixuni.bkt.backend.local.handler.LocalFileUtils;
import win.ixuni.bkt.core.exception.ObjectNotFoundException;
import win.ixuni.bkt.core.model.ObjectInfo;
import win.ixuni.bkt.core.operation.BackendContext;
import win.ixuni.bkt.core.operation.OperationHandler;
import win.ixuni.bkt.core.operation.object.GetObjectInfoOperation;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 本地文件系统获取对象元数据处理器
 */
public class LocalGetObjectInfoHandler implements OperationHandler<GetObjectInfoOperation, ObjectInfo> {

    @Override
    public Mono<ObjectInfo> handle(GetObjectInfoOperation operation, BackendContext context) {
        LocalBackendContext ctx = (LocalBackendContext) context;
        String bucketName = operation.getBucketName();
        String key = operation.getKey();

        return Mono.fromCallable(() -> {
            Path objectPath = ctx.getObjectPath(bucketName, key);
            if (!Files.isRegularFile(objectPath)) {
                throw new ObjectNotFoundException(bucketName, key);
            }
            return LocalFileUtils.describe(ctx, bucketName, key, objectPath);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Class<GetObjectInfoOperation> getOperationType() {
        return GetObjectInfoOperation.class;
    }
}
