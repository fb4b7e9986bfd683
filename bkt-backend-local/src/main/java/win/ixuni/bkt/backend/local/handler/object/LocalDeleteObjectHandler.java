package win.ixuni.bkt.backend.local.handler.object;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.bkt.backend.local.context.LocalBackendContext;
import win.ixuni.bkt.backend.local.handler.LocalFileUtils;
import win.ixuni.bkt.core.operation.BackendContext;
import win.ixuni.bkt.core.operation.OperationHandler;
import win.ixuni.bkt.core.operation.object.DeleteObjectOperation;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 本地文件系统删除对象处理器
 * <p>
 * Deleting a missing object succeeds. Directories left empty by the delete are pruned.
 */
public class LocalDeleteObjectHandler implements OperationHandler<DeleteObjectOperation, Void> {

    @Override
    public Mono<Void> handle(DeleteObjectOperation operation, BackendContext context) {
        LocalBackendContext ctx = (LocalBackendContext) context;
        String bucketName = operation.getBucketName();
        String key = operation.getKey();

        return Mono.fromCallable(() -> {
            Path objectPath = ctx.getObjectPath(bucketName, key);
            Path metaPath = ctx.getMetadataPath(bucketName, key);

            boolean deleted = Files.deleteIfExists(objectPath);
            Files.deleteIfExists(metaPath);

            LocalFileUtils.pruneEmptyParents(objectPath.getParent(), ctx.getBucketPath(bucketName));
            LocalFileUtils.pruneEmptyParents(metaPath.getParent(), ctx.getBucketMetaPath(bucketName));
            return deleted;
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }

    @Override
    public Class<DeleteObjectOperation> getOperationType() {
        return DeleteObjectOperation.class;
    }
}
