package win.ixuni.bkt.backend.local.handler.object;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.bkt.backend.local.context.LocalBackendContext;
import win.ixuni.bkt.backend.local.handler.LocalFileUtils;
import win.ixuni.bkt.core.exception.ObjectNotFoundException;
import win.ixuni.bkt.core.model.ObjectContent;
import win.ixuni.bkt.core.model.ObjectInfo;
import win.ixuni.bkt.core.operation.BackendContext;
import win.ixuni.bkt.core.operation.OperationHandler;
import win.ixuni.bkt.core.operation.object.GetObjectOperation;
import win.ixuni.bkt.core.util.ChannelFluxes;

import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * 本地文件系统获取对象处理器
 * <p>
 * The file is opened per subscription and read in 64 KB chunks.
 */
public class LocalGetObjectHandler implements OperationHandler<GetObjectOperation, ObjectContent> {

    @Override
    public Mono<ObjectContent> handle(GetObjectOperation operation, BackendContext context) {
        LocalBackendContext ctx = (LocalBackendContext) context;
        String bucketName = operation.getBucketName();
        String key = operation.getKey();

        return Mono.fromCallable(() -> {
            Path objectPath = ctx.getObjectPath(bucketName, key);
            if (!Files.isRegularFile(objectPath)) {
                throw new ObjectNotFoundException(bucketName, key);
            }
            ObjectInfo info = LocalFileUtils.describe(ctx, bucketName, key, objectPath);
            return ObjectContent.builder()
                    .info(info)
                    .content(ChannelFluxes.read(() -> FileChannel.open(objectPath, StandardOpenOption.READ),
                                    ChannelFluxes.DEFAULT_BUFFER_SIZE)
                            .subscribeOn(Schedulers.boundedElastic()))
                    .build();
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Class<GetObjectOperation> getOperationType() {
        return GetObjectOperation.class;
    }
}
