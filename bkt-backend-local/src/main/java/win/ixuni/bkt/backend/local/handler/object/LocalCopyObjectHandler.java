package win.ixuni.bkt.backend.local.handler.object;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.bkt.backend.local.context.LocalBackendContext;
import win.ixuni.bkt.backend.local.handler.LocalFileUtils;
import win.ixuni.bkt.backend.local.handler.LocalSidecar;
import win.ixuni.bkt.core.exception.ObjectNotFoundException;
import win.ixuni.bkt.core.model.ObjectInfo;
import win.ixuni.bkt.core.operation.BackendContext;
import win.ixuni.bkt.core.operation.OperationHandler;
import win.ixuni.bkt.core.operation.object.CopyObjectOperation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.UUID;

/**
 * 本地文件系统复制对象处理器
 * <p>
 * Server-side copy inside one bucket. The source stays in place; moves are a copy followed
 * by a delete at the service layer.
 */
public class LocalCopyObjectHandler implements OperationHandler<CopyObjectOperation, Void> {

    @Override
    public Mono<Void> handle(CopyObjectOperation operation, BackendContext context) {
        LocalBackendContext ctx = (LocalBackendContext) context;
        String bucketName = operation.getBucketName();
        String sourceKey = operation.getSourceKey();
        String destinationKey = operation.getDestinationKey();

        return Mono.fromCallable(() -> {
            Path source = ctx.getObjectPath(bucketName, sourceKey);
            Path destination = ctx.getObjectPath(bucketName, destinationKey);
            if (!Files.isRegularFile(source)) {
                throw new ObjectNotFoundException(bucketName, sourceKey);
            }
            if (source.equals(destination)) {
                return Boolean.TRUE;
            }
            ObjectInfo info = LocalFileUtils.describe(ctx, bucketName, sourceKey, source);

            Files.createDirectories(ctx.getTmpRoot());
            Path tmp = ctx.getTmpRoot().resolve(UUID.randomUUID() + ".part");
            try {
                Files.copy(source, tmp);
                Files.createDirectories(destination.getParent());
                Files.move(tmp, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }

            LocalFileUtils.writeSidecar(ctx.getMetadataPath(bucketName, destinationKey), LocalSidecar.builder()
                    .etag(info.getEtag())
                    .contentType(info.getContentType())
                    .size(info.getSize())
                    .lastModified(Instant.now().toEpochMilli())
                    .build());
            return Boolean.TRUE;
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }

    @Override
    public Class<CopyObjectOperation> getOperationType() {
        return CopyObjectOperation.class;
    }
}
