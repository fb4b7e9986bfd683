package win.ixuni.bkt.backend.local.handler.object;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.bkt.backend.local.context.LocalBackendContext;
import win.ixuni.bkt.backend.local.handler.LocalFileUtils;
import win.ixuni.bkt.core.model.ObjectInfo;
import win.ixuni.bkt.core.operation.BackendContext;
import win.ixuni.bkt.core.operation.OperationHandler;
import win.ixuni.bkt.core.operation.object.ListObjectsOperation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 本地文件系统列出对象处理器
 * <p>
 * Walks the bucket directory; the result is sorted by key. A missing bucket lists as empty.
 */
public class LocalListObjectsHandler implements OperationHandler<ListObjectsOperation, List<ObjectInfo>> {

    @Override
    public Mono<List<ObjectInfo>> handle(ListObjectsOperation operation, BackendContext context) {
        LocalBackendContext ctx = (LocalBackendContext) context;
        String bucketName = operation.getBucketName();
        String prefix = operation.getPrefix() != null ? operation.getPrefix() : "";

        return Mono.fromCallable(() -> {
            Path bucketPath = ctx.getBucketPath(bucketName);
            if (!Files.isDirectory(bucketPath)) {
                return List.<ObjectInfo>of();
            }

            List<Path> files;
            try (Stream<Path> paths = Files.walk(bucketPath)) {
                files = paths.filter(Files::isRegularFile)
                        .filter(path -> ctx.keyOf(bucketName, path).startsWith(prefix))
                        .collect(Collectors.toList());
            }

            List<ObjectInfo> objects = new ArrayList<>(files.size());
            for (Path file : files) {
                objects.add(LocalFileUtils.describe(ctx, bucketName, ctx.keyOf(bucketName, file), file));
            }
            objects.sort(Comparator.comparing(ObjectInfo::getKey));
            return objects;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Class<ListObjectsOperation> getOperationType() {
        return ListObjectsOperation.class;
    }
}
