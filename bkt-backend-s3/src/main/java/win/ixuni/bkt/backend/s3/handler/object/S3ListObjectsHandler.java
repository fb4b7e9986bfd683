package win.ixuni.bkt.backend.s3.handler.object;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import win.ixuni.bkt.backend.s3.context.S3BackendContext;
import win.ixuni.bkt.backend.s3.handler.S3Objects;
import win.ixuni.bkt.core.model.ObjectInfo;
import win.ixuni.bkt.core.operation.BackendContext;
import win.ixuni.bkt.core.operation.OperationHandler;
import win.ixuni.bkt.core.operation.object.ListObjectsOperation;

import java.util.List;

/**
 * S3 列出对象处理器
 * <p>
 * Pages through ListObjectsV2 with 1000 keys per page and stops at {@link #MAX_OBJECTS}.
 * A missing remote bucket is an error, never an empty listing.
 */
public class S3ListObjectsHandler implements OperationHandler<ListObjectsOperation, List<ObjectInfo>> {

    public static final int PAGE_SIZE = 1000;

    public static final int MAX_OBJECTS = 10_000;

    @Override
    public Mono<List<ObjectInfo>> handle(ListObjectsOperation operation, BackendContext context) {
        S3BackendContext ctx = (S3BackendContext) context;
        String prefix = operation.getPrefix();

        ListObjectsV2Request request = ListObjectsV2Request.builder()
                .bucket(ctx.physicalBucket(operation.getBucketName()))
                .prefix(prefix == null || prefix.isEmpty() ? null : prefix)
                .maxKeys(PAGE_SIZE)
                .build();

        return Flux.from(ctx.getS3Client().listObjectsV2Paginator(request).contents())
                .take(MAX_OBJECTS)
                .map(obj -> ObjectInfo.builder()
                        .key(obj.key())
                        .size(obj.size() != null ? obj.size() : 0L)
                        .etag(S3Objects.unquote(obj.eTag()))
                        .contentType(S3Objects.guessContentType(obj.key()))
                        .lastModified(obj.lastModified())
                        .build())
                .collectList();
    }

    @Override
    public Class<ListObjectsOperation> getOperationType() {
        return ListObjectsOperation.class;
    }
}
