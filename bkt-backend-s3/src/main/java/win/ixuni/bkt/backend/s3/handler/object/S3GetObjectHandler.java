package win.ixuni.bkt.backend.s3.handler.object;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.core.async.AsyncResponseTransformer;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import win.ixuni.bkt.backend.s3.context.S3BackendContext;
import win.ixuni.bkt.backend.s3.handler.S3Objects;
import win.ixuni.bkt.core.model.ObjectContent;
import win.ixuni.bkt.core.model.ObjectInfo;
import win.ixuni.bkt.core.operation.BackendContext;
import win.ixuni.bkt.core.operation.OperationHandler;
import win.ixuni.bkt.core.operation.object.GetObjectOperation;

/**
 * S3 获取对象处理器
 * <p>
 * Uses streaming responses to avoid loading entire object into memory
 */
public class S3GetObjectHandler implements OperationHandler<GetObjectOperation, ObjectContent> {

    @Override
    public Mono<ObjectContent> handle(GetObjectOperation operation, BackendContext context) {
        S3BackendContext ctx = (S3BackendContext) context;
        String key = operation.getKey();

        return Mono.fromFuture(() -> ctx.getS3Client().getObject(
                        GetObjectRequest.builder()
                                .bucket(ctx.physicalBucket(operation.getBucketName()))
                                .key(key)
                                .build(),
                        AsyncResponseTransformer.toPublisher()))
                .map(publisher -> {
                    GetObjectResponse response = publisher.response();
                    ObjectInfo info = ObjectInfo.builder()
                            .key(key)
                            .size(response.contentLength() != null ? response.contentLength() : 0L)
                            .etag(S3Objects.unquote(response.eTag()))
                            .contentType(S3Objects.orDefault(response.contentType()))
                            .lastModified(response.lastModified())
                            .build();

                    // 流式转发：直接将后端 Publisher 包装为 Flux
                    return ObjectContent.builder()
                            .info(info)
                            .content(Flux.from(publisher))
                            .build();
                });
    }

    @Override
    public Class<GetObjectOperation> getOperationType() {
        return GetObjectOperation.class;
    }
}
