package win.ixuni.bkt.backend.s3.handler.object;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import win.ixuni.bkt.backend.s3.context.S3BackendContext;
import win.ixuni.bkt.backend.s3.handler.S3Objects;
import win.ixuni.bkt.core.model.ObjectInfo;
import win.ixuni.bkt.core.operation.BackendContext;
import win.ixuni.bkt.core.operation.OperationHandler;
import win.ixuni.bkt.core.operation.object.GetObjectInfoOperation;

/**
 * S3 获取对象元数据处理器 (HEAD)
 */
public class S3GetObjectInfoHandler implements OperationHandler<GetObjectInfoOperation, ObjectInfo> {

    @Override
    public Mono<ObjectInfo> handle(GetObjectInfoOperation operation, BackendContext context) {
        S3BackendContext ctx = (S3BackendContext) context;
        String key = operation.getKey();

        return Mono.fromFuture(() -> ctx.getS3Client().headObject(
                        HeadObjectRequest.builder()
                                .bucket(ctx.physicalBucket(operation.getBucketName()))
                                .key(key)
                                .build()))
                .map(response -> ObjectInfo.builder()
                        .key(key)
                        .size(response.contentLength() != null ? response.contentLength() : 0L)
                        .etag(S3Objects.unquote(response.eTag()))
                        .contentType(S3Objects.orDefault(response.contentType()))
                        .lastModified(response.lastModified())
                        .build());
    }

    @Override
    public Class<GetObjectInfoOperation> getOperationType() {
        return GetObjectInfoOperation.class;
    }
}
