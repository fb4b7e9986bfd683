package win.ixuni.bkt.backend.s3.handler.object;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.core.async.AsyncRequestBody;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import win.ixuni.bkt.backend.s3.context.S3BackendContext;
import win.ixuni.bkt.backend.s3.handler.S3Objects;
import win.ixuni.bkt.core.exception.ValidationException;
import win.ixuni.bkt.core.operation.BackendContext;
import win.ixuni.bkt.core.operation.OperationHandler;
import win.ixuni.bkt.core.operation.object.PutObjectOperation;

/**
 * S3 上传对象处理器
 * <p>
 * The content publisher is handed to the SDK as is; nothing is buffered here. A single PUT needs
 * the content length up front, so an unknown size is rejected.
 */
public class S3PutObjectHandler implements OperationHandler<PutObjectOperation, Void> {

    @Override
    public Mono<Void> handle(PutObjectOperation operation, BackendContext context) {
        S3BackendContext ctx = (S3BackendContext) context;

        if (operation.getSize() < 0) {
            return Mono.error(new ValidationException("MissingContentLength",
                    "S3 backend needs the object size before upload"));
        }

        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(ctx.physicalBucket(operation.getBucketName()))
                .key(operation.getKey())
                .contentType(S3Objects.orDefault(operation.getContentType()))
                .contentLength(operation.getSize())
                .build();

        return Mono.fromFuture(() -> ctx.getS3Client().putObject(request,
                        AsyncRequestBody.fromPublisher(operation.getContent())))
                .then();
    }

    @Override
    public Class<PutObjectOperation> getOperationType() {
        return PutObjectOperation.class;
    }
}
