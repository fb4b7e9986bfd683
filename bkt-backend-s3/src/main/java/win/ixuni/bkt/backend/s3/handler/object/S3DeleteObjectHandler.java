package win.ixuni.bkt.backend.s3.handler.object;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import win.ixuni.bkt.backend.s3.context.S3BackendContext;
import win.ixuni.bkt.core.operation.BackendContext;
import win.ixuni.bkt.core.operation.OperationHandler;
import win.ixuni.bkt.core.operation.object.DeleteObjectOperation;

/**
 * S3 删除对象处理器
 */
public class S3DeleteObjectHandler implements OperationHandler<DeleteObjectOperation, Void> {

    @Override
    public Mono<Void> handle(DeleteObjectOperation operation, BackendContext context) {
        S3BackendContext ctx = (S3BackendContext) context;

        return Mono.fromFuture(() -> ctx.getS3Client().deleteObject(
                        DeleteObjectRequest.builder()
                                .bucket(ctx.physicalBucket(operation.getBucketName()))
                                .key(operation.getKey())
                                .build()))
                .then();
    }

    @Override
    public Class<DeleteObjectOperation> getOperationType() {
        return DeleteObjectOperation.class;
    }
}
