package win.ixuni.bkt.backend.s3.handler.bucket;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.DeleteBucketRequest;
import win.ixuni.bkt.backend.s3.context.S3BackendContext;
import win.ixuni.bkt.core.operation.BackendContext;
import win.ixuni.bkt.core.operation.OperationHandler;
import win.ixuni.bkt.core.operation.bucket.DeleteBucketOperation;

/**
 * S3 删除 Bucket 处理器 (the remote bucket must be empty)
 */
public class S3DeleteBucketHandler implements OperationHandler<DeleteBucketOperation, Void> {

    @Override
    public Mono<Void> handle(DeleteBucketOperation operation, BackendContext context) {
        S3BackendContext ctx = (S3BackendContext) context;

        return Mono.fromFuture(() -> ctx.getS3Client().deleteBucket(
                        DeleteBucketRequest.builder()
                                .bucket(ctx.physicalBucket(operation.getBucketName()))
                                .build()))
                .then();
    }

    @Override
    public Class<DeleteBucketOperation> getOperationType() {
        return DeleteBucketOperation.class;
    }
}
