package win.ixuni.bkt.backend.s3.handler.object;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.CopyObjectRequest;
import win.ixuni.bkt.backend.s3.context.S3BackendContext;
import win.ixuni.bkt.core.operation.BackendContext;
import win.ixuni.bkt.core.operation.OperationHandler;
import win.ixuni.bkt.core.operation.object.CopyObjectOperation;

/**
 * S3 复制对象处理器 (server-side copy, content never passes through the gateway)
 */
public class S3CopyObjectHandler implements OperationHandler<CopyObjectOperation, Void> {

    @Override
    public Mono<Void> handle(CopyObjectOperation operation, BackendContext context) {
        S3BackendContext ctx = (S3BackendContext) context;
        String physical = ctx.physicalBucket(operation.getBucketName());

        return Mono.fromFuture(() -> ctx.getS3Client().copyObject(
                        CopyObjectRequest.builder()
                                .sourceBucket(physical)
                                .sourceKey(operation.getSourceKey())
                                .destinationBucket(physical)
                                .destinationKey(operation.getDestinationKey())
                                .build()))
                .then();
    }

    @Override
    public Class<CopyObjectOperation> getOperationType() {
        return CopyObjectOperation.class;
    }
}
