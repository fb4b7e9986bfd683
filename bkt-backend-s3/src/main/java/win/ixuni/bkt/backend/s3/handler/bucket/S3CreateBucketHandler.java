package win.ixuni.bkt.backend.s3.handler.bucket;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.CreateBucketConfiguration;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import win.ixuni.bkt.backend.s3.context.S3BackendContext;
import win.ixuni.bkt.core.operation.BackendContext;
import win.ixuni.bkt.core.operation.OperationHandler;
import win.ixuni.bkt.core.operation.bucket.BucketExistsOperation;
import win.ixuni.bkt.core.operation.bucket.CreateBucketOperation;
import win.ixuni.bkt.core.util.ValidationUtils;

/**
 * S3 创建 Bucket 处理器
 * <p>
 * Idempotent: an existing bucket owned by the configured account is accepted as is.
 */
@Slf4j
public class S3CreateBucketHandler implements OperationHandler<CreateBucketOperation, Void> {

    @Override
    public Mono<Void> handle(CreateBucketOperation operation, BackendContext context) {
        S3BackendContext ctx = (S3BackendContext) context;
        String physical = ctx.physicalBucket(operation.getBucketName());

        return ctx.execute(new BucketExistsOperation(operation.getBucketName()))
                .flatMap(exists -> {
                    if (exists) {
                        log.debug("Remote bucket {} already exists, reusing it", physical);
                        return Mono.<Void>empty();
                    }
                    return Mono.fromFuture(() -> ctx.getS3Client().createBucket(
                                    buildRequest(physical, operation.getRegion())))
                            .then()
                            .onErrorResume(S3Exception.class, e -> isOwnedByUs(e)
                                    ? Mono.empty()
                                    : Mono.error(e));
                });
    }

    /**
     * us-east-1 is the one region that must not be sent as a LocationConstraint
     */
    public static CreateBucketRequest buildRequest(String physicalBucket, String region) {
        CreateBucketRequest.Builder builder = CreateBucketRequest.builder().bucket(physicalBucket);
        if (region != null && !region.isEmpty() && !ValidationUtils.DEFAULT_REGION.equals(region)) {
            builder.createBucketConfiguration(CreateBucketConfiguration.builder()
                    .locationConstraint(region)
                    .build());
        }
        return builder.build();
    }

    private static boolean isOwnedByUs(S3Exception e) {
        return e.awsErrorDetails() != null
                && "BucketAlreadyOwnedByYou".equals(e.awsErrorDetails().errorCode());
    }

    @Override
    public Class<CreateBucketOperation> getOperationType() {
        return CreateBucketOperation.class;
    }
}
