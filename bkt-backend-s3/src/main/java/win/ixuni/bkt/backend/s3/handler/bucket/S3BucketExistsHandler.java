package win.ixuni.bkt.backend.s3.handler.bucket;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.S3Exception;
import win.ixuni.bkt.backend.s3.context.S3BackendContext;
import win.ixuni.bkt.backend.s3.interceptor.S3ExceptionTranslationInterceptor;
import win.ixuni.bkt.core.exception.BackendException;
import win.ixuni.bkt.core.operation.BackendContext;
import win.ixuni.bkt.core.operation.OperationHandler;
import win.ixuni.bkt.core.operation.bucket.BucketExistsOperation;

/**
 * S3 检查 Bucket 是否存在处理器
 * <p>
 * 404 means the bucket does not exist. 403 is an error: the bucket may exist but the
 * configured credentials cannot see it, and answering {@code false} would invite a create.
 */
public class S3BucketExistsHandler implements OperationHandler<BucketExistsOperation, Boolean> {

    @Override
    public Mono<Boolean> handle(BucketExistsOperation operation, BackendContext context) {
        S3BackendContext ctx = (S3BackendContext) context;
        String bucketName = operation.getBucketName();

        return Mono.fromFuture(() -> ctx.getS3Client().headBucket(
                        HeadBucketRequest.builder()
                                .bucket(ctx.physicalBucket(bucketName))
                                .build()))
                .map(response -> true)
                .onErrorResume(NoSuchBucketException.class, e -> Mono.just(false))
                .onErrorResume(S3Exception.class, e -> {
                    if (e.statusCode() == 404) {
                        return Mono.just(false);
                    }
                    if (e.statusCode() == 403) {
                        return Mono.error(new BackendException("bucket '" + bucketName
                                + "' may exist but access is denied",
                                S3ExceptionTranslationInterceptor.BAD_GATEWAY, e));
                    }
                    return Mono.error(e);
                });
    }

    @Override
    public Class<BucketExistsOperation> getOperationType() {
        return BucketExistsOperation.class;
    }
}
