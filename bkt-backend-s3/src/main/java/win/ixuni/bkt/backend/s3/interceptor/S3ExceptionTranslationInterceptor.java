package win.ixuni.bkt.backend.s3.interceptor;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.model.S3Exception;
import win.ixuni.bkt.core.exception.BackendException;
import win.ixuni.bkt.core.exception.BucketAlreadyExistsException;
import win.ixuni.bkt.core.exception.BucketNotEmptyException;
import win.ixuni.bkt.core.exception.BucketNotFoundException;
import win.ixuni.bkt.core.exception.ObjectNotFoundException;
import win.ixuni.bkt.core.operation.BackendContext;
import win.ixuni.bkt.core.operation.HandlerInterceptor;
import win.ixuni.bkt.core.operation.InterceptorChain;
import win.ixuni.bkt.core.operation.Operation;

/**
 * S3 exception conversion interceptor
 * <p>
 * Converts AWS SDK exceptions to the gateway exception hierarchy, so the S3 backend fails the
 * same way the local backend does. Names in the messages are the logical ones of the operation,
 * never the prefixed remote bucket.
 */
@Slf4j
public class S3ExceptionTranslationInterceptor implements HandlerInterceptor {

    /**
     * Status used for failures of the remote side
     */
    public static final int BAD_GATEWAY = 502;

    @Override
    public <O extends Operation<R>, R> Mono<R> intercept(
            O operation, BackendContext context, InterceptorChain<O, R> chain) {
        return chain.proceed(operation, context)
                .onErrorMap(S3Exception.class, e -> translate(operation, e))
                .onErrorMap(SdkClientException.class, e -> new BackendException(
                        "S3 backend '" + context.getBackendName() + "' unreachable: " + e.getMessage(),
                        BAD_GATEWAY, e));
    }

    /**
     * Convert S3Exception to the corresponding gateway exception
     */
    public Throwable translate(Operation<?> operation, S3Exception e) {
        String errorCode = e.awsErrorDetails() != null && e.awsErrorDetails().errorCode() != null
                ? e.awsErrorDetails().errorCode()
                : "";
        String bucketName = operation.getBucketName();

        switch (errorCode) {
            case "NoSuchBucket":
                return new BucketNotFoundException(bucketName);
            case "NoSuchKey":
                return new ObjectNotFoundException(bucketName, operation.getKey());
            case "BucketNotEmpty":
                return new BucketNotEmptyException(bucketName);
            case "BucketAlreadyExists":
                return new BucketAlreadyExistsException(bucketName);
            default:
                break;
        }

        // HEAD responses have no body, so only the status is known
        if (e.statusCode() == 404) {
            return operation.getKey() != null
                    ? new ObjectNotFoundException(bucketName, operation.getKey())
                    : new BucketNotFoundException(bucketName);
        }
        if (e.statusCode() == 403) {
            return new BackendException("S3 backend denied access to bucket '" + bucketName
                    + "' (check the configured credentials)", BAD_GATEWAY, e);
        }

        log.debug("Unmapped S3 error code: {} (HTTP {})", errorCode, e.statusCode());
        return new BackendException("S3 " + operation.getOperationName() + " failed: "
                + (errorCode.isEmpty() ? "HTTP " + e.statusCode() : errorCode), BAD_GATEWAY, e);
    }

    @Override
    public int getOrder() {
        // closest to the handler, inside the logging interceptor
        return 100;
    }
}
