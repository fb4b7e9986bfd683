package win.ixuni.bkt.core.operation.interceptor;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.exception.GatewayException;
import win.ixuni.bkt.core.operation.BackendContext;
import win.ixuni.bkt.core.operation.HandlerInterceptor;
import win.ixuni.bkt.core.operation.InterceptorChain;
import win.ixuni.bkt.core.operation.Operation;

import java.util.concurrent.TimeUnit;

/**
 * 日志拦截器
 * <p>
 * Traces every backend call with its target and duration. Expected outcomes such as a missing
 * key (any gateway error below 500) stay at debug; server-side failures are logged as warnings.
 */
@Slf4j
public class LoggingInterceptor implements HandlerInterceptor {

    public static final int ORDER = -100;

    @Override
    public <O extends Operation<R>, R> Mono<R> intercept(O operation, BackendContext context,
                                                         InterceptorChain<O, R> chain) {
        String target = operation.getKey() == null
                ? operation.getBucketName()
                : operation.getBucketName() + "/" + operation.getKey();
        return Mono.defer(() -> {
            long started = System.nanoTime();
            return chain.proceed(operation, context)
                    .doOnSuccess(result -> log.debug("[{}] {} {} took {}ms", context.getBackendName(),
                            operation.getOperationName(), target, elapsedMillis(started)))
                    .doOnError(error -> {
                        if (error instanceof GatewayException gateway && gateway.getHttpStatus() < 500) {
                            log.debug("[{}] {} {}: {}", context.getBackendName(),
                                    operation.getOperationName(), target, error.getMessage());
                        } else {
                            log.warn("[{}] {} {} failed after {}ms: {}", context.getBackendName(),
                                    operation.getOperationName(), target, elapsedMillis(started),
                                    error.getMessage());
                        }
                    });
        });
    }

    @Override
    public int getOrder() {
        return ORDER;
    }

    private static long elapsedMillis(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
