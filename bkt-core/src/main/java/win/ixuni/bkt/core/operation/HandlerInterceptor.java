package win.ixuni.bkt.core.operation;

import reactor.core.publisher.Mono;

/**
 * 后端操作拦截器
 * <p>
 * Installed per backend: logging in every backend, SDK error translation in the S3 backend.
 */
public interface HandlerInterceptor {

    <O extends Operation<R>, R> Mono<R> intercept(O operation, BackendContext context, InterceptorChain<O, R> chain);

    /**
     * Lower runs first, i.e. further from the handler
     */
    default int getOrder() {
        return 0;
    }
}
