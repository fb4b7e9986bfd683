package win.ixuni.bkt.core.operation;

import reactor.core.publisher.Mono;

/**
 * The rest of an execution: the remaining interceptors, then the handler
 */
@FunctionalInterface
public interface InterceptorChain<O extends Operation<R>, R> {

    Mono<R> proceed(O operation, BackendContext context);
}
