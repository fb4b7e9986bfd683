package win.ixuni.bkt.core.operation;

import reactor.core.publisher.Mono;

/**
 * Implementation of one {@link Operation} by one backend
 *
 * @param <O> operation handled
 * @param <R> result type of the operation
 */
public interface OperationHandler<O extends Operation<R>, R> {

    /**
     * @param context state of the backend instance running the operation
     */
    Mono<R> handle(O operation, BackendContext context);

    /**
     * Registry key; exactly one handler per type and backend
     */
    Class<O> getOperationType();
}
