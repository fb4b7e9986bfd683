package win.ixuni.bkt.core.operation;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.exception.BackendException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 后端操作处理器注册表
 * <p>
 * One registry per backend instance. Handlers are registered once, when the backend is built;
 * a second handler for the same operation type is a programming error. Every execution passes
 * through the interceptors, lowest {@link HandlerInterceptor#getOrder()} outermost.
 */
@Slf4j
public class OperationHandlerRegistry {

    private final Map<Class<?>, OperationHandler<?, ?>> handlers = new ConcurrentHashMap<>();

    /**
     * Sorted snapshot, replaced as a whole when an interceptor is added
     */
    private volatile List<HandlerInterceptor> interceptors = List.of();

    public <O extends Operation<R>, R> void register(OperationHandler<O, R> handler) {
        Class<O> operationType = handler.getOperationType();
        OperationHandler<?, ?> previous = handlers.putIfAbsent(operationType, handler);
        if (previous != null) {
            throw new IllegalStateException("Handler for " + operationType.getSimpleName()
                    + " already registered: " + previous.getClass().getSimpleName());
        }
        log.debug("Registered {} for {}", handler.getClass().getSimpleName(), operationType.getSimpleName());
    }

    public synchronized void addInterceptor(HandlerInterceptor interceptor) {
        List<HandlerInterceptor> updated = new ArrayList<>(interceptors);
        updated.add(interceptor);
        updated.sort(Comparator.comparingInt(HandlerInterceptor::getOrder));
        interceptors = List.copyOf(updated);
    }

    public boolean supports(Class<? extends Operation<?>> operationType) {
        return handlers.containsKey(operationType);
    }

    /**
     * Number of registered handlers
     */
    public int size() {
        return handlers.size();
    }

    /**
     * Run an operation through the interceptors and its handler
     *
     * @return the handler's result, or a {@link BackendException} signal when this backend has
     *         no handler for the operation
     */
    @SuppressWarnings("unchecked")
    public <O extends Operation<R>, R> Mono<R> execute(O operation, BackendContext context) {
        OperationHandler<O, R> handler = (OperationHandler<O, R>) handlers.get(operation.getClass());
        if (handler == null) {
            return Mono.error(new BackendException("Backend '" + context.getBackendName()
                    + "' cannot handle " + operation.getOperationName()));
        }

        List<HandlerInterceptor> snapshot = interceptors;
        InterceptorChain<O, R> chain = handler::handle;
        for (int i = snapshot.size() - 1; i >= 0; i--) {
            HandlerInterceptor interceptor = snapshot.get(i);
            InterceptorChain<O, R> next = chain;
            chain = (op, ctx) -> interceptor.intercept(op, ctx, next);
        }
        return chain.proceed(operation, context);
    }
}
