package win.ixuni.bkt.core.operation;

import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.config.BackendConfig;

/**
 * Backend context interface
 * <p>
 * Shared state handed to every handler of one backend instance (client, root path, ...).
 * 每个后端实现自己的上下文类。
 */
public interface BackendContext {

    /**
     * 获取后端配置
     */
    BackendConfig getConfig();

    /**
     * Backend instance name
     */
    String getBackendName();

    /**
     * Backend type, "local" or "s3"
     */
    String getBackendType();

    OperationHandlerRegistry getHandlerRegistry();

    void setHandlerRegistry(OperationHandlerRegistry registry);

    /**
     * Execute another operation of the same backend from inside a handler
     *
     * @param operation the operation instance
     * @param <O>       operation type
     * @param <R>       return type
     * @return operation result
     */
    default <O extends Operation<R>, R> Mono<R> execute(O operation) {
        return getHandlerRegistry().execute(operation, this);
    }
}
