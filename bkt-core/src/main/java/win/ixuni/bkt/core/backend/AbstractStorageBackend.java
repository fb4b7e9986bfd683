package win.ixuni.bkt.core.backend;

import lombok.Getter;
import win.ixuni.bkt.core.operation.OperationHandlerRegistry;
import win.ixuni.bkt.core.operation.interceptor.LoggingInterceptor;

/**
 * Abstract base class for storage backends
 * <p>
 * Holds the handler registry with the logging interceptor already installed; subclasses
 * register their handlers in the constructor.
 */
public abstract class AbstractStorageBackend implements StorageBackend {

    @Getter
    protected final OperationHandlerRegistry handlerRegistry = new OperationHandlerRegistry();

    protected AbstractStorageBackend() {
        handlerRegistry.addInterceptor(new LoggingInterceptor());
    }
}
