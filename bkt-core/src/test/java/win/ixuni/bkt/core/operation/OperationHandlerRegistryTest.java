package win.ixuni.bkt.core.operation;

import org.junit.jupiter.api.*;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.config.BackendConfig;
import win.ixuni.bkt.core.exception.BackendException;
import win.ixuni.bkt.core.operation.bucket.BucketExistsOperation;
import win.ixuni.bkt.core.operation.bucket.DeleteBucketOperation;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

public class OperationHandlerRegistryTest {

    private static final class TestContext implements BackendContext {
        private OperationHandlerRegistry registry;

        @Override
        public BackendConfig getConfig() {
            return new BackendConfig("test", "test");
        }

        @Override
        public String getBackendName() {
            return "test";
        }

        @Override
        public String getBackendType() {
            return "test";
        }

        @Override
        public OperationHandlerRegistry getHandlerRegistry() {
            return registry;
        }

        @Override
        public void setHandlerRegistry(OperationHandlerRegistry registry) {
            this.registry = registry;
        }
    }

    private static final class RecordingInterceptor implements HandlerInterceptor {
        private final String name;
        private final int order;
        private final List<String> calls;

        RecordingInterceptor(String name, int order, List<String> calls) {
            this.name = name;
            this.order = order;
            this.calls = calls;
        }

        @Override
        public <O extends Operation<R>, R> Mono<R> intercept(O operation, BackendContext context,
                                                             InterceptorChain<O, R> chain) {
            calls.add(name + ":" + operation.getOperationName());
            return chain.proceed(operation, context);
        }

        @Override
        public int getOrder() {
            return order;
        }
    }

    @Test
    @DisplayName("Interceptors run in order before the handler")
    void testInterceptorOrder() {
        List<String> calls = new CopyOnWriteArrayList<>();
        OperationHandlerRegistry registry = new OperationHandlerRegistry();
        registry.register(new OperationHandler<BucketExistsOperation, Boolean>() {
            @Override
            public Mono<Boolean> handle(BucketExistsOperation operation, BackendContext context) {
                calls.add("handler");
                return Mono.just(operation.getBucketName().equals("present"));
            }

            @Override
            public Class<BucketExistsOperation> getOperationType() {
                return BucketExistsOperation.class;
            }
        });
        registry.addInterceptor(new RecordingInterceptor("inner", 10, calls));
        registry.addInterceptor(new RecordingInterceptor("outer", -10, calls));

        TestContext context = new TestContext();
        context.setHandlerRegistry(registry);

        assertTrue(context.execute(new BucketExistsOperation("present")).block());
        assertEquals(List.of("outer:BucketExists", "inner:BucketExists", "handler"), calls);
    }

    @Test
    @DisplayName("未注册的操作返回 BackendException")
    void testUnsupported() {
        OperationHandlerRegistry registry = new OperationHandlerRegistry();
        TestContext context = new TestContext();
        context.setHandlerRegistry(registry);

        BackendException error = assertThrows(BackendException.class,
                () -> context.execute(new DeleteBucketOperation("x")).block());
        assertTrue(error.getMessage().contains("DeleteBucket"));
        assertFalse(registry.supports(DeleteBucketOperation.class));
    }

    @Test
    @DisplayName("A second handler for the same operation is refused")
    void testDuplicateHandler() {
        OperationHandlerRegistry registry = new OperationHandlerRegistry();
        assertEquals(0, registry.size());
        registry.register(existsHandler());

        assertThrows(IllegalStateException.class, () -> registry.register(existsHandler()));
        assertTrue(registry.supports(BucketExistsOperation.class));
        assertEquals(1, registry.size());
    }

    private static OperationHandler<BucketExistsOperation, Boolean> existsHandler() {
        return new OperationHandler<>() {
            @Override
            public Mono<Boolean> handle(BucketExistsOperation operation, BackendContext context) {
                return Mono.just(true);
            }

            @Override
            public Class<BucketExistsOperation> getOperationType() {
                return BucketExistsOperation.class;
            }
        };
    }
}
