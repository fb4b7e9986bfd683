package win.ixuni.bkt.backend.local;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.bkt.backend.local.context.LocalBackendContext;
import win.ixuni.bkt.backend.local.handler.bucket.LocalBucketExistsHandler;
import win.ixuni.bkt.backend.local.handler.bucket.LocalCreateBucketHandler;
import win.ixuni.bkt.backend.local.handler.bucket.LocalDeleteBucketHandler;
import win.ixuni.bkt.backend.local.handler.object.LocalCopyObjectHandler;
import win.ixuni.bkt.backend.local.handler.object.LocalDeleteObjectHandler;
import win.ixuni.bkt.backend.local.handler.object.LocalGetObjectHandler;
import win.ixuni.bkt.backend.local.handler.object.LocalGetObjectInfoHandler;
import win.ixuni.bkt.backend.local.handler.object.LocalListObjectsHandler;
import win.ixuni.bkt.backend.local.handler.object.LocalPutObjectHandler;
import win.ixuni.bkt.core.backend.AbstractStorageBackend;
import win.ixuni.bkt.core.config.BackendConfig;
import win.ixuni.bkt.core.operation.BackendContext;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 本地文件系统存储后端
 * <p>
 * 使用本地文件系统存储对象，元数据保存在 sidecar JSON 文件中。
 * <p>
 * Configuration properties:
 * <ul>
 *   <li>{@code root-path}: storage root, default {@value #DEFAULT_ROOT_PATH}</li>
 * </ul>
 */
@Slf4j
public class LocalStorageBackend extends AbstractStorageBackend {

    public static final String ROOT_PATH = "root-path";

    public static final String DEFAULT_ROOT_PATH = "./data";

    private final BackendConfig config;

    private final LocalBackendContext backendContext;

    public LocalStorageBackend(BackendConfig config) {
        this.config = config;

        Path rootPath = Paths.get(config.getString(ROOT_PATH, DEFAULT_ROOT_PATH)).toAbsolutePath().normalize();
        this.backendContext = LocalBackendContext.builder()
                .config(config)
                .rootPath(rootPath)
                .build();
        this.backendContext.setHandlerRegistry(handlerRegistry);

        registerHandlers();
    }

    private void registerHandlers() {
        // Bucket handlers
        handlerRegistry.register(new LocalCreateBucketHandler());
        handlerRegistry.register(new LocalBucketExistsHandler());
        handlerRegistry.register(new LocalDeleteBucketHandler());

        // Object handlers
        handlerRegistry.register(new LocalPutObjectHandler());
        handlerRegistry.register(new LocalGetObjectHandler());
        handlerRegistry.register(new LocalGetObjectInfoHandler());
        handlerRegistry.register(new LocalDeleteObjectHandler());
        handlerRegistry.register(new LocalCopyObjectHandler());
        handlerRegistry.register(new LocalListObjectsHandler());

        log.info("LocalStorageBackend registered {} operation handlers", handlerRegistry.size());
    }

    @Override
    public BackendContext getBackendContext() {
        return backendContext;
    }

    @Override
    public String getBackendType() {
        return LocalBackendContext.BACKEND_TYPE;
    }

    @Override
    public String getBackendName() {
        return config.getName();
    }

    @Override
    public Mono<Void> initialize() {
        return Mono.fromRunnable(() -> {
            try {
                Files.createDirectories(backendContext.getRootPath());
                Files.createDirectories(backendContext.getMetaRoot());
                Files.createDirectories(backendContext.getTmpRoot());
                log.info("Local storage initialized at: {}", backendContext.getRootPath());
            } catch (Exception e) {
                throw new RuntimeException("Failed to initialize local storage", e);
            }
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }

    @Override
    public Mono<Void> shutdown() {
        log.info("Local storage backend '{}' shut down", config.getName());
        return Mono.empty();
    }
}
