package win.ixuni.bkt.server.registry;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.bkt.backend.local.LocalStorageBackend;
import win.ixuni.bkt.core.backend.BackendFactory;
import win.ixuni.bkt.core.backend.BackendFactoryLoader;
import win.ixuni.bkt.core.backend.StorageBackend;
import win.ixuni.bkt.core.config.BackendConfig;
import win.ixuni.bkt.core.exception.BackendException;
import win.ixuni.bkt.server.config.GatewayProperties;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 存储后端注册表
 * <p>
 * Factories come from {@code META-INF/services}. The local backend is built once at startup;
 * remote backends are built on first use and pooled by {@link BackendConfig#fingerprint()}, so
 * every bucket sharing one S3 configuration shares one client.
 */
@Slf4j
@Component
public class BackendRegistry {

    public static final String LOCAL_NAME = "local";

    private final GatewayProperties properties;
    private final Map<String, BackendFactory> factories;

    /**
     * fingerprint -> backend
     */
    private final Map<String, StorageBackend> backends = new ConcurrentHashMap<>();

    private volatile StorageBackend localBackend;

    @Autowired
    public BackendRegistry(GatewayProperties properties) {
        this(properties, BackendFactoryLoader.load());
    }

    public BackendRegistry(GatewayProperties properties, Map<String, BackendFactory> factories) {
        this.properties = properties;
        this.factories = factories;
    }

    @PostConstruct
    public void initialize() {
        log.info("Initializing backend registry, factories: {}", factories.keySet());
        BackendConfig config = new BackendConfig(LOCAL_NAME, LOCAL_NAME)
                .with(LocalStorageBackend.ROOT_PATH, properties.getStorage().getLocalRoot());
        localBackend = create(config);
        localBackend.initialize().block();
        log.info("Local backend ready at {}", properties.getStorage().getLocalRoot());
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down {} pooled backend(s)...", backends.size());
        Flux.fromIterable(backends.values())
                .concatWithValues(localBackend)
                .flatMap(backend -> backend.shutdown()
                        .onErrorResume(e -> {
                            log.error("Error shutting down backend '{}': {}", backend.getBackendName(), e.getMessage());
                            return Mono.empty();
                        }))
                .blockLast();
        backends.clear();
    }

    public StorageBackend getLocalBackend() {
        return localBackend;
    }

    /**
     * Pooled backend for {@code config}, built and initialized on first use
     */
    public Mono<StorageBackend> obtain(BackendConfig config) {
        String fingerprint = config.fingerprint();
        StorageBackend existing = backends.get(fingerprint);
        if (existing != null) {
            return Mono.just(existing);
        }
        return Mono.fromCallable(() -> create(config))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(backend -> backend.initialize().thenReturn(backend))
                .map(backend -> {
                    StorageBackend winner = backends.putIfAbsent(fingerprint, backend);
                    if (winner != null) {
                        // lost the race, keep the pooled one
                        backend.shutdown().subscribe(null,
                                e -> log.warn("Failed to close duplicate backend: {}", e.getMessage()));
                        return winner;
                    }
                    log.info("Created {} backend '{}'", config.getType(), config.getName());
                    return backend;
                });
    }

    /**
     * Drop and close every pooled backend built under {@code backendName}.
     * <p>
     * Called when the configuration behind those backends changes or disappears; the next
     * resolution builds a fresh client.
     *
     * @return number of backends closed
     */
    public Mono<Integer> evict(String backendName) {
        return Flux.fromIterable(backends.entrySet())
                .filter(entry -> backendName.equals(entry.getValue().getBackendName()))
                .filter(entry -> backends.remove(entry.getKey(), entry.getValue()))
                .map(Map.Entry::getValue)
                .concatMap(backend -> backend.shutdown()
                        .onErrorResume(e -> {
                            log.warn("Error closing evicted backend '{}': {}", backendName, e.getMessage());
                            return Mono.empty();
                        })
                        .thenReturn(1))
                .reduce(0, Integer::sum)
                .doOnNext(closed -> {
                    if (closed > 0) {
                        log.info("Evicted {} pooled backend(s) named '{}'", closed, backendName);
                    }
                });
    }

    public int getPooledCount() {
        return backends.size();
    }

    private StorageBackend create(BackendConfig config) {
        BackendFactory factory = factories.get(config.getType());
        if (factory == null) {
            throw new BackendException("No storage backend of type '" + config.getType() + "' is available");
        }
        return factory.createBackend(config);
    }
}
