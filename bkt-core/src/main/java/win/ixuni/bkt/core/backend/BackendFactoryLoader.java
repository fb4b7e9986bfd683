package win.ixuni.bkt.core.backend;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.ServiceLoader;

/**
 * Backend factory loader
 * <p>
 * Uses Java SPI (ServiceLoader) to discover {@link BackendFactory} implementations on the
 * classpath, keyed by backend type.
 */
@Slf4j
public final class BackendFactoryLoader {

    private BackendFactoryLoader() {
    }

    public static Map<String, BackendFactory> load() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    public static Map<String, BackendFactory> load(ClassLoader classLoader) {
        ServiceLoader<BackendFactory> loader = ServiceLoader.load(BackendFactory.class, classLoader);
        Map<String, BackendFactory> factories = new LinkedHashMap<>();

        for (BackendFactory factory : loader) {
            factories.put(factory.getBackendType(), factory);
            log.info("Discovered backend factory via SPI: {} - {}",
                    factory.getBackendType(), factory.getDescription());
        }

        if (factories.isEmpty()) {
            log.warn("No BackendFactory implementations found via SPI");
        }
        return Collections.unmodifiableMap(factories);
    }
}
