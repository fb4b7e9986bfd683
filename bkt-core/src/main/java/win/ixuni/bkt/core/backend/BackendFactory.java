package win.ixuni.bkt.core.backend;

import win.ixuni.bkt.core.config.BackendConfig;

/**
 * Backend factory interface
 * <p>
 * One factory per backend type, discovered through {@code META-INF/services}.
 */
public interface BackendFactory {

    /**
     * @return backend type identifier ("local", "s3")
     */
    String getBackendType();

    /**
     * Create a backend instance from configuration. The instance is not yet initialized.
     *
     * @param config backend configuration
     * @return backend instance
     */
    StorageBackend createBackend(BackendConfig config);

    default String getDescription() {
        return getBackendType() + " storage backend";
    }
}
