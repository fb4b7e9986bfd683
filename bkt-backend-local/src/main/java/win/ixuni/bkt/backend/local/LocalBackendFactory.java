package win.ixuni.bkt.backend.local;

import win.ixuni.bkt.backend.local.context.LocalBackendContext;
import win.ixuni.bkt.core.backend.BackendFactory;
import win.ixuni.bkt.core.backend.StorageBackend;
import win.ixuni.bkt.core.config.BackendConfig;

/**
 * 本地文件系统后端工厂
 */
public class LocalBackendFactory implements BackendFactory {

    @Override
    public String getBackendType() {
        return LocalBackendContext.BACKEND_TYPE;
    }

    @Override
    public StorageBackend createBackend(BackendConfig config) {
        return new LocalStorageBackend(config);
    }

    @Override
    public String getDescription() {
        return "Local filesystem storage backend";
    }
}
