package win.ixuni.bkt.backend.s3;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.bkt.backend.s3.context.S3BackendContext;
import win.ixuni.bkt.core.backend.BackendFactory;
import win.ixuni.bkt.core.backend.StorageBackend;
import win.ixuni.bkt.core.config.BackendConfig;

/**
 * S3 后端工厂
 */
@Slf4j
public class S3BackendFactory implements BackendFactory {

    @Override
    public String getBackendType() {
        return S3BackendContext.BACKEND_TYPE;
    }

    @Override
    public StorageBackend createBackend(BackendConfig config) {
        log.info("Creating S3 backend instance: {}", config.getName());
        return new S3StorageBackend(config);
    }

    @Override
    public String getDescription() {
        return "S3 backend for MinIO, AWS S3, and other S3-compatible endpoints";
    }
}
