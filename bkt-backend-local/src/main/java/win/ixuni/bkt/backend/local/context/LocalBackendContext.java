package win.ixuni.bkt.backend.local.context;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import win.ixuni.bkt.core.config.BackendConfig;
import win.ixuni.bkt.core.exception.ValidationException;
import win.ixuni.bkt.core.operation.BackendContext;
import win.ixuni.bkt.core.operation.OperationHandlerRegistry;

import java.nio.file.Path;

/**
 * 本地文件系统后端上下文
 * <p>
 * Layout under the root path:
 * <pre>
 *   root/
 *     bucket-name/        ← object data, key = relative path
 *       photos/cat.jpg
 *     .bkt-meta/          ← sidecar metadata
 *       bucket-name/
 *         photos/cat.jpg.meta.json
 *     .bkt-tmp/           ← in-flight writes, moved into place when complete
 * </pre>
 * Legal bucket names never start with a dot, so the two service directories cannot collide
 * with a bucket.
 */
@Getter
@Builder
public class LocalBackendContext implements BackendContext {

    public static final String BACKEND_TYPE = "local";

    static final String META_DIR = ".bkt-meta";
    static final String TMP_DIR = ".bkt-tmp";
    static final String SIDECAR_SUFFIX = ".meta.json";

    private final BackendConfig config;

    /**
     * 存储根路径 (absolute, normalized)
     */
    private final Path rootPath;

    @Setter
    private OperationHandlerRegistry handlerRegistry;

    @Override
    public String getBackendName() {
        return config.getName();
    }

    @Override
    public String getBackendType() {
        return BACKEND_TYPE;
    }

    // ============ Path Utility Methods ============

    public Path getMetaRoot() {
        return rootPath.resolve(META_DIR);
    }

    public Path getTmpRoot() {
        return rootPath.resolve(TMP_DIR);
    }

    public Path getBucketPath(String bucketName) {
        return contained(rootPath, bucketName);
    }

    public Path getBucketMetaPath(String bucketName) {
        return contained(getMetaRoot(), bucketName);
    }

    /**
     * @throws ValidationException when the key would escape the bucket directory
     */
    public Path getObjectPath(String bucketName, String key) {
        return contained(getBucketPath(bucketName), key);
    }

    public Path getMetadataPath(String bucketName, String key) {
        return contained(getBucketMetaPath(bucketName), key + SIDECAR_SUFFIX);
    }

    /**
     * Object key of a file inside the bucket directory, always with forward slashes
     */
    public String keyOf(String bucketName, Path file) {
        return getBucketPath(bucketName).relativize(file).toString().replace('\\', '/');
    }

    private static Path contained(Path base, String relative) {
        if (relative == null || relative.isEmpty()) {
            throw ValidationException.invalidKey("empty path segment");
        }
        Path resolved = base.resolve(relative).normalize();
        if (!resolved.startsWith(base) || resolved.equals(base)) {
            throw ValidationException.invalidKey("path escapes its parent directory: " + relative);
        }
        return resolved;
    }
}
