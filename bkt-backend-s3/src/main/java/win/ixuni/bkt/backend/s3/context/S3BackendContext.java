package win.ixuni.bkt.backend.s3.context;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import win.ixuni.bkt.core.config.BackendConfig;
import win.ixuni.bkt.core.operation.BackendContext;
import win.ixuni.bkt.core.operation.OperationHandlerRegistry;

/**
 * S3 后端上下文
 * <p>
 * Holds the AWS S3 async client and the bucket prefix. Operations carry logical bucket names;
 * handlers translate them with {@link #physicalBucket(String)} before calling the remote side.
 */
@Getter
@Builder
public class S3BackendContext implements BackendContext {

    public static final String BACKEND_TYPE = "s3";

    private final BackendConfig config;

    /**
     * AWS S3 async client
     */
    private final S3AsyncClient s3Client;

    /**
     * Physical bucket prefix, empty for none
     */
    @Builder.Default
    private final String bucketPrefix = "";

    /**
     * Operation handler registry (injected at runtime)
     */
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

    /**
     * Logical bucket name to the remote bucket name ({@code prefix-name})
     */
    public String physicalBucket(String bucketName) {
        return physicalBucket(bucketPrefix, bucketName);
    }

    public static String physicalBucket(String prefix, String bucketName) {
        if (prefix == null || prefix.isEmpty()) {
            return bucketName;
        }
        return prefix + "-" + bucketName;
    }
}
