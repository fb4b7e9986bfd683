package win.ixuni.bkt.backend.s3;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.S3AsyncClientBuilder;
import win.ixuni.bkt.backend.s3.context.S3BackendContext;
import win.ixuni.bkt.backend.s3.handler.bucket.S3BucketExistsHandler;
import win.ixuni.bkt.backend.s3.handler.bucket.S3CreateBucketHandler;
import win.ixuni.bkt.backend.s3.handler.bucket.S3DeleteBucketHandler;
import win.ixuni.bkt.backend.s3.handler.object.S3CopyObjectHandler;
import win.ixuni.bkt.backend.s3.handler.object.S3DeleteObjectHandler;
import win.ixuni.bkt.backend.s3.handler.object.S3GetObjectHandler;
import win.ixuni.bkt.backend.s3.handler.object.S3GetObjectInfoHandler;
import win.ixuni.bkt.backend.s3.handler.object.S3ListObjectsHandler;
import win.ixuni.bkt.backend.s3.handler.object.S3PutObjectHandler;
import win.ixuni.bkt.backend.s3.interceptor.S3ExceptionTranslationInterceptor;
import win.ixuni.bkt.core.backend.AbstractStorageBackend;
import win.ixuni.bkt.core.config.BackendConfig;
import win.ixuni.bkt.core.operation.BackendContext;
import win.ixuni.bkt.core.util.ValidationUtils;

import java.net.URI;

/**
 * S3 storage backend
 * <p>
 * 代理标准 S3 后端（MinIO、AWS S3、阿里云 OSS 等）。
 * <p>
 * Configuration properties: {@code endpoint}, {@code region}, {@code access-key},
 * {@code secret-key}, {@code bucket-prefix}, {@code use-ssl}, {@code force-path-style}.
 */
@Slf4j
public class S3StorageBackend extends AbstractStorageBackend {

    public static final String ENDPOINT = "endpoint";
    public static final String REGION = "region";
    public static final String ACCESS_KEY = "access-key";
    public static final String SECRET_KEY = "secret-key";
    public static final String BUCKET_PREFIX = "bucket-prefix";
    public static final String USE_SSL = "use-ssl";
    public static final String FORCE_PATH_STYLE = "force-path-style";

    /**
     * Endpoint value meaning "plain AWS", no override
     */
    static final String AWS_ENDPOINT = "s3.amazonaws.com";

    private final BackendConfig config;

    private final S3BackendContext backendContext;

    private final S3AsyncClient s3Client;

    public S3StorageBackend(BackendConfig config) {
        this.config = config;
        this.s3Client = buildS3Client(config);

        this.backendContext = S3BackendContext.builder()
                .config(config)
                .s3Client(s3Client)
                .bucketPrefix(config.getString(BUCKET_PREFIX, ""))
                .build();

        registerHandlers();
        registerInterceptors();
        backendContext.setHandlerRegistry(handlerRegistry);
    }

    private S3AsyncClient buildS3Client(BackendConfig config) {
        String accessKey = config.getString(ACCESS_KEY, "");
        String secretKey = config.getString(SECRET_KEY, "");
        String region = config.getString(REGION, ValidationUtils.DEFAULT_REGION);
        boolean useSsl = config.getBoolean(USE_SSL, true);
        boolean pathStyle = config.getBoolean(FORCE_PATH_STYLE, false);

        if (accessKey.isBlank() || secretKey.isBlank()) {
            throw new IllegalArgumentException(
                    "S3 backend '" + config.getName() + "': access-key and secret-key must be configured");
        }

        S3AsyncClientBuilder builder = S3AsyncClient.builder()
                .region(Region.of(region == null || region.isEmpty() ? ValidationUtils.DEFAULT_REGION : region))
                .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(accessKey, secretKey)))
                .forcePathStyle(pathStyle);

        URI endpoint = resolveEndpoint(config.getString(ENDPOINT, null), useSsl);
        if (endpoint != null) {
            builder.endpointOverride(endpoint);
        } else {
            log.debug("S3 backend '{}': no endpoint configured, using AWS default", config.getName());
        }
        return builder.build();
    }

    /**
     * Endpoint override for the client, null for plain AWS. A bare host gets its scheme from the
     * SSL flag; an explicit scheme is kept.
     */
    static URI resolveEndpoint(String endpoint, boolean useSsl) {
        if (endpoint == null || endpoint.isBlank() || AWS_ENDPOINT.equals(endpoint)) {
            return null;
        }
        if (endpoint.contains("://")) {
            return URI.create(endpoint);
        }
        return URI.create((useSsl ? "https" : "http") + "://" + endpoint);
    }

    private void registerHandlers() {
        // Bucket handlers
        handlerRegistry.register(new S3CreateBucketHandler());
        handlerRegistry.register(new S3BucketExistsHandler());
        handlerRegistry.register(new S3DeleteBucketHandler());

        // Object handlers
        handlerRegistry.register(new S3PutObjectHandler());
        handlerRegistry.register(new S3GetObjectHandler());
        handlerRegistry.register(new S3GetObjectInfoHandler());
        handlerRegistry.register(new S3DeleteObjectHandler());
        handlerRegistry.register(new S3CopyObjectHandler());
        handlerRegistry.register(new S3ListObjectsHandler());

        log.info("Registered {} operation handlers for S3 backend", handlerRegistry.size());
    }

    private void registerInterceptors() {
        handlerRegistry.addInterceptor(new S3ExceptionTranslationInterceptor());
        log.debug("Registered S3 exception translation interceptor");
    }

    @Override
    public BackendContext getBackendContext() {
        return backendContext;
    }

    @Override
    public String getBackendType() {
        return S3BackendContext.BACKEND_TYPE;
    }

    @Override
    public String getBackendName() {
        return config.getName();
    }

    @Override
    public Mono<Void> initialize() {
        log.info("Initializing S3 backend: {} -> {}",
                config.getName(),
                config.getString(ENDPOINT, "AWS S3"));
        return Mono.empty();
    }

    @Override
    public Mono<Void> shutdown() {
        log.info("Shutting down S3 backend: {}", config.getName());
        s3Client.close();
        return Mono.empty();
    }
}
