package win.ixuni.bkt.backend.s3;

import org.junit.jupiter.api.*;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.paginators.ListObjectsV2Publisher;
import win.ixuni.bkt.backend.s3.context.S3BackendContext;
import win.ixuni.bkt.backend.s3.handler.S3Objects;
import win.ixuni.bkt.backend.s3.handler.bucket.S3CreateBucketHandler;
import win.ixuni.bkt.backend.s3.handler.object.S3ListObjectsHandler;
import win.ixuni.bkt.backend.s3.interceptor.S3ExceptionTranslationInterceptor;
import win.ixuni.bkt.core.backend.BackendFactoryLoader;
import win.ixuni.bkt.core.backend.StorageBackend;
import win.ixuni.bkt.core.config.BackendConfig;
import win.ixuni.bkt.core.exception.BackendException;
import win.ixuni.bkt.core.exception.BucketNotEmptyException;
import win.ixuni.bkt.core.exception.BucketNotFoundException;
import win.ixuni.bkt.core.exception.GatewayException;
import win.ixuni.bkt.core.exception.ObjectNotFoundException;
import win.ixuni.bkt.core.operation.OperationHandlerRegistry;
import win.ixuni.bkt.core.operation.bucket.BucketExistsOperation;
import win.ixuni.bkt.core.operation.bucket.DeleteBucketOperation;
import win.ixuni.bkt.core.operation.object.CopyObjectOperation;
import win.ixuni.bkt.core.operation.object.GetObjectInfoOperation;
import win.ixuni.bkt.core.operation.object.ListObjectsOperation;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class S3StorageBackendTest {

    private final S3ExceptionTranslationInterceptor interceptor = new S3ExceptionTranslationInterceptor();

    @Test
    @DisplayName("Bucket prefix maps logical to physical names")
    void testPhysicalBucket() {
        assertEquals("photos", S3BackendContext.physicalBucket("", "photos"));
        assertEquals("photos", S3BackendContext.physicalBucket(null, "photos"));
        assertEquals("team-a-photos", S3BackendContext.physicalBucket("team-a", "photos"));
    }

    @Test
    @DisplayName("Endpoint scheme follows the SSL flag")
    void testResolveEndpoint() {
        assertNull(S3StorageBackend.resolveEndpoint(null, true));
        assertNull(S3StorageBackend.resolveEndpoint("", true));
        assertNull(S3StorageBackend.resolveEndpoint("s3.amazonaws.com", true));
        assertEquals(URI.create("https://minio.local:9000"), S3StorageBackend.resolveEndpoint("minio.local:9000", true));
        assertEquals(URI.create("http://minio.local:9000"), S3StorageBackend.resolveEndpoint("minio.local:9000", false));
        assertEquals(URI.create("http://127.0.0.1:9000"), S3StorageBackend.resolveEndpoint("http://127.0.0.1:9000", true));
    }

    @Test
    @DisplayName("us-east-1 不发送 LocationConstraint")
    void testLocationConstraint() {
        CreateBucketRequest east = S3CreateBucketHandler.buildRequest("b", "us-east-1");
        assertNull(east.createBucketConfiguration());

        CreateBucketRequest empty = S3CreateBucketHandler.buildRequest("b", "");
        assertNull(empty.createBucketConfiguration());

        CreateBucketRequest eu = S3CreateBucketHandler.buildRequest("b", "eu-west-1");
        assertEquals("eu-west-1", eu.createBucketConfiguration().locationConstraintAsString());
    }

    @Test
    @DisplayName("ETags are unquoted, unknown content types default")
    void testObjectHelpers() {
        assertEquals("abc", S3Objects.unquote("\"abc\""));
        assertEquals("abc", S3Objects.unquote("abc"));
        assertEquals("", S3Objects.unquote(null));
        assertEquals("application/octet-stream", S3Objects.guessContentType("noext"));
        assertEquals("image/png", S3Objects.guessContentType("a/b.png"));
    }

    @Test
    @DisplayName("S3 error codes translate to gateway exceptions with logical names")
    void testTranslation() {
        Throwable noBucket = interceptor.translate(new DeleteBucketOperation("photos"), s3Error(404, "NoSuchBucket"));
        assertInstanceOf(BucketNotFoundException.class, noBucket);
        assertTrue(noBucket.getMessage().contains("photos"));

        Throwable noKey = interceptor.translate(new GetObjectInfoOperation("photos", "a.txt"), s3Error(404, null));
        assertInstanceOf(ObjectNotFoundException.class, noKey);

        Throwable copyMissing = interceptor.translate(
                new CopyObjectOperation("photos", "src.txt", "dst.txt"), s3Error(404, "NoSuchKey"));
        assertInstanceOf(ObjectNotFoundException.class, copyMissing);
        assertTrue(copyMissing.getMessage().contains("src.txt"));

        assertInstanceOf(BucketNotEmptyException.class,
                interceptor.translate(new DeleteBucketOperation("photos"), s3Error(409, "BucketNotEmpty")));

        Throwable denied = interceptor.translate(new BucketExistsOperation("photos"), s3Error(403, "AccessDenied"));
        assertInstanceOf(BackendException.class, denied);
        assertEquals(502, ((GatewayException) denied).getHttpStatus());

        Throwable other = interceptor.translate(new BucketExistsOperation("photos"), s3Error(500, "InternalError"));
        assertEquals("BackendError", ((GatewayException) other).getErrorCode());
    }

    @Test
    @DisplayName("Missing credentials fail construction")
    void testMissingCredentials() {
        BackendConfig config = new BackendConfig("broken", "s3").with(S3StorageBackend.ENDPOINT, "localhost:9000");
        assertThrows(IllegalArgumentException.class, () -> new S3StorageBackend(config));
    }

    @Test
    @DisplayName("SPI 发现 s3 工厂, unreachable endpoint surfaces as BackendError")
    void testUnreachableEndpoint() {
        BackendConfig config = new BackendConfig("offline", "s3")
                .with(S3StorageBackend.ENDPOINT, "127.0.0.1:1")
                .with(S3StorageBackend.USE_SSL, false)
                .with(S3StorageBackend.FORCE_PATH_STYLE, true)
                .with(S3StorageBackend.ACCESS_KEY, "test")
                .with(S3StorageBackend.SECRET_KEY, "test-secret")
                .with(S3StorageBackend.BUCKET_PREFIX, "bkt");

        StorageBackend backend = BackendFactoryLoader.load().get("s3").createBackend(config);
        try {
            assertEquals("s3", backend.getBackendType());
            BackendException e = assertThrows(BackendException.class,
                    () -> backend.bucketExists("photos").block(Duration.ofSeconds(30)));
            assertEquals(502, e.getHttpStatus());
        } finally {
            backend.shutdown().block();
        }
    }

    @Test
    @DisplayName("Listing a missing remote bucket fails instead of returning nothing")
    void testListMissingBucket() {
        S3AsyncClient client = mock(S3AsyncClient.class);
        when(client.listObjectsV2Paginator(any(ListObjectsV2Request.class)))
                .thenAnswer(inv -> new ListObjectsV2Publisher(client, inv.getArgument(0)));
        when(client.listObjectsV2(any(ListObjectsV2Request.class)))
                .thenReturn(CompletableFuture.failedFuture(NoSuchBucketException.builder()
                        .statusCode(404)
                        .awsErrorDetails(AwsErrorDetails.builder().errorCode("NoSuchBucket").build())
                        .message("The specified bucket does not exist")
                        .build()));

        S3BackendContext context = S3BackendContext.builder()
                .config(new BackendConfig("remote", "s3"))
                .s3Client(client)
                .bucketPrefix("team")
                .build();
        OperationHandlerRegistry registry = new OperationHandlerRegistry();
        registry.register(new S3ListObjectsHandler());
        registry.addInterceptor(interceptor);
        context.setHandlerRegistry(registry);

        BucketNotFoundException error = assertThrows(BucketNotFoundException.class,
                () -> context.execute(new ListObjectsOperation("photos", "")).block(Duration.ofSeconds(5)));
        assertTrue(error.getMessage().contains("photos"));

        ArgumentCaptor<ListObjectsV2Request> request = ArgumentCaptor.forClass(ListObjectsV2Request.class);
        verify(client).listObjectsV2(request.capture());
        assertEquals("team-photos", request.getValue().bucket());
        assertNull(request.getValue().prefix());
    }

    private static S3Exception s3Error(int status, String code) {
        AwsErrorDetails.Builder details = AwsErrorDetails.builder().errorMessage("remote error");
        if (code != null) {
            details.errorCode(code);
        }
        return (S3Exception) S3Exception.builder()
                .statusCode(status)
                .awsErrorDetails(details.build())
                .message("remote error")
                .build();
    }
}
