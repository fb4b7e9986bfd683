package win.ixuni.bkt.server.resolver;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.backend.local.LocalBackendFactory;
import win.ixuni.bkt.backend.s3.S3StorageBackend;
import win.ixuni.bkt.core.backend.BackendFactory;
import win.ixuni.bkt.core.backend.StorageBackend;
import win.ixuni.bkt.core.config.BackendConfig;
import win.ixuni.bkt.core.exception.BackendException;
import win.ixuni.bkt.core.model.Bucket;
import win.ixuni.bkt.core.model.S3Configuration;
import win.ixuni.bkt.core.model.StorageBackendType;
import win.ixuni.bkt.core.store.memory.MemoryS3ConfigStore;
import win.ixuni.bkt.core.store.memory.MemoryStoreContext;
import win.ixuni.bkt.server.config.GatewayProperties;
import win.ixuni.bkt.server.registry.BackendRegistry;
import win.ixuni.bkt.server.security.CredentialCipher;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class ConfigResolverTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);
    private static final String BROKEN_ENDPOINT = "http://broken.invalid";

    @TempDir
    Path localRoot;

    private ConfigCacheTest.MutableClock clock;
    private ConfigCache cache;
    private MemoryS3ConfigStore store;
    private CredentialCipher cipher;
    private GatewayProperties properties;
    private RecordingS3Factory s3Factory;
    private BackendRegistry registry;
    private ConfigResolver resolver;

    @BeforeEach
    void setUp() {
        clock = new ConfigCacheTest.MutableClock(Instant.parse("2024-05-01T08:00:00Z"));
        cache = new ConfigCache(Duration.ofMinutes(5), clock);
        store = spy(new MemoryS3ConfigStore(new MemoryStoreContext()));
        cipher = new CredentialCipher("test-secret");
        properties = new GatewayProperties();
        properties.getStorage().setLocalRoot(localRoot.toString());
        s3Factory = new RecordingS3Factory();
        registry = new BackendRegistry(properties, Map.of("local", new LocalBackendFactory(), "s3", s3Factory));
        registry.initialize();
        resolver = new ConfigResolver(store, cache, cipher, registry, properties);
    }

    @AfterEach
    void tearDown() {
        registry.shutdown();
    }

    @Test
    @DisplayName("Second resolution within the TTL is served from the cache")
    void testCacheHit() {
        S3Configuration config = storeConfig("primary", "http://minio:9000", false);
        Bucket bucket = s3Bucket(config.getId());

        StorageBackend first = resolver.resolve(bucket).block(TIMEOUT);
        StorageBackend second = resolver.resolve(bucket).block(TIMEOUT);

        assertSame(first, second);
        verify(store, times(1)).findById(config.getId());
        assertEquals(1, cache.size());
        assertEquals(1, s3Factory.created.size());
    }

    @Test
    @DisplayName("Decrypted credentials reach the backend config")
    void testCredentialsDecrypted() {
        S3Configuration config = storeConfig("primary", "http://minio:9000", false);

        resolver.resolve(s3Bucket(config.getId())).block(TIMEOUT);

        BackendConfig built = s3Factory.created.get(0);
        assertEquals("s3-" + config.getId(), built.getName());
        assertEquals("AKIAPRIMARY", built.getString(S3StorageBackend.ACCESS_KEY, null));
        assertEquals("secret-primary", built.getString(S3StorageBackend.SECRET_KEY, null));
    }

    @Test
    @DisplayName("An expired entry goes back to the store")
    void testCacheExpiry() {
        S3Configuration config = storeConfig("primary", "http://minio:9000", false);
        Bucket bucket = s3Bucket(config.getId());

        resolver.resolve(bucket).block(TIMEOUT);
        clock.advance(Duration.ofMinutes(4));
        resolver.resolve(bucket).block(TIMEOUT);
        verify(store, times(1)).findById(config.getId());

        clock.advance(Duration.ofMinutes(1));
        resolver.resolve(bucket).block(TIMEOUT);
        verify(store, times(2)).findById(config.getId());
    }

    @Test
    @DisplayName("Invalidation forces a fresh lookup")
    void testInvalidation() {
        S3Configuration config = storeConfig("primary", "http://minio:9000", false);
        Bucket bucket = s3Bucket(config.getId());
        resolver.resolve(bucket).block(TIMEOUT);

        store.update(config.toBuilder().endpoint("http://minio-2:9000").build()).block(TIMEOUT);
        cache.invalidateAll();
        resolver.resolve(bucket).block(TIMEOUT);

        verify(store, times(2)).findById(config.getId());
        assertEquals("http://minio-2:9000", s3Factory.created.get(1).getString(S3StorageBackend.ENDPOINT, null));
    }

    @Test
    @DisplayName("A bucket recorded as s3 fails with a backend error rather than landing on local disk")
    void testExplicitS3Failure() {
        S3Configuration config = storeConfig("broken", BROKEN_ENDPOINT, false);

        BackendException error = assertThrows(BackendException.class,
                () -> resolver.resolve(s3Bucket(config.getId())).block(TIMEOUT));

        assertTrue(error.getMessage().startsWith("S3 storage backend configuration error"));
        assertThrows(BackendException.class,
                () -> resolver.resolve(StorageBackendType.S3, config.getId()).block(TIMEOUT));
        assertEquals(0, registry.getPooledCount());
    }

    @Test
    @DisplayName("Local buckets never touch the S3 configuration store")
    void testLocalBucket() {
        Bucket bucket = Bucket.builder().id("b-1").name("notes").storageBackend(StorageBackendType.LOCAL).build();

        assertSame(registry.getLocalBackend(), resolver.resolve(bucket).block(TIMEOUT));
        verifyNoInteractions(store);
    }

    @Test
    @DisplayName("Default s3 backend falls back to local storage when it cannot be built")
    void testDefaultFallsBackToLocal() {
        properties.getStorage().setDefaultBackend("s3");
        properties.getS3().setEndpoint(BROKEN_ENDPOINT);

        ConfigResolver.ResolvedBackend resolved = resolver.resolveDefault().block(TIMEOUT);

        assertNotNull(resolved);
        assertEquals(StorageBackendType.LOCAL, resolved.type());
        assertSame(registry.getLocalBackend(), resolved.backend());
    }

    @Test
    @DisplayName("Default s3 backend uses the stored default configuration")
    void testDefaultUsesStoredDefault() {
        properties.getStorage().setDefaultBackend("s3");
        S3Configuration config = storeConfig("primary", "http://minio:9000", true);

        ConfigResolver.ResolvedBackend resolved = resolver.resolveDefault().block(TIMEOUT);

        assertNotNull(resolved);
        assertEquals(StorageBackendType.S3, resolved.type());
        assertEquals("s3-" + config.getId(), resolved.backend().getBackendName());
        assertTrue(cache.get(ConfigCache.DEFAULT_KEY).isPresent());
    }

    @Test
    @DisplayName("Environment settings apply when no default is stored, and are not cached")
    void testEnvironmentFallback() {
        properties.getS3().setEndpoint("http://env-minio:9000");
        properties.getS3().setAccessKey("AKIAENV");
        properties.getS3().setSecretKey("secret-env");

        ResolvedS3Config first = resolver.resolveS3Config(null).block(TIMEOUT);
        StorageBackend backend = resolver.resolve(StorageBackendType.S3, null).block(TIMEOUT);

        assertNotNull(first);
        assertEquals(ConfigResolver.ENV_SOURCE, first.getSource());
        assertEquals("http://env-minio:9000", first.getEndpoint());
        assertEquals("AKIAENV", first.getAccessKey());
        assertNotNull(backend);
        assertEquals("s3-env", backend.getBackendName());
        assertEquals(0, cache.size());
        verify(store, times(2)).findDefault();
    }

    private S3Configuration storeConfig(String name, String endpoint, boolean isDefault) {
        return store.insert(S3Configuration.builder()
                .name(name)
                .endpoint(endpoint)
                .region("us-east-1")
                .accessKeyId(cipher.encrypt("AKIA" + name.toUpperCase()))
                .secretAccessKey(cipher.encrypt("secret-" + name))
                .bucketPrefix("")
                .isDefault(isDefault)
                .build()).block(TIMEOUT);
    }

    private static Bucket s3Bucket(String s3ConfigId) {
        return Bucket.builder()
                .id("bucket-" + s3ConfigId)
                .name("photos")
                .storageBackend(StorageBackendType.S3)
                .s3ConfigId(s3ConfigId)
                .build();
    }

    /**
     * Builds mock backends and remembers every config it was asked for
     */
    static final class RecordingS3Factory implements BackendFactory {

        final List<BackendConfig> created = new CopyOnWriteArrayList<>();

        @Override
        public String getBackendType() {
            return "s3";
        }

        @Override
        public StorageBackend createBackend(BackendConfig config) {
            if (BROKEN_ENDPOINT.equals(config.getString(S3StorageBackend.ENDPOINT, null))) {
                throw new IllegalArgumentException("Unable to reach " + BROKEN_ENDPOINT);
            }
            created.add(config);
            StorageBackend backend = mock(StorageBackend.class);
            when(backend.getBackendName()).thenReturn(config.getName());
            when(backend.getBackendType()).thenReturn("s3");
            when(backend.initialize()).thenReturn(Mono.empty());
            when(backend.shutdown()).thenReturn(Mono.empty());
            return backend;
        }
    }
}
