package win.ixuni.bkt.server.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.backend.local.LocalBackendFactory;
import win.ixuni.bkt.core.backend.BackendFactory;
import win.ixuni.bkt.core.backend.StorageBackend;
import win.ixuni.bkt.core.config.BackendConfig;
import win.ixuni.bkt.core.exception.AccessDeniedException;
import win.ixuni.bkt.core.exception.S3ConfigNotFoundException;
import win.ixuni.bkt.core.exception.ValidationException;
import win.ixuni.bkt.core.model.Bucket;
import win.ixuni.bkt.core.model.S3Configuration;
import win.ixuni.bkt.core.model.StorageBackendType;
import win.ixuni.bkt.core.policy.Identity;
import win.ixuni.bkt.core.store.memory.MemoryS3ConfigStore;
import win.ixuni.bkt.core.store.memory.MemoryStoreContext;
import win.ixuni.bkt.server.config.GatewayProperties;
import win.ixuni.bkt.server.registry.BackendRegistry;
import win.ixuni.bkt.server.resolver.ConfigCache;
import win.ixuni.bkt.server.resolver.ConfigResolver;
import win.ixuni.bkt.server.security.AuthorizationService;
import win.ixuni.bkt.server.security.CredentialCipher;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class S3ConfigServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final Identity admin = Identity.builder().userId("u-admin").username("root").admin(true).build();
    private final Identity user = Identity.builder().userId("u-1").username("alice").admin(false).build();

    @TempDir
    Path localRoot;

    private MemoryS3ConfigStore store;
    private CredentialCipher cipher;
    private ConfigCache cache;
    private BackendRegistry registry;
    private ConfigResolver resolver;
    private List<StorageBackend> built;
    private S3ConfigService service;

    @BeforeEach
    void setUp() {
        store = spy(new MemoryS3ConfigStore(new MemoryStoreContext()));
        cipher = new CredentialCipher("test-secret");
        cache = new ConfigCache(Duration.ofMinutes(5), Clock.systemUTC());
        GatewayProperties properties = new GatewayProperties();
        properties.getStorage().setLocalRoot(localRoot.toString());
        built = new CopyOnWriteArrayList<>();
        BackendFactory s3Factory = mock(BackendFactory.class);
        when(s3Factory.getBackendType()).thenReturn("s3");
        when(s3Factory.createBackend(any())).thenAnswer(invocation -> {
            BackendConfig config = invocation.getArgument(0);
            StorageBackend backend = mock(StorageBackend.class);
            when(backend.getBackendName()).thenReturn(config.getName());
            when(backend.initialize()).thenReturn(Mono.empty());
            when(backend.shutdown()).thenReturn(Mono.empty());
            built.add(backend);
            return backend;
        });
        registry = new BackendRegistry(properties, Map.of("local", new LocalBackendFactory(), "s3", s3Factory));
        registry.initialize();
        resolver = new ConfigResolver(store, cache, cipher, registry, properties);

        AuthorizationService authorization = mock(AuthorizationService.class);
        when(authorization.requireAdmin(any())).thenAnswer(invocation -> {
            Identity identity = invocation.getArgument(0);
            return identity.isAdmin()
                    ? Mono.empty()
                    : Mono.error(new AccessDeniedException("Administrator privileges required"));
        });
        service = new S3ConfigService(store, cipher, cache, registry, authorization);
    }

    @AfterEach
    void tearDown() {
        registry.shutdown();
    }

    @Test
    @DisplayName("Create stores encrypted credentials")
    void testCreateEncrypts() {
        S3Configuration created = service.create(admin, changes("primary", "http://minio:9000")).block(TIMEOUT);

        assertNotNull(created);
        assertNotEquals("AKIA1", created.getAccessKeyId());
        assertEquals("AKIA1", cipher.decrypt(created.getAccessKeyId()));
        assertEquals("secret1", cipher.decrypt(created.getSecretAccessKey()));
        assertTrue(created.isUseSsl());
    }

    @Test
    @DisplayName("Create requires name, endpoint and both keys")
    void testCreateValidation() {
        assertThrows(ValidationException.class,
                () -> service.create(admin, changes("", "http://minio:9000")).block(TIMEOUT));
        S3ConfigService.Changes noKeys = new S3ConfigService.Changes("primary", "http://minio:9000", null,
                null, null, null, null, null, null);
        assertThrows(ValidationException.class, () -> service.create(admin, noKeys).block(TIMEOUT));
    }

    @Test
    @DisplayName("Non-admins are refused")
    void testAdminOnly() {
        assertThrows(AccessDeniedException.class,
                () -> service.create(user, changes("primary", "http://minio:9000")).block(TIMEOUT));
        assertThrows(AccessDeniedException.class, () -> service.list(user).collectList().block(TIMEOUT));
        verify(store, never()).insert(any());
    }

    @Test
    @DisplayName("Update empties the cache and closes the backend built from the old settings")
    void testUpdateInvalidatesAndEvicts() {
        S3Configuration config = service.create(admin, changes("primary", "http://minio:9000")).block(TIMEOUT);
        Bucket bucket = s3Bucket(config.getId());
        StorageBackend before = resolver.resolve(bucket).block(TIMEOUT);
        assertEquals(1, cache.size());

        S3ConfigService.Changes newEndpoint = new S3ConfigService.Changes(null, "http://minio-2:9000", null,
                null, null, null, null, null, null);
        service.update(admin, config.getId(), newEndpoint).block(TIMEOUT);

        assertEquals(0, cache.size());
        assertNotNull(before);
        verify(before).shutdown();
        assertEquals(0, registry.getPooledCount());

        StorageBackend after = resolver.resolve(bucket).block(TIMEOUT);
        assertNotSame(before, after);
        // once to resolve, once inside update, once more after the cache was emptied
        verify(store, times(3)).findById(config.getId());
    }

    @Test
    @DisplayName("Update keeps the stored keys when none are given")
    void testUpdateKeepsKeys() {
        S3Configuration config = service.create(admin, changes("primary", "http://minio:9000")).block(TIMEOUT);
        S3ConfigService.Changes rename = new S3ConfigService.Changes("renamed", null, null,
                "", null, null, null, null, null);

        S3Configuration updated = service.update(admin, config.getId(), rename).block(TIMEOUT);

        assertNotNull(updated);
        assertEquals("renamed", updated.getName());
        assertEquals("http://minio:9000", updated.getEndpoint());
        assertEquals(config.getAccessKeyId(), updated.getAccessKeyId());
    }

    @Test
    @DisplayName("Delete empties the cache and closes the pooled backend")
    void testDeleteEvicts() {
        S3Configuration config = service.create(admin, changes("primary", "http://minio:9000")).block(TIMEOUT);
        StorageBackend pooled = resolver.resolve(s3Bucket(config.getId())).block(TIMEOUT);

        service.delete(admin, config.getId()).block(TIMEOUT);

        assertNotNull(pooled);
        verify(pooled).shutdown();
        assertEquals(0, cache.size());
        assertEquals(0, registry.getPooledCount());
        assertThrows(S3ConfigNotFoundException.class,
                () -> service.get(admin, config.getId()).block(TIMEOUT));
    }

    @Test
    @DisplayName("Updating one configuration leaves other pooled backends open")
    void testEvictionScopedToConfig() {
        S3Configuration first = service.create(admin, changes("first", "http://minio-a:9000")).block(TIMEOUT);
        S3Configuration second = service.create(admin, changes("second", "http://minio-b:9000")).block(TIMEOUT);
        resolver.resolve(s3Bucket(first.getId())).block(TIMEOUT);
        StorageBackend untouched = resolver.resolve(s3Bucket(second.getId())).block(TIMEOUT);

        service.update(admin, first.getId(), new S3ConfigService.Changes(null, null, "eu-west-1",
                null, null, null, null, null, null)).block(TIMEOUT);

        assertNotNull(untouched);
        verify(untouched, never()).shutdown();
        assertEquals(1, registry.getPooledCount());
        assertEquals(2, built.size());
    }

    private static S3ConfigService.Changes changes(String name, String endpoint) {
        return new S3ConfigService.Changes(name, endpoint, "us-east-1", "AKIA1", "secret1",
                "", null, false, false);
    }

    private static Bucket s3Bucket(String s3ConfigId) {
        return Bucket.builder()
                .id("bucket-" + s3ConfigId)
                .name("photos")
                .storageBackend(StorageBackendType.S3)
                .s3ConfigId(s3ConfigId)
                .build();
    }
}
