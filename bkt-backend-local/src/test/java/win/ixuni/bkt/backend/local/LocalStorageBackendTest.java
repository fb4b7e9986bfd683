package win.ixuni.bkt.backend.local;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.publisher.Flux;
import win.ixuni.bkt.core.backend.BackendFactory;
import win.ixuni.bkt.core.backend.BackendFactoryLoader;
import win.ixuni.bkt.core.backend.StorageBackend;
import win.ixuni.bkt.core.config.BackendConfig;
import win.ixuni.bkt.core.exception.BucketNotEmptyException;
import win.ixuni.bkt.core.exception.BucketNotFoundException;
import win.ixuni.bkt.core.exception.ObjectNotFoundException;
import win.ixuni.bkt.core.exception.ValidationException;
import win.ixuni.bkt.core.model.ObjectContent;
import win.ixuni.bkt.core.model.ObjectInfo;
import win.ixuni.bkt.core.util.Digests;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class LocalStorageBackendTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    @TempDir
    Path root;

    private StorageBackend backend;

    @BeforeEach
    void setUp() {
        backend = new LocalStorageBackend(new BackendConfig("local-test", "local")
                .with(LocalStorageBackend.ROOT_PATH, root.toString()));
        backend.initialize().block(TIMEOUT);
        backend.createBucket("photos", "us-east-1").block(TIMEOUT);
    }

    @Test
    @DisplayName("SPI 发现 local 工厂")
    void testFactoryDiscovered() {
        Map<String, BackendFactory> factories = BackendFactoryLoader.load();
        assertTrue(factories.containsKey("local"));
        assertInstanceOf(LocalStorageBackend.class,
                factories.get("local").createBackend(new BackendConfig("x", "local")
                        .with(LocalStorageBackend.ROOT_PATH, root.toString())));
    }

    @Test
    @DisplayName("Put then get returns same bytes and MD5 etag")
    void testPutGetRoundTrip() {
        byte[] data = "hello local backend".getBytes(StandardCharsets.UTF_8);
        put("a/b/hello.txt", data, "text/plain");

        ObjectContent content = backend.getObject("photos", "a/b/hello.txt").block(TIMEOUT);
        assertNotNull(content);
        assertArrayEquals(data, drain(content.getContent()));
        assertEquals(data.length, content.getInfo().getSize());
        assertEquals(Digests.md5Hex(data), content.getInfo().getEtag());
        assertEquals("text/plain", content.getInfo().getContentType());

        ObjectInfo again = backend.getObjectInfo("photos", "a/b/hello.txt").block(TIMEOUT);
        assertEquals(content.getInfo().getEtag(), again.getEtag());
    }

    @Test
    @DisplayName("Content stream can be subscribed twice")
    void testContentResubscribe() {
        byte[] data = new byte[200_000];
        for (int i = 0; i < data.length; i++) {
            data[i] = (byte) i;
        }
        put("big.bin", data, "application/octet-stream");

        ObjectContent content = backend.getObject("photos", "big.bin").block(TIMEOUT);
        assertArrayEquals(data, drain(content.getContent()));
        assertArrayEquals(data, drain(content.getContent()));
    }

    @Test
    @DisplayName("Size mismatch leaves no object behind")
    void testSizeMismatch() {
        Flux<ByteBuffer> body = Flux.just(ByteBuffer.wrap(new byte[10]));
        ValidationException e = assertThrows(ValidationException.class,
                () -> backend.putObject("photos", "short.bin", body, 20, null).block(TIMEOUT));
        assertEquals("IncompleteBody", e.getErrorCode());
        assertFalse(Files.exists(root.resolve("photos/short.bin")));
        assertEquals(0, root.resolve(".bkt-tmp").toFile().list().length);
    }

    @Test
    @DisplayName("Put into missing bucket fails with NoSuchBucket")
    void testPutMissingBucket() {
        assertThrows(BucketNotFoundException.class,
                () -> put("missing", "x.txt", new byte[]{1}, null));
    }

    @Test
    @DisplayName("Unknown content type is guessed from the extension")
    void testContentTypeFallback() throws Exception {
        Path file = root.resolve("photos/readme.html");
        Files.writeString(file, "<p>hi</p>");

        ObjectInfo info = backend.getObjectInfo("photos", "readme.html").block(TIMEOUT);
        assertEquals("text/html", info.getContentType());
        assertEquals(Digests.md5Hex("<p>hi</p>".getBytes(StandardCharsets.UTF_8)), info.getEtag());
    }

    @Test
    @DisplayName("Keys escaping the bucket are rejected")
    void testPathEscape() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> put("../outside.txt", new byte[]{1}, null));
        assertEquals("InvalidKey", e.getErrorCode());
        assertFalse(Files.exists(root.resolve("outside.txt")));
    }

    @Test
    @DisplayName("Copy keeps source, duplicates content and etag")
    void testCopy() {
        byte[] data = "copy me".getBytes(StandardCharsets.UTF_8);
        put("src.txt", data, "text/plain");

        backend.copyObject("photos", "src.txt", "dir/dst.txt").block(TIMEOUT);

        ObjectInfo src = backend.getObjectInfo("photos", "src.txt").block(TIMEOUT);
        ObjectInfo dst = backend.getObjectInfo("photos", "dir/dst.txt").block(TIMEOUT);
        assertEquals(src.getEtag(), dst.getEtag());
        assertEquals("text/plain", dst.getContentType());
        assertArrayEquals(data, drain(backend.getObject("photos", "dir/dst.txt").block(TIMEOUT).getContent()));
    }

    @Test
    @DisplayName("Copy of missing source fails with NoSuchKey")
    void testCopyMissingSource() {
        assertThrows(ObjectNotFoundException.class,
                () -> backend.copyObject("photos", "nope.txt", "dst.txt").block(TIMEOUT));
    }

    @Test
    @DisplayName("List is sorted by key and filtered by prefix")
    void testList() {
        put("b.txt", new byte[]{1}, null);
        put("a/2.txt", new byte[]{2}, null);
        put("a/1.txt", new byte[]{3}, null);

        List<String> all = keys(backend.listObjects("photos", "").block(TIMEOUT));
        assertEquals(List.of("a/1.txt", "a/2.txt", "b.txt"), all);

        List<String> underA = keys(backend.listObjects("photos", "a/").block(TIMEOUT));
        assertEquals(List.of("a/1.txt", "a/2.txt"), underA);

        assertTrue(backend.listObjects("nothing-here", null).block(TIMEOUT).isEmpty());
    }

    @Test
    @DisplayName("Delete is idempotent and prunes empty directories")
    void testDelete() {
        put("deep/nested/file.txt", new byte[]{1}, null);

        backend.deleteObject("photos", "deep/nested/file.txt").block(TIMEOUT);
        backend.deleteObject("photos", "deep/nested/file.txt").block(TIMEOUT);

        assertFalse(Files.exists(root.resolve("photos/deep")));
        assertThrows(ObjectNotFoundException.class,
                () -> backend.getObjectInfo("photos", "deep/nested/file.txt").block(TIMEOUT));
    }

    @Test
    @DisplayName("删除非空 Bucket 失败")
    void testDeleteBucket() {
        put("keep.txt", new byte[]{1}, null);
        assertThrows(BucketNotEmptyException.class, () -> backend.deleteBucket("photos").block(TIMEOUT));

        backend.deleteObject("photos", "keep.txt").block(TIMEOUT);
        backend.deleteBucket("photos").block(TIMEOUT);
        assertFalse(backend.bucketExists("photos").block(TIMEOUT));
    }

    private void put(String key, byte[] data, String contentType) {
        put("photos", key, data, contentType);
    }

    private void put(String bucket, String key, byte[] data, String contentType) {
        Flux<ByteBuffer> body = Flux.just(ByteBuffer.wrap(data, 0, data.length / 2),
                ByteBuffer.wrap(data, data.length / 2, data.length - data.length / 2));
        backend.putObject(bucket, key, body, data.length, contentType).block(TIMEOUT);
    }

    private static byte[] drain(Flux<ByteBuffer> content) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        content.doOnNext(buffer -> {
            byte[] bytes = new byte[buffer.remaining()];
            buffer.get(bytes);
            out.writeBytes(bytes);
        }).blockLast(TIMEOUT);
        return out.toByteArray();
    }

    private static List<String> keys(List<ObjectInfo> objects) {
        return objects.stream().map(ObjectInfo::getKey).collect(Collectors.toList());
    }
}
