package win.ixuni.bkt.core.store.memory;

import org.junit.jupiter.api.*;
import win.ixuni.bkt.core.exception.BucketAlreadyExistsException;
import win.ixuni.bkt.core.exception.BucketNotEmptyException;
import win.ixuni.bkt.core.exception.ResourceInUseException;
import win.ixuni.bkt.core.model.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 内存存储测试
 */
public class MemoryStoreTest {

    private MemoryStoreContext ctx;
    private MemoryBucketStore buckets;
    private MemoryObjectStore objects;
    private MemoryPolicyStore policies;
    private MemoryS3ConfigStore s3Configs;
    private MemoryUploadStore uploads;
    private MemoryUserStore users;

    @BeforeEach
    void setUp() {
        ctx = new MemoryStoreContext();
        buckets = new MemoryBucketStore(ctx);
        objects = new MemoryObjectStore(ctx);
        policies = new MemoryPolicyStore(ctx);
        s3Configs = new MemoryS3ConfigStore(ctx);
        uploads = new MemoryUploadStore(ctx);
        users = new MemoryUserStore(ctx);
    }

    private Bucket bucket(String name) {
        return buckets.insert(Bucket.builder().name(name).ownerId("u1").region("us-east-1").build()).block();
    }

    private StoredObject object(String bucketId, String key, long size, String etag) {
        return StoredObject.builder()
                .bucketId(bucketId)
                .key(key)
                .size(size)
                .etag(etag)
                .contentType("text/plain")
                .storagePath(key)
                .build();
    }

    @Test
    @DisplayName("Upsert on (bucket, key) is idempotent and last-write-wins")
    void testUpsertIdempotence() {
        Bucket bucket = bucket("alpha");

        StoredObject first = objects.upsert(object(bucket.getId(), "a.txt", 3, "e1")).block();
        StoredObject again = objects.upsert(object(bucket.getId(), "a.txt", 3, "e1")).block();
        StoredObject changed = objects.upsert(object(bucket.getId(), "a.txt", 9, "e2")).block();

        assertNotNull(first);
        assertNotNull(again);
        assertNotNull(changed);
        assertEquals(first.getId(), again.getId());
        assertEquals(first.getId(), changed.getId());
        assertEquals(1L, objects.countByBucket(bucket.getId()).block());

        StoredObject stored = objects.find(bucket.getId(), "a.txt").block();
        assertNotNull(stored);
        assertEquals(9, stored.getSize());
        assertEquals("e2", stored.getEtag());
    }

    @Test
    @DisplayName("Listing is ordered by key, prefix-filtered and limited")
    void testListOrderedByKey() {
        Bucket bucket = bucket("alpha");
        for (String key : List.of("b/2", "a/1", "b/1", "c", "b/3")) {
            objects.upsert(object(bucket.getId(), key, 1, "e")).block();
        }

        List<String> all = objects.list(bucket.getId(), "", 1000).map(StoredObject::getKey).collectList().block();
        assertEquals(List.of("a/1", "b/1", "b/2", "b/3", "c"), all);

        List<String> underB = objects.list(bucket.getId(), "b/", 2).map(StoredObject::getKey).collectList().block();
        assertEquals(List.of("b/1", "b/2"), underB);
    }

    @Test
    @DisplayName("删除非空 bucket 被拒绝")
    void testDeleteBucketRequiresEmpty() {
        Bucket bucket = bucket("alpha");
        objects.upsert(object(bucket.getId(), "a.txt", 1, "e")).block();

        assertThrows(BucketNotEmptyException.class, () -> buckets.deleteIfEmpty(bucket).block());

        objects.delete(bucket.getId(), "a.txt").block();
        buckets.deleteIfEmpty(bucket).block();
        assertNull(buckets.findByName("alpha").block());
    }

    @Test
    void testDuplicateBucketName() {
        bucket("alpha");
        assertThrows(BucketAlreadyExistsException.class, () -> bucket("alpha"));
    }

    @Test
    @DisplayName("Only one default S3 configuration")
    void testSingleDefault() {
        S3Configuration first = s3Configs.insert(S3Configuration.builder().name("one").isDefault(true).build()).block();
        S3Configuration second = s3Configs.insert(S3Configuration.builder().name("two").isDefault(true).build()).block();

        assertNotNull(first);
        assertNotNull(second);
        S3Configuration current = s3Configs.findDefault().block();
        assertNotNull(current);
        assertEquals(second.getId(), current.getId());
        assertFalse(s3Configs.findById(first.getId()).block().isDefault());
    }

    @Test
    @DisplayName("S3 configuration referenced by a bucket cannot be deleted")
    void testS3ConfigInUse() {
        S3Configuration config = s3Configs.insert(S3Configuration.builder().name("remote").build()).block();
        buckets.insert(Bucket.builder().name("remote-bucket").storageBackend(StorageBackendType.S3)
                .s3ConfigId(config.getId()).build()).block();

        assertThrows(ResourceInUseException.class, () -> s3Configs.delete(config.getId()).block());
    }

    @Test
    @DisplayName("Attached policy cannot be deleted")
    void testPolicyAttachment() {
        User user = users.save(User.builder().id("u1").username("alice").build()).block();
        Policy policy = policies.insert(Policy.builder().name("read").document("{}").build()).block();

        policies.attach(user.getId(), policy.getId()).block();
        policies.attach(user.getId(), policy.getId()).block();
        assertEquals(1, policies.findByUser(user.getId()).collectList().block().size());

        assertThrows(ResourceInUseException.class, () -> policies.delete(policy.getId()).block());

        assertTrue(policies.detach(user.getId(), policy.getId()).block());
        policies.delete(policy.getId()).block();
        assertNull(policies.findById(policy.getId()).block());
    }

    @Test
    @DisplayName("进度更新只增不减，且不覆盖终态")
    void testUploadProgressMonotonic() {
        Upload upload = uploads.insert(Upload.builder().userId("u1").bucketName("alpha").objectKey("k")
                .totalSize(100).status(UploadStatus.PROCESSING).build()).block();

        uploads.updateProgress(upload.getId(), 40).block();
        uploads.updateProgress(upload.getId(), 20).block();
        assertEquals(40, uploads.findById(upload.getId()).block().getUploadedSize());

        Upload done = uploads.findById(upload.getId()).block().toBuilder()
                .status(UploadStatus.COMPLETED).uploadedSize(100).build();
        uploads.update(done).block();
        uploads.updateProgress(upload.getId(), 60).block();

        Upload reloaded = uploads.findById(upload.getId()).block();
        assertEquals(UploadStatus.COMPLETED, reloaded.getStatus());
        assertEquals(100, reloaded.getUploadedSize());
        assertEquals(100.0, reloaded.getProgressPercent(), 0.0001);
    }

    @Test
    @DisplayName("Upload lookup is scoped to its owner")
    void testUploadOwnerScope() {
        Upload upload = uploads.insert(Upload.builder().userId("u1").bucketName("alpha").objectKey("k").build()).block();

        assertNotNull(uploads.findByIdAndUser(upload.getId(), "u1").block());
        assertNull(uploads.findByIdAndUser(upload.getId(), "u2").block());
        assertEquals(1, uploads.findByUser("u1", UploadStatus.PENDING, 50).collectList().block().size());
        assertEquals(0, uploads.findByUser("u1", UploadStatus.FAILED, 50).collectList().block().size());
    }
}
