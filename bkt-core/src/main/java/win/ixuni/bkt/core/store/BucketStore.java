package win.ixuni.bkt.core.store;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.model.Bucket;

/**
 * Bucket 元数据存储
 */
public interface BucketStore {

    /**
     * Insert a new bucket record
     *
     * @return the stored record, or {@code BucketAlreadyExistsException} when the name is taken
     */
    Mono<Bucket> insert(Bucket bucket);

    Mono<Bucket> findByName(String name);

    Mono<Bucket> findById(String id);

    /**
     * All buckets ordered by name
     */
    Flux<Bucket> findAll();

    /**
     * Buckets of one owner ordered by name
     */
    Flux<Bucket> findByOwner(String ownerId);

    /**
     * Delete a bucket that owns no objects. The object count and the delete run in one
     * transaction; the bucket policy goes with the bucket.
     *
     * @return empty on success, {@code BucketNotEmptyException} when objects remain,
     *         {@code BucketNotFoundException} when the record is gone
     */
    Mono<Void> deleteIfEmpty(Bucket bucket);

    /**
     * Number of buckets bound to an S3 configuration
     */
    Mono<Long> countByS3Config(String s3ConfigId);
}
