package win.ixuni.bkt.core.store;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.model.StoredObject;

import java.util.Collection;

/**
 * 对象元数据存储
 * <p>
 * {@code (bucketId, key)} is unique; writes are last-write-wins upserts.
 */
public interface ObjectStore {

    /**
     * Insert or replace the record of {@code (bucketId, key)}.
     * <p>
     * An existing record keeps its id and creation time; size, type, hashes and storage path
     * are replaced.
     *
     * @return the stored record
     */
    Mono<StoredObject> upsert(StoredObject object);

    Mono<StoredObject> find(String bucketId, String key);

    /**
     * Records whose key starts with {@code prefix}, ordered by key
     *
     * @param prefix literal prefix, LIKE wildcards are escaped by the store
     * @param limit  maximum number of records
     */
    Flux<StoredObject> list(String bucketId, String prefix, int limit);

    /**
     * @return true when a record was removed
     */
    Mono<Boolean> delete(String bucketId, String key);

    /**
     * @return number of records removed
     */
    Mono<Long> deleteKeys(String bucketId, Collection<String> keys);

    /**
     * Point an existing record at a new key
     *
     * @return the updated record, empty when the source record does not exist
     */
    Mono<StoredObject> rename(String bucketId, String oldKey, String newKey, String storagePath);

    Mono<Long> countByBucket(String bucketId);
}
