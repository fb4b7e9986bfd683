package win.ixuni.bkt.store.postgresql;

import io.r2dbc.spi.Row;
import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.exception.ObjectAlreadyExistsException;
import win.ixuni.bkt.core.model.StoredObject;
import win.ixuni.bkt.core.store.ObjectStore;
import win.ixuni.bkt.core.util.ValidationUtils;

import java.time.Instant;
import java.util.Collection;
import java.util.UUID;

import static win.ixuni.bkt.store.postgresql.PostgresStoreContext.param;

/**
 * PostgreSQL 对象元数据存储
 * <p>
 * Upsert on {@code (bucket_id, key)}; the last write wins and keeps the row id.
 */
@RequiredArgsConstructor
public class PostgresObjectStore implements ObjectStore {

    private static final String COLUMNS =
            "id, bucket_id, key, size, content_type, etag, sha256, storage_path, created_at, updated_at";

    private final PostgresStoreContext ctx;

    @Override
    public Mono<StoredObject> upsert(StoredObject object) {
        Instant now = ctx.now();
        String id = object.getId() != null ? object.getId() : UUID.randomUUID().toString();
        return ctx.queryOne("INSERT INTO objects (" + COLUMNS + ") "
                        + "VALUES ($1, $2, $3, $4, $5, $6, $7, $8, $9, $9) "
                        + "ON CONFLICT (bucket_id, key) DO UPDATE SET "
                        + "size = EXCLUDED.size, content_type = EXCLUDED.content_type, etag = EXCLUDED.etag, "
                        + "sha256 = EXCLUDED.sha256, storage_path = EXCLUDED.storage_path, "
                        + "updated_at = EXCLUDED.updated_at "
                        + "RETURNING " + COLUMNS,
                PostgresObjectStore::map,
                id,
                object.getBucketId(),
                object.getKey(),
                object.getSize(),
                param(object.getContentType(), String.class),
                param(object.getEtag(), String.class),
                param(object.getSha256(), String.class),
                object.getStoragePath(),
                now);
    }

    @Override
    public Mono<StoredObject> find(String bucketId, String key) {
        return ctx.queryOne("SELECT " + COLUMNS + " FROM objects WHERE bucket_id = $1 AND key = $2",
                PostgresObjectStore::map, bucketId, key);
    }

    @Override
    public Flux<StoredObject> list(String bucketId, String prefix, int limit) {
        return ctx.query("SELECT " + COLUMNS + " FROM objects WHERE bucket_id = $1 AND key LIKE $2 "
                        + "ORDER BY key LIMIT $3",
                PostgresObjectStore::map, bucketId, likePrefix(prefix), limit);
    }

    /**
     * LIKE pattern matching every key starting with {@code prefix} literally
     */
    static String likePrefix(String prefix) {
        return ValidationUtils.escapeLikeWildcards(prefix) + "%";
    }

    @Override
    public Mono<Boolean> delete(String bucketId, String key) {
        return ctx.update("DELETE FROM objects WHERE bucket_id = $1 AND key = $2", bucketId, key)
                .map(rows -> rows > 0);
    }

    @Override
    public Mono<Long> deleteKeys(String bucketId, Collection<String> keys) {
        if (keys.isEmpty()) {
            return Mono.just(0L);
        }
        return ctx.update("DELETE FROM objects WHERE bucket_id = $1 AND key = ANY($2)",
                bucketId, keys.toArray(new String[0]));
    }

    @Override
    public Mono<StoredObject> rename(String bucketId, String oldKey, String newKey, String storagePath) {
        return ctx.inTransaction(connection -> PostgresStoreContext.query(connection,
                        "SELECT id FROM objects WHERE bucket_id = $1 AND key = $2 FOR UPDATE",
                        row -> row.get("id", String.class), bucketId, oldKey)
                .next()
                .flatMap(id -> PostgresStoreContext.query(connection,
                                "SELECT COUNT(*) AS n FROM objects WHERE bucket_id = $1 AND key = $2",
                                row -> row.get("n", Long.class), bucketId, newKey)
                        .next()
                        .flatMap(taken -> taken > 0
                                ? Mono.error(new ObjectAlreadyExistsException(bucketId, newKey))
                                : PostgresStoreContext.query(connection,
                                        "UPDATE objects SET key = $2, storage_path = $3, updated_at = $4 "
                                                + "WHERE id = $1 RETURNING " + COLUMNS,
                                        PostgresObjectStore::map, id, newKey, storagePath, ctx.now())
                                .next())));
    }

    @Override
    public Mono<Long> countByBucket(String bucketId) {
        return ctx.queryOne("SELECT COUNT(*) AS n FROM objects WHERE bucket_id = $1",
                row -> row.get("n", Long.class), bucketId);
    }

    static StoredObject map(Row row) {
        Long size = row.get("size", Long.class);
        return StoredObject.builder()
                .id(row.get("id", String.class))
                .bucketId(row.get("bucket_id", String.class))
                .key(row.get("key", String.class))
                .size(size != null ? size : 0L)
                .contentType(row.get("content_type", String.class))
                .etag(row.get("etag", String.class))
                .sha256(row.get("sha256", String.class))
                .storagePath(row.get("storage_path", String.class))
                .createdAt(row.get("created_at", Instant.class))
                .updatedAt(row.get("updated_at", Instant.class))
                .build();
    }
}
