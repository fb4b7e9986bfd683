package win.ixuni.bkt.store.postgresql;

import io.r2dbc.spi.Row;
import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.exception.BucketAlreadyExistsException;
import win.ixuni.bkt.core.exception.BucketNotEmptyException;
import win.ixuni.bkt.core.exception.BucketNotFoundException;
import win.ixuni.bkt.core.model.Bucket;
import win.ixuni.bkt.core.model.StorageBackendType;
import win.ixuni.bkt.core.store.BucketStore;

import java.time.Instant;
import java.util.UUID;

import static win.ixuni.bkt.store.postgresql.PostgresStoreContext.param;

/**
 * PostgreSQL bucket 元数据存储
 */
@RequiredArgsConstructor
public class PostgresBucketStore implements BucketStore {

    private static final String COLUMNS =
            "id, name, owner_id, is_public, region, storage_backend, s3_config_id, created_at, updated_at";

    private final PostgresStoreContext ctx;

    @Override
    public Mono<Bucket> insert(Bucket bucket) {
        Instant now = ctx.now();
        String id = bucket.getId() != null ? bucket.getId() : UUID.randomUUID().toString();
        return ctx.queryOne("INSERT INTO buckets (" + COLUMNS + ") VALUES ($1, $2, $3, $4, $5, $6, $7, $8, $9) "
                                + "ON CONFLICT (name) DO NOTHING RETURNING " + COLUMNS,
                        PostgresBucketStore::map,
                        id,
                        bucket.getName(),
                        param(bucket.getOwnerId(), String.class),
                        bucket.isPublic(),
                        bucket.getRegion(),
                        bucket.getStorageBackend().getValue(),
                        param(bucket.getS3ConfigId(), String.class),
                        now,
                        now)
                .switchIfEmpty(Mono.error(() -> new BucketAlreadyExistsException(bucket.getName())));
    }

    @Override
    public Mono<Bucket> findByName(String name) {
        return ctx.queryOne("SELECT " + COLUMNS + " FROM buckets WHERE name = $1", PostgresBucketStore::map, name);
    }

    @Override
    public Mono<Bucket> findById(String id) {
        return ctx.queryOne("SELECT " + COLUMNS + " FROM buckets WHERE id = $1", PostgresBucketStore::map, id);
    }

    @Override
    public Flux<Bucket> findAll() {
        return ctx.query("SELECT " + COLUMNS + " FROM buckets ORDER BY name", PostgresBucketStore::map);
    }

    @Override
    public Flux<Bucket> findByOwner(String ownerId) {
        return ctx.query("SELECT " + COLUMNS + " FROM buckets WHERE owner_id = $1 ORDER BY name",
                PostgresBucketStore::map, ownerId);
    }

    @Override
    public Mono<Void> deleteIfEmpty(Bucket bucket) {
        return ctx.inTransaction(connection -> PostgresStoreContext.query(connection,
                        "SELECT id FROM buckets WHERE id = $1 FOR UPDATE", row -> row.get("id", String.class),
                        bucket.getId())
                .next()
                .switchIfEmpty(Mono.error(() -> new BucketNotFoundException(bucket.getName())))
                .flatMap(id -> PostgresStoreContext.query(connection,
                                "SELECT COUNT(*) AS n FROM objects WHERE bucket_id = $1",
                                row -> row.get("n", Long.class), id)
                        .next())
                .flatMap(count -> {
                    if (count > 0) {
                        return Mono.error(new BucketNotEmptyException(bucket.getName()));
                    }
                    return PostgresStoreContext.update(connection,
                                    "DELETE FROM bucket_policies WHERE bucket_id = $1", bucket.getId())
                            .then(PostgresStoreContext.update(connection,
                                    "DELETE FROM buckets WHERE id = $1", bucket.getId()));
                }))
                .then();
    }

    @Override
    public Mono<Long> countByS3Config(String s3ConfigId) {
        return ctx.queryOne("SELECT COUNT(*) AS n FROM buckets WHERE s3_config_id = $1",
                row -> row.get("n", Long.class), s3ConfigId);
    }

    static Bucket map(Row row) {
        return Bucket.builder()
                .id(row.get("id", String.class))
                .name(row.get("name", String.class))
                .ownerId(row.get("owner_id", String.class))
                .isPublic(Boolean.TRUE.equals(row.get("is_public", Boolean.class)))
                .region(row.get("region", String.class))
                .storageBackend(StorageBackendType.fromValue(row.get("storage_backend", String.class)))
                .s3ConfigId(row.get("s3_config_id", String.class))
                .createdAt(row.get("created_at", Instant.class))
                .updatedAt(row.get("updated_at", Instant.class))
                .build();
    }
}
