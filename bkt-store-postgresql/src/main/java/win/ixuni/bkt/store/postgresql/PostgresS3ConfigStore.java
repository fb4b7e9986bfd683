package win.ixuni.bkt.store.postgresql;

import io.r2dbc.spi.Connection;
import io.r2dbc.spi.Row;
import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.exception.DuplicateNameException;
import win.ixuni.bkt.core.exception.ResourceInUseException;
import win.ixuni.bkt.core.exception.S3ConfigNotFoundException;
import win.ixuni.bkt.core.model.S3Configuration;
import win.ixuni.bkt.core.store.S3ConfigStore;

import java.time.Instant;
import java.util.UUID;

import static win.ixuni.bkt.store.postgresql.PostgresStoreContext.param;

/**
 * PostgreSQL S3 配置存储
 * <p>
 * Credentials arrive already encrypted. Marking a configuration default clears the flag on every
 * other row in the same transaction.
 */
@RequiredArgsConstructor
public class PostgresS3ConfigStore implements S3ConfigStore {

    private static final String COLUMNS = "id, name, endpoint, region, access_key_id, secret_access_key, "
            + "bucket_prefix, use_ssl, force_path_style, is_default, created_at, updated_at";

    private final PostgresStoreContext ctx;

    @Override
    public Mono<S3Configuration> insert(S3Configuration configuration) {
        Instant now = ctx.now();
        String id = configuration.getId() != null ? configuration.getId() : UUID.randomUUID().toString();
        return ctx.inTransaction(connection -> clearDefaults(connection, configuration.isDefault(), id)
                .then(PostgresStoreContext.query(connection,
                                "INSERT INTO s3_configurations (" + COLUMNS + ") "
                                        + "VALUES ($1, $2, $3, $4, $5, $6, $7, $8, $9, $10, $11, $11) "
                                        + "ON CONFLICT (name) DO NOTHING RETURNING " + COLUMNS,
                                PostgresS3ConfigStore::map,
                                id,
                                configuration.getName(),
                                param(configuration.getEndpoint(), String.class),
                                param(configuration.getRegion(), String.class),
                                configuration.getAccessKeyId(),
                                configuration.getSecretAccessKey(),
                                param(configuration.getBucketPrefix(), String.class),
                                configuration.isUseSsl(),
                                configuration.isForcePathStyle(),
                                configuration.isDefault(),
                                now)
                        .next())
                .switchIfEmpty(Mono.error(() -> new DuplicateNameException("S3 configuration",
                        configuration.getName()))));
    }

    @Override
    public Mono<S3Configuration> update(S3Configuration configuration) {
        String id = configuration.getId();
        return ctx.inTransaction(connection -> PostgresStoreContext.query(connection,
                        "SELECT id FROM s3_configurations WHERE id = $1 FOR UPDATE",
                        row -> row.get("id", String.class), id)
                .next()
                .switchIfEmpty(Mono.error(() -> new S3ConfigNotFoundException(id)))
                .flatMap(found -> PostgresStoreContext.query(connection,
                                "SELECT COUNT(*) AS n FROM s3_configurations WHERE name = $1 AND id <> $2",
                                row -> row.get("n", Long.class), configuration.getName(), id)
                        .next())
                .flatMap(taken -> {
                    if (taken > 0) {
                        return Mono.error(new DuplicateNameException("S3 configuration", configuration.getName()));
                    }
                    return clearDefaults(connection, configuration.isDefault(), id)
                            .then(PostgresStoreContext.query(connection,
                                            "UPDATE s3_configurations SET name = $2, endpoint = $3, region = $4, "
                                                    + "access_key_id = $5, secret_access_key = $6, bucket_prefix = $7, "
                                                    + "use_ssl = $8, force_path_style = $9, is_default = $10, "
                                                    + "updated_at = $11 WHERE id = $1 RETURNING " + COLUMNS,
                                            PostgresS3ConfigStore::map,
                                            id,
                                            configuration.getName(),
                                            param(configuration.getEndpoint(), String.class),
                                            param(configuration.getRegion(), String.class),
                                            configuration.getAccessKeyId(),
                                            configuration.getSecretAccessKey(),
                                            param(configuration.getBucketPrefix(), String.class),
                                            configuration.isUseSsl(),
                                            configuration.isForcePathStyle(),
                                            configuration.isDefault(),
                                            ctx.now())
                                    .next());
                }));
    }

    @Override
    public Mono<S3Configuration> findById(String id) {
        return ctx.queryOne("SELECT " + COLUMNS + " FROM s3_configurations WHERE id = $1",
                PostgresS3ConfigStore::map, id);
    }

    @Override
    public Mono<S3Configuration> findDefault() {
        return ctx.queryOne("SELECT " + COLUMNS + " FROM s3_configurations WHERE is_default LIMIT 1",
                PostgresS3ConfigStore::map);
    }

    @Override
    public Flux<S3Configuration> findAll() {
        return ctx.query("SELECT " + COLUMNS + " FROM s3_configurations ORDER BY name", PostgresS3ConfigStore::map);
    }

    @Override
    public Mono<Void> delete(String id) {
        return ctx.inTransaction(connection -> PostgresStoreContext.query(connection,
                        "SELECT id FROM s3_configurations WHERE id = $1 FOR UPDATE",
                        row -> row.get("id", String.class), id)
                .next()
                .switchIfEmpty(Mono.error(() -> new S3ConfigNotFoundException(id)))
                .flatMap(found -> PostgresStoreContext.query(connection,
                                "SELECT COUNT(*) AS n FROM buckets WHERE s3_config_id = $1",
                                row -> row.get("n", Long.class), id)
                        .next())
                .flatMap(referencing -> referencing > 0
                        ? Mono.error(new ResourceInUseException(
                                "S3 configuration is used by " + referencing + " bucket(s)"))
                        : PostgresStoreContext.update(connection, "DELETE FROM s3_configurations WHERE id = $1", id)))
                .then();
    }

    private Mono<Long> clearDefaults(Connection connection, boolean becomesDefault, String selfId) {
        if (!becomesDefault) {
            return Mono.just(0L);
        }
        return PostgresStoreContext.update(connection,
                "UPDATE s3_configurations SET is_default = FALSE, updated_at = $2 WHERE is_default AND id <> $1",
                selfId, ctx.now());
    }

    static S3Configuration map(Row row) {
        return S3Configuration.builder()
                .id(row.get("id", String.class))
                .name(row.get("name", String.class))
                .endpoint(row.get("endpoint", String.class))
                .region(row.get("region", String.class))
                .accessKeyId(row.get("access_key_id", String.class))
                .secretAccessKey(row.get("secret_access_key", String.class))
                .bucketPrefix(row.get("bucket_prefix", String.class))
                .useSsl(Boolean.TRUE.equals(row.get("use_ssl", Boolean.class)))
                .forcePathStyle(Boolean.TRUE.equals(row.get("force_path_style", Boolean.class)))
                .isDefault(Boolean.TRUE.equals(row.get("is_default", Boolean.class)))
                .createdAt(row.get("created_at", Instant.class))
                .updatedAt(row.get("updated_at", Instant.class))
                .build();
    }
}
