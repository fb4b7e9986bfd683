package win.ixuni.bkt.store.postgresql.schema;

import io.r2dbc.spi.Connection;
import io.r2dbc.spi.ConnectionFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * PostgreSQL Schema 初始化器
 * <p>
 * 自动创建元数据表: buckets, objects, policies, user_policies, bucket_policies, users,
 * s3_configurations, uploads. Statements are idempotent ({@code IF NOT EXISTS}).
 * <p>
 * Policy documents are TEXT, not JSONB: the stored form is the canonical serialization and
 * JSONB would reorder its keys.
 */
@Slf4j
@RequiredArgsConstructor
public class PostgresSchemaInitializer {

    static final List<String> DDL = List.of(
            """
            CREATE TABLE IF NOT EXISTS users (
                id VARCHAR(36) PRIMARY KEY,
                username VARCHAR(255) NOT NULL UNIQUE,
                is_admin BOOLEAN NOT NULL DEFAULT FALSE
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS s3_configurations (
                id VARCHAR(36) PRIMARY KEY,
                name VARCHAR(255) NOT NULL UNIQUE,
                endpoint VARCHAR(255),
                region VARCHAR(50),
                access_key_id TEXT NOT NULL,
                secret_access_key TEXT NOT NULL,
                bucket_prefix VARCHAR(255),
                use_ssl BOOLEAN NOT NULL DEFAULT TRUE,
                force_path_style BOOLEAN NOT NULL DEFAULT FALSE,
                is_default BOOLEAN NOT NULL DEFAULT FALSE,
                created_at TIMESTAMPTZ NOT NULL,
                updated_at TIMESTAMPTZ NOT NULL
            )
            """,
            """
            CREATE UNIQUE INDEX IF NOT EXISTS uk_s3_configurations_default
            ON s3_configurations (is_default) WHERE is_default
            """,
            """
            CREATE TABLE IF NOT EXISTS buckets (
                id VARCHAR(36) PRIMARY KEY,
                name VARCHAR(63) NOT NULL UNIQUE,
                owner_id VARCHAR(36),
                is_public BOOLEAN NOT NULL DEFAULT FALSE,
                region VARCHAR(50) NOT NULL DEFAULT 'us-east-1',
                storage_backend VARCHAR(16) NOT NULL DEFAULT 'local',
                s3_config_id VARCHAR(36) REFERENCES s3_configurations(id),
                created_at TIMESTAMPTZ NOT NULL,
                updated_at TIMESTAMPTZ NOT NULL
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_buckets_owner_id ON buckets (owner_id)",
            """
            CREATE TABLE IF NOT EXISTS objects (
                id VARCHAR(36) PRIMARY KEY,
                bucket_id VARCHAR(36) NOT NULL REFERENCES buckets(id) ON DELETE CASCADE,
                key VARCHAR(1024) NOT NULL,
                size BIGINT NOT NULL,
                content_type VARCHAR(255),
                etag VARCHAR(64),
                sha256 VARCHAR(64),
                storage_path VARCHAR(1100) NOT NULL,
                created_at TIMESTAMPTZ NOT NULL,
                updated_at TIMESTAMPTZ NOT NULL,
                UNIQUE (bucket_id, key)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS policies (
                id VARCHAR(36) PRIMARY KEY,
                name VARCHAR(255) NOT NULL UNIQUE,
                description TEXT,
                document TEXT NOT NULL,
                created_at TIMESTAMPTZ NOT NULL,
                updated_at TIMESTAMPTZ NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS user_policies (
                user_id VARCHAR(36) NOT NULL REFERENCES users(id) ON DELETE CASCADE,
                policy_id VARCHAR(36) NOT NULL REFERENCES policies(id),
                attached_at TIMESTAMPTZ NOT NULL,
                PRIMARY KEY (user_id, policy_id)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS bucket_policies (
                bucket_id VARCHAR(36) PRIMARY KEY REFERENCES buckets(id) ON DELETE CASCADE,
                document TEXT NOT NULL,
                updated_at TIMESTAMPTZ NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS uploads (
                id VARCHAR(36) PRIMARY KEY,
                user_id VARCHAR(36),
                bucket_name VARCHAR(63) NOT NULL,
                object_key VARCHAR(1024) NOT NULL,
                filename VARCHAR(1024),
                content_type VARCHAR(255),
                total_size BIGINT NOT NULL DEFAULT 0,
                uploaded_size BIGINT NOT NULL DEFAULT 0,
                status VARCHAR(16) NOT NULL,
                error_message TEXT,
                object_id VARCHAR(36),
                created_at TIMESTAMPTZ NOT NULL,
                updated_at TIMESTAMPTZ NOT NULL,
                completed_at TIMESTAMPTZ
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_uploads_user_created ON uploads (user_id, created_at DESC)");

    private final ConnectionFactory connectionFactory;

    public Mono<Void> initialize() {
        log.info("初始化 PostgreSQL schema ({} statements)", DDL.size());
        return Mono.usingWhen(
                        Mono.from(connectionFactory.create()),
                        connection -> Flux.fromIterable(DDL)
                                .concatMap(sql -> executeStatement(connection, sql))
                                .then(),
                        connection -> Mono.from(connection.close()))
                .doOnSuccess(v -> log.info("PostgreSQL schema 初始化完成"))
                .doOnError(e -> log.error("PostgreSQL schema 初始化失败", e));
    }

    private Mono<Void> executeStatement(Connection connection, String sql) {
        return Flux.from(connection.createStatement(sql).execute())
                .flatMap(result -> Mono.from(result.getRowsUpdated()))
                .then()
                .onErrorResume(e -> {
                    String message = e.getMessage();
                    if (message != null && message.contains("already exists")) {
                        log.debug("DDL skipped (already exists): {}", message);
                        return Mono.empty();
                    }
                    log.error("DDL 执行失败: {}", message);
                    return Mono.error(e);
                });
    }
}
