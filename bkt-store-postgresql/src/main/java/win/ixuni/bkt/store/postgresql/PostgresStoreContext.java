package win.ixuni.bkt.store.postgresql;

import io.r2dbc.pool.ConnectionPool;
import io.r2dbc.pool.ConnectionPoolConfiguration;
import io.r2dbc.spi.Connection;
import io.r2dbc.spi.ConnectionFactories;
import io.r2dbc.spi.ConnectionFactory;
import io.r2dbc.spi.ConnectionFactoryOptions;
import io.r2dbc.spi.Row;
import io.r2dbc.spi.Statement;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.store.postgresql.config.PostgresStoreConfig;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Function;

import static io.r2dbc.spi.ConnectionFactoryOptions.PASSWORD;
import static io.r2dbc.spi.ConnectionFactoryOptions.USER;

/**
 * PostgreSQL 存储上下文
 * <p>
 * Shared connection pool plus the query helpers every store uses. Rows are mapped inside the
 * connection scope, never handed out raw. Placeholders are {@code $1, $2, ...}.
 */
@Slf4j
@Getter
public class PostgresStoreContext {

    private final ConnectionFactory connectionFactory;

    private final Clock clock;

    public PostgresStoreContext(ConnectionFactory connectionFactory, Clock clock) {
        this.connectionFactory = connectionFactory;
        this.clock = clock;
    }

    /**
     * Build a pooled context from configuration
     */
    public static PostgresStoreContext create(PostgresStoreConfig config, Clock clock) {
        ConnectionFactoryOptions baseOptions = ConnectionFactoryOptions.parse(config.getUrl());
        ConnectionFactoryOptions.Builder optionsBuilder = ConnectionFactoryOptions.builder().from(baseOptions);

        if (config.getUsername() != null && !config.getUsername().isEmpty()) {
            optionsBuilder.option(USER, config.getUsername());
        }
        if (config.getPassword() != null && !config.getPassword().isEmpty()) {
            optionsBuilder.option(PASSWORD, config.getPassword());
        }

        ConnectionFactory connectionFactory = ConnectionFactories.get(optionsBuilder.build());
        ConnectionPoolConfiguration poolConfig = ConnectionPoolConfiguration.builder(connectionFactory)
                .name("bkt-pg")
                .initialSize(Math.min(2, config.getPoolSize()))
                .maxSize(config.getPoolSize())
                .maxIdleTime(Duration.ofMinutes(10))
                .build();

        log.info("PostgreSQL store pool created (max {} connections)", config.getPoolSize());
        return new PostgresStoreContext(new ConnectionPool(poolConfig), clock);
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * Typed null parameter; the driver needs the type to encode a null
     */
    public static Param param(Object value, Class<?> type) {
        return new Param(value, type);
    }

    public record Param(Object value, Class<?> type) {
    }

    // ==================== Pooled helpers ====================

    public <T> Flux<T> query(String sql, Function<Row, T> mapper, Object... params) {
        return Flux.usingWhen(
                Mono.from(connectionFactory.create()),
                connection -> query(connection, sql, mapper, params),
                connection -> Mono.from(connection.close()));
    }

    public <T> Mono<T> queryOne(String sql, Function<Row, T> mapper, Object... params) {
        return query(sql, mapper, params).next();
    }

    public Mono<Long> update(String sql, Object... params) {
        return Mono.usingWhen(
                Mono.from(connectionFactory.create()),
                connection -> update(connection, sql, params),
                connection -> Mono.from(connection.close()));
    }

    /**
     * Run {@code work} in one transaction: commit on success, roll back on error or cancel
     */
    public <T> Mono<T> inTransaction(Function<Connection, Mono<T>> work) {
        return Mono.usingWhen(
                Mono.from(connectionFactory.create()),
                connection -> Mono.usingWhen(
                        Mono.from(connection.beginTransaction()).thenReturn(connection),
                        work,
                        Connection::commitTransaction,
                        (c, error) -> c.rollbackTransaction(),
                        Connection::rollbackTransaction),
                connection -> Mono.from(connection.close()));
    }

    // ==================== Connection-scoped helpers ====================

    public static <T> Flux<T> query(Connection connection, String sql, Function<Row, T> mapper, Object... params) {
        Statement statement = bind(connection.createStatement(sql), params);
        return Flux.from(statement.execute())
                .flatMap(result -> Flux.from(result.map((row, meta) -> mapper.apply(row))));
    }

    public static Mono<Long> update(Connection connection, String sql, Object... params) {
        Statement statement = bind(connection.createStatement(sql), params);
        return Flux.from(statement.execute())
                .flatMap(result -> Mono.from(result.getRowsUpdated()))
                .reduce(0L, Long::sum);
    }

    static Statement bind(Statement statement, Object... params) {
        for (int i = 0; i < params.length; i++) {
            Object value = params[i];
            if (value instanceof Param typed) {
                if (typed.value() == null) {
                    statement.bindNull(i, typed.type());
                } else {
                    statement.bind(i, typed.value());
                }
            } else if (value == null) {
                throw new IllegalArgumentException("Untyped null for parameter $" + (i + 1));
            } else {
                statement.bind(i, value);
            }
        }
        return statement;
    }

    /**
     * Close the pool if this context owns one
     */
    public void dispose() {
        if (connectionFactory instanceof ConnectionPool pool) {
            pool.dispose();
            log.info("PostgreSQL store pool disposed");
        }
    }
}
