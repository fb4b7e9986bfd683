package win.ixuni.bkt.store.postgresql;

import io.r2dbc.spi.Row;
import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.model.User;
import win.ixuni.bkt.core.store.UserStore;

import java.util.UUID;

/**
 * PostgreSQL 用户存储 (rows are provisioned by the authentication layer)
 */
@RequiredArgsConstructor
public class PostgresUserStore implements UserStore {

    private final PostgresStoreContext ctx;

    @Override
    public Mono<User> findById(String id) {
        return ctx.queryOne("SELECT id, username, is_admin FROM users WHERE id = $1", PostgresUserStore::map, id);
    }

    @Override
    public Mono<User> findByUsername(String username) {
        return ctx.queryOne("SELECT id, username, is_admin FROM users WHERE username = $1",
                PostgresUserStore::map, username);
    }

    @Override
    public Mono<User> save(User user) {
        String id = user.getId() != null ? user.getId() : UUID.randomUUID().toString();
        return ctx.queryOne("INSERT INTO users (id, username, is_admin) VALUES ($1, $2, $3) "
                        + "ON CONFLICT (id) DO UPDATE SET username = EXCLUDED.username, is_admin = EXCLUDED.is_admin "
                        + "RETURNING id, username, is_admin",
                PostgresUserStore::map, id, user.getUsername(), user.isAdmin());
    }

    static User map(Row row) {
        return User.builder()
                .id(row.get("id", String.class))
                .username(row.get("username", String.class))
                .isAdmin(Boolean.TRUE.equals(row.get("is_admin", Boolean.class)))
                .build();
    }
}
