package win.ixuni.bkt.store.postgresql;

import io.r2dbc.spi.Row;
import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.exception.DuplicateNameException;
import win.ixuni.bkt.core.exception.PolicyNotFoundException;
import win.ixuni.bkt.core.exception.ResourceInUseException;
import win.ixuni.bkt.core.exception.UserNotFoundException;
import win.ixuni.bkt.core.model.BucketPolicy;
import win.ixuni.bkt.core.model.Policy;
import win.ixuni.bkt.core.store.PolicyStore;

import java.time.Instant;
import java.util.UUID;

import static win.ixuni.bkt.store.postgresql.PostgresStoreContext.param;

/**
 * PostgreSQL 策略存储 (policies, user attachments, bucket policies)
 */
@RequiredArgsConstructor
public class PostgresPolicyStore implements PolicyStore {

    private static final String COLUMNS = "id, name, description, document, created_at, updated_at";

    private final PostgresStoreContext ctx;

    @Override
    public Mono<Policy> insert(Policy policy) {
        Instant now = ctx.now();
        String id = policy.getId() != null ? policy.getId() : UUID.randomUUID().toString();
        return ctx.queryOne("INSERT INTO policies (" + COLUMNS + ") VALUES ($1, $2, $3, $4, $5, $5) "
                                + "ON CONFLICT (name) DO NOTHING RETURNING " + COLUMNS,
                        PostgresPolicyStore::map,
                        id, policy.getName(), param(policy.getDescription(), String.class), policy.getDocument(), now)
                .switchIfEmpty(Mono.error(() -> new DuplicateNameException("Policy", policy.getName())));
    }

    @Override
    public Mono<Policy> update(Policy policy) {
        return ctx.inTransaction(connection -> PostgresStoreContext.query(connection,
                        "SELECT id FROM policies WHERE id = $1 FOR UPDATE", row -> row.get("id", String.class),
                        policy.getId())
                .next()
                .switchIfEmpty(Mono.error(() -> new PolicyNotFoundException(policy.getId())))
                .flatMap(id -> PostgresStoreContext.query(connection,
                                "SELECT COUNT(*) AS n FROM policies WHERE name = $1 AND id <> $2",
                                row -> row.get("n", Long.class), policy.getName(), id)
                        .next())
                .flatMap(taken -> taken > 0
                        ? Mono.error(new DuplicateNameException("Policy", policy.getName()))
                        : PostgresStoreContext.query(connection,
                                        "UPDATE policies SET name = $2, description = $3, document = $4, updated_at = $5 "
                                                + "WHERE id = $1 RETURNING " + COLUMNS,
                                        PostgresPolicyStore::map,
                                        policy.getId(), policy.getName(), param(policy.getDescription(), String.class),
                                        policy.getDocument(), ctx.now())
                                .next()));
    }

    @Override
    public Mono<Policy> findById(String id) {
        return ctx.queryOne("SELECT " + COLUMNS + " FROM policies WHERE id = $1", PostgresPolicyStore::map, id);
    }

    @Override
    public Mono<Policy> findByName(String name) {
        return ctx.queryOne("SELECT " + COLUMNS + " FROM policies WHERE name = $1", PostgresPolicyStore::map, name);
    }

    @Override
    public Flux<Policy> findAll() {
        return ctx.query("SELECT " + COLUMNS + " FROM policies ORDER BY name", PostgresPolicyStore::map);
    }

    @Override
    public Mono<Void> delete(String id) {
        return ctx.inTransaction(connection -> PostgresStoreContext.query(connection,
                        "SELECT id FROM policies WHERE id = $1 FOR UPDATE", row -> row.get("id", String.class), id)
                .next()
                .switchIfEmpty(Mono.error(() -> new PolicyNotFoundException(id)))
                .flatMap(found -> PostgresStoreContext.query(connection,
                                "SELECT COUNT(*) AS n FROM user_policies WHERE policy_id = $1",
                                row -> row.get("n", Long.class), id)
                        .next())
                .flatMap(attached -> attached > 0
                        ? Mono.error(new ResourceInUseException("Policy is attached to " + attached + " user(s)"))
                        : PostgresStoreContext.update(connection, "DELETE FROM policies WHERE id = $1", id)))
                .then();
    }

    @Override
    public Mono<Void> attach(String userId, String policyId) {
        return ctx.inTransaction(connection -> PostgresStoreContext.query(connection,
                        "SELECT id FROM users WHERE id = $1", row -> row.get("id", String.class), userId)
                .next()
                .switchIfEmpty(Mono.error(() -> new UserNotFoundException(userId)))
                .flatMap(user -> PostgresStoreContext.query(connection,
                                "SELECT id FROM policies WHERE id = $1 FOR SHARE",
                                row -> row.get("id", String.class), policyId)
                        .next()
                        .switchIfEmpty(Mono.error(() -> new PolicyNotFoundException(policyId))))
                .flatMap(policy -> PostgresStoreContext.update(connection,
                        "INSERT INTO user_policies (user_id, policy_id, attached_at) VALUES ($1, $2, $3) "
                                + "ON CONFLICT DO NOTHING",
                        userId, policyId, ctx.now())))
                .then();
    }

    @Override
    public Mono<Boolean> detach(String userId, String policyId) {
        return ctx.update("DELETE FROM user_policies WHERE user_id = $1 AND policy_id = $2", userId, policyId)
                .map(rows -> rows > 0);
    }

    @Override
    public Flux<Policy> findByUser(String userId) {
        return ctx.query("SELECT p.id, p.name, p.description, p.document, p.created_at, p.updated_at "
                        + "FROM policies p JOIN user_policies up ON up.policy_id = p.id "
                        + "WHERE up.user_id = $1 ORDER BY up.attached_at",
                PostgresPolicyStore::map, userId);
    }

    @Override
    public Mono<BucketPolicy> findBucketPolicy(String bucketId) {
        return ctx.queryOne("SELECT bucket_id, document, updated_at FROM bucket_policies WHERE bucket_id = $1",
                PostgresPolicyStore::mapBucketPolicy, bucketId);
    }

    @Override
    public Mono<BucketPolicy> putBucketPolicy(BucketPolicy bucketPolicy) {
        return ctx.queryOne("INSERT INTO bucket_policies (bucket_id, document, updated_at) VALUES ($1, $2, $3) "
                        + "ON CONFLICT (bucket_id) DO UPDATE SET document = EXCLUDED.document, "
                        + "updated_at = EXCLUDED.updated_at "
                        + "RETURNING bucket_id, document, updated_at",
                PostgresPolicyStore::mapBucketPolicy,
                bucketPolicy.getBucketId(), bucketPolicy.getDocument(), ctx.now());
    }

    @Override
    public Mono<Boolean> deleteBucketPolicy(String bucketId) {
        return ctx.update("DELETE FROM bucket_policies WHERE bucket_id = $1", bucketId)
                .map(rows -> rows > 0);
    }

    static Policy map(Row row) {
        return Policy.builder()
                .id(row.get("id", String.class))
                .name(row.get("name", String.class))
                .description(row.get("description", String.class))
                .document(row.get("document", String.class))
                .createdAt(row.get("created_at", Instant.class))
                .updatedAt(row.get("updated_at", Instant.class))
                .build();
    }

    static BucketPolicy mapBucketPolicy(Row row) {
        return BucketPolicy.builder()
                .bucketId(row.get("bucket_id", String.class))
                .document(row.get("document", String.class))
                .updatedAt(row.get("updated_at", Instant.class))
                .build();
    }
}
