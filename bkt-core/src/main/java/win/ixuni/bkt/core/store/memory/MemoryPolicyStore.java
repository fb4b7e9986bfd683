package win.ixuni.bkt.core.store.memory;

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

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@RequiredArgsConstructor
public class MemoryPolicyStore implements PolicyStore {

    private final MemoryStoreContext ctx;

    @Override
    public Mono<Policy> insert(Policy policy) {
        return ctx.tx(() -> {
            assertNameFree(policy.getName(), null);
            Policy stored = policy.toBuilder()
                    .id(policy.getId() != null ? policy.getId() : UUID.randomUUID().toString())
                    .createdAt(ctx.now())
                    .updatedAt(ctx.now())
                    .build();
            ctx.getPolicies().put(stored.getId(), stored);
            return stored.toBuilder().build();
        });
    }

    @Override
    public Mono<Policy> update(Policy policy) {
        return ctx.tx(() -> {
            Policy existing = ctx.getPolicies().get(policy.getId());
            if (existing == null) {
                throw new PolicyNotFoundException(policy.getId());
            }
            assertNameFree(policy.getName(), policy.getId());
            Policy stored = existing.toBuilder()
                    .name(policy.getName())
                    .description(policy.getDescription())
                    .document(policy.getDocument())
                    .updatedAt(ctx.now())
                    .build();
            ctx.getPolicies().put(stored.getId(), stored);
            return stored.toBuilder().build();
        });
    }

    @Override
    public Mono<Policy> findById(String id) {
        return ctx.tx(() -> {
            Policy policy = ctx.getPolicies().get(id);
            return policy != null ? policy.toBuilder().build() : null;
        });
    }

    @Override
    public Mono<Policy> findByName(String name) {
        return ctx.tx(() -> ctx.getPolicies().values().stream()
                .filter(policy -> policy.getName().equals(name))
                .findFirst()
                .map(policy -> policy.toBuilder().build())
                .orElse(null));
    }

    @Override
    public Flux<Policy> findAll() {
        return ctx.txMany(() -> ctx.getPolicies().values().stream()
                .sorted(Comparator.comparing(Policy::getName))
                .map(policy -> policy.toBuilder().build())
                .collect(Collectors.toList()));
    }

    @Override
    public Mono<Void> delete(String id) {
        return ctx.tx(() -> {
            if (!ctx.getPolicies().containsKey(id)) {
                throw new PolicyNotFoundException(id);
            }
            long attached = ctx.getUserPolicies().values().stream()
                    .filter(ids -> ids.contains(id))
                    .count();
            if (attached > 0) {
                throw new ResourceInUseException("Policy is attached to " + attached + " user(s)");
            }
            ctx.getPolicies().remove(id);
            return Boolean.TRUE;
        }).then();
    }

    @Override
    public Mono<Void> attach(String userId, String policyId) {
        return ctx.tx(() -> {
            if (!ctx.getUsers().containsKey(userId)) {
                throw new UserNotFoundException(userId);
            }
            if (!ctx.getPolicies().containsKey(policyId)) {
                throw new PolicyNotFoundException(policyId);
            }
            ctx.getUserPolicies().computeIfAbsent(userId, k -> new LinkedHashSet<>()).add(policyId);
            return Boolean.TRUE;
        }).then();
    }

    @Override
    public Mono<Boolean> detach(String userId, String policyId) {
        return ctx.tx(() -> {
            Set<String> ids = ctx.getUserPolicies().get(userId);
            return ids != null && ids.remove(policyId);
        });
    }

    @Override
    public Flux<Policy> findByUser(String userId) {
        return ctx.txMany(() -> ctx.getUserPolicies().getOrDefault(userId, Set.of()).stream()
                .map(ctx.getPolicies()::get)
                .filter(policy -> policy != null)
                .map(policy -> policy.toBuilder().build())
                .collect(Collectors.toList()));
    }

    @Override
    public Mono<BucketPolicy> findBucketPolicy(String bucketId) {
        return ctx.tx(() -> ctx.getBucketPolicies().get(bucketId));
    }

    @Override
    public Mono<BucketPolicy> putBucketPolicy(BucketPolicy bucketPolicy) {
        return ctx.tx(() -> {
            BucketPolicy stored = BucketPolicy.builder()
                    .bucketId(bucketPolicy.getBucketId())
                    .document(bucketPolicy.getDocument())
                    .updatedAt(ctx.now())
                    .build();
            ctx.getBucketPolicies().put(stored.getBucketId(), stored);
            return stored;
        });
    }

    @Override
    public Mono<Boolean> deleteBucketPolicy(String bucketId) {
        return ctx.tx(() -> ctx.getBucketPolicies().remove(bucketId) != null);
    }

    private void assertNameFree(String name, String selfId) {
        boolean taken = ctx.getPolicies().values().stream()
                .anyMatch(policy -> policy.getName().equals(name) && !policy.getId().equals(selfId));
        if (taken) {
            throw new DuplicateNameException("Policy", name);
        }
    }
}
