package win.ixuni.bkt.core.store.memory;

import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.exception.BucketAlreadyExistsException;
import win.ixuni.bkt.core.exception.BucketNotEmptyException;
import win.ixuni.bkt.core.exception.BucketNotFoundException;
import win.ixuni.bkt.core.model.Bucket;
import win.ixuni.bkt.core.store.BucketStore;

import java.util.Comparator;
import java.util.NavigableMap;
import java.util.UUID;
import java.util.stream.Collectors;

@RequiredArgsConstructor
public class MemoryBucketStore implements BucketStore {

    private final MemoryStoreContext ctx;

    @Override
    public Mono<Bucket> insert(Bucket bucket) {
        return ctx.tx(() -> {
            boolean taken = ctx.getBuckets().values().stream()
                    .anyMatch(existing -> existing.getName().equals(bucket.getName()));
            if (taken) {
                throw new BucketAlreadyExistsException(bucket.getName());
            }
            Bucket stored = bucket.toBuilder()
                    .id(bucket.getId() != null ? bucket.getId() : UUID.randomUUID().toString())
                    .createdAt(ctx.now())
                    .updatedAt(ctx.now())
                    .build();
            ctx.getBuckets().put(stored.getId(), stored);
            return stored.toBuilder().build();
        });
    }

    @Override
    public Mono<Bucket> findByName(String name) {
        return ctx.tx(() -> ctx.getBuckets().values().stream()
                        .filter(bucket -> bucket.getName().equals(name))
                        .findFirst()
                        .map(bucket -> bucket.toBuilder().build())
                        .orElse(null));
    }

    @Override
    public Mono<Bucket> findById(String id) {
        return ctx.tx(() -> {
            Bucket bucket = ctx.getBuckets().get(id);
            return bucket != null ? bucket.toBuilder().build() : null;
        });
    }

    @Override
    public Flux<Bucket> findAll() {
        return ctx.txMany(() -> ctx.getBuckets().values().stream()
                .sorted(Comparator.comparing(Bucket::getName))
                .map(bucket -> bucket.toBuilder().build())
                .collect(Collectors.toList()));
    }

    @Override
    public Flux<Bucket> findByOwner(String ownerId) {
        return ctx.txMany(() -> ctx.getBuckets().values().stream()
                .filter(bucket -> ownerId != null && ownerId.equals(bucket.getOwnerId()))
                .sorted(Comparator.comparing(Bucket::getName))
                .map(bucket -> bucket.toBuilder().build())
                .collect(Collectors.toList()));
    }

    @Override
    public Mono<Void> deleteIfEmpty(Bucket bucket) {
        return ctx.tx(() -> {
            if (!ctx.getBuckets().containsKey(bucket.getId())) {
                throw new BucketNotFoundException(bucket.getName());
            }
            NavigableMap<String, ?> objects = ctx.getObjects().get(bucket.getId());
            if (objects != null && !objects.isEmpty()) {
                throw new BucketNotEmptyException(bucket.getName());
            }
            ctx.getBuckets().remove(bucket.getId());
            ctx.getObjects().remove(bucket.getId());
            ctx.getBucketPolicies().remove(bucket.getId());
            return Boolean.TRUE;
        }).then();
    }

    @Override
    public Mono<Long> countByS3Config(String s3ConfigId) {
        return ctx.tx(() -> ctx.getBuckets().values().stream()
                .map(Bucket::getS3ConfigId)
                .filter(s3ConfigId::equals)
                .count());
    }
}
