package win.ixuni.bkt.core.store.memory;

import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.exception.ObjectAlreadyExistsException;
import win.ixuni.bkt.core.model.StoredObject;
import win.ixuni.bkt.core.store.ObjectStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.UUID;

@RequiredArgsConstructor
public class MemoryObjectStore implements ObjectStore {

    private final MemoryStoreContext ctx;

    @Override
    public Mono<StoredObject> upsert(StoredObject object) {
        return ctx.tx(() -> {
            NavigableMap<String, StoredObject> table =
                    ctx.getObjects().computeIfAbsent(object.getBucketId(), id -> new TreeMap<>());
            StoredObject existing = table.get(object.getKey());
            StoredObject stored = object.toBuilder()
                    .id(existing != null ? existing.getId()
                            : object.getId() != null ? object.getId() : UUID.randomUUID().toString())
                    .createdAt(existing != null ? existing.getCreatedAt() : ctx.now())
                    .updatedAt(ctx.now())
                    .build();
            table.put(stored.getKey(), stored);
            return stored.toBuilder().build();
        });
    }

    @Override
    public Mono<StoredObject> find(String bucketId, String key) {
        return ctx.tx(() -> {
            NavigableMap<String, StoredObject> table = ctx.getObjects().get(bucketId);
            StoredObject object = table != null ? table.get(key) : null;
            return object != null ? object.toBuilder().build() : null;
        });
    }

    @Override
    public Flux<StoredObject> list(String bucketId, String prefix, int limit) {
        return ctx.txMany(() -> {
            List<StoredObject> result = new ArrayList<>();
            NavigableMap<String, StoredObject> table = ctx.getObjects().get(bucketId);
            if (table == null) {
                return result;
            }
            String from = prefix == null ? "" : prefix;
            for (Map.Entry<String, StoredObject> entry : table.tailMap(from, true).entrySet()) {
                if (!entry.getKey().startsWith(from) || result.size() >= limit) {
                    break;
                }
                result.add(entry.getValue().toBuilder().build());
            }
            return result;
        });
    }

    @Override
    public Mono<Boolean> delete(String bucketId, String key) {
        return ctx.tx(() -> {
            NavigableMap<String, StoredObject> table = ctx.getObjects().get(bucketId);
            return table != null && table.remove(key) != null;
        });
    }

    @Override
    public Mono<Long> deleteKeys(String bucketId, Collection<String> keys) {
        return ctx.tx(() -> {
            NavigableMap<String, StoredObject> table = ctx.getObjects().get(bucketId);
            if (table == null) {
                return 0L;
            }
            long removed = 0;
            for (String key : keys) {
                if (table.remove(key) != null) {
                    removed++;
                }
            }
            return removed;
        });
    }

    @Override
    public Mono<StoredObject> rename(String bucketId, String oldKey, String newKey, String storagePath) {
        return ctx.tx(() -> {
            NavigableMap<String, StoredObject> table = ctx.getObjects().get(bucketId);
            if (table == null || !table.containsKey(oldKey)) {
                return null;
            }
            if (table.containsKey(newKey)) {
                throw new ObjectAlreadyExistsException(bucketId, newKey);
            }
            StoredObject moved = table.remove(oldKey).toBuilder()
                    .key(newKey)
                    .storagePath(storagePath)
                    .updatedAt(ctx.now())
                    .build();
            table.put(newKey, moved);
            return moved.toBuilder().build();
        });
    }

    @Override
    public Mono<Long> countByBucket(String bucketId) {
        return ctx.tx(() -> {
            NavigableMap<String, StoredObject> table = ctx.getObjects().get(bucketId);
            return table == null ? 0L : (long) table.size();
        });
    }
}
