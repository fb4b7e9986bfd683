package win.ixuni.bkt.core.store.memory;

import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.exception.DuplicateNameException;
import win.ixuni.bkt.core.exception.ResourceInUseException;
import win.ixuni.bkt.core.exception.S3ConfigNotFoundException;
import win.ixuni.bkt.core.model.S3Configuration;
import win.ixuni.bkt.core.store.S3ConfigStore;

import java.util.Comparator;
import java.util.UUID;
import java.util.stream.Collectors;

@RequiredArgsConstructor
public class MemoryS3ConfigStore implements S3ConfigStore {

    private final MemoryStoreContext ctx;

    @Override
    public Mono<S3Configuration> insert(S3Configuration configuration) {
        return ctx.tx(() -> {
            assertNameFree(configuration.getName(), null);
            S3Configuration stored = configuration.toBuilder()
                    .id(configuration.getId() != null ? configuration.getId() : UUID.randomUUID().toString())
                    .createdAt(ctx.now())
                    .updatedAt(ctx.now())
                    .build();
            if (stored.isDefault()) {
                clearDefaults();
            }
            ctx.getS3Configurations().put(stored.getId(), stored);
            return stored.toBuilder().build();
        });
    }

    @Override
    public Mono<S3Configuration> update(S3Configuration configuration) {
        return ctx.tx(() -> {
            S3Configuration existing = ctx.getS3Configurations().get(configuration.getId());
            if (existing == null) {
                throw new S3ConfigNotFoundException(configuration.getId());
            }
            assertNameFree(configuration.getName(), configuration.getId());
            S3Configuration stored = configuration.toBuilder()
                    .createdAt(existing.getCreatedAt())
                    .updatedAt(ctx.now())
                    .build();
            if (stored.isDefault()) {
                clearDefaults();
            }
            ctx.getS3Configurations().put(stored.getId(), stored);
            return stored.toBuilder().build();
        });
    }

    @Override
    public Mono<S3Configuration> findById(String id) {
        return ctx.tx(() -> {
            S3Configuration configuration = ctx.getS3Configurations().get(id);
            return configuration != null ? configuration.toBuilder().build() : null;
        });
    }

    @Override
    public Mono<S3Configuration> findDefault() {
        return ctx.tx(() -> ctx.getS3Configurations().values().stream()
                .filter(S3Configuration::isDefault)
                .findFirst()
                .map(configuration -> configuration.toBuilder().build())
                .orElse(null));
    }

    @Override
    public Flux<S3Configuration> findAll() {
        return ctx.txMany(() -> ctx.getS3Configurations().values().stream()
                .sorted(Comparator.comparing(S3Configuration::getName))
                .map(configuration -> configuration.toBuilder().build())
                .collect(Collectors.toList()));
    }

    @Override
    public Mono<Void> delete(String id) {
        return ctx.tx(() -> {
            if (!ctx.getS3Configurations().containsKey(id)) {
                throw new S3ConfigNotFoundException(id);
            }
            long referencing = ctx.getBuckets().values().stream()
                    .filter(bucket -> id.equals(bucket.getS3ConfigId()))
                    .count();
            if (referencing > 0) {
                throw new ResourceInUseException("S3 configuration is used by " + referencing + " bucket(s)");
            }
            ctx.getS3Configurations().remove(id);
            return Boolean.TRUE;
        }).then();
    }

    private void clearDefaults() {
        ctx.getS3Configurations().replaceAll((id, configuration) -> configuration.isDefault()
                ? configuration.toBuilder().isDefault(false).updatedAt(ctx.now()).build()
                : configuration);
    }

    private void assertNameFree(String name, String selfId) {
        boolean taken = ctx.getS3Configurations().values().stream()
                .anyMatch(configuration -> configuration.getName().equals(name)
                        && !configuration.getId().equals(selfId));
        if (taken) {
            throw new DuplicateNameException("S3 configuration", name);
        }
    }
}
