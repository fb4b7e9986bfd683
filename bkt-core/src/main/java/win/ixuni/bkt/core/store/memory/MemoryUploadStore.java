package win.ixuni.bkt.core.store.memory;

import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.exception.UploadNotFoundException;
import win.ixuni.bkt.core.model.Upload;
import win.ixuni.bkt.core.model.UploadStatus;
import win.ixuni.bkt.core.store.UploadStore;

import java.util.Comparator;
import java.util.UUID;
import java.util.stream.Collectors;

@RequiredArgsConstructor
public class MemoryUploadStore implements UploadStore {

    private final MemoryStoreContext ctx;

    @Override
    public Mono<Upload> insert(Upload upload) {
        return ctx.tx(() -> {
            Upload stored = upload.toBuilder()
                    .id(upload.getId() != null ? upload.getId() : UUID.randomUUID().toString())
                    .createdAt(ctx.now())
                    .updatedAt(ctx.now())
                    .build();
            ctx.getUploads().put(stored.getId(), stored);
            return stored.toBuilder().build();
        });
    }

    @Override
    public Mono<Upload> findById(String id) {
        return ctx.tx(() -> {
            Upload upload = ctx.getUploads().get(id);
            return upload != null ? upload.toBuilder().build() : null;
        });
    }

    @Override
    public Mono<Upload> findByIdAndUser(String id, String userId) {
        return ctx.tx(() -> {
            Upload upload = ctx.getUploads().get(id);
            if (upload == null || userId == null || !userId.equals(upload.getUserId())) {
                return null;
            }
            return upload.toBuilder().build();
        });
    }

    @Override
    public Mono<Upload> update(Upload upload) {
        return ctx.tx(() -> {
            Upload existing = ctx.getUploads().get(upload.getId());
            if (existing == null) {
                throw new UploadNotFoundException(upload.getId());
            }
            Upload stored = upload.toBuilder()
                    .createdAt(existing.getCreatedAt())
                    .updatedAt(ctx.now())
                    .build();
            ctx.getUploads().put(stored.getId(), stored);
            return stored.toBuilder().build();
        });
    }

    @Override
    public Mono<Void> updateProgress(String id, long uploadedSize) {
        return ctx.tx(() -> {
            Upload existing = ctx.getUploads().get(id);
            if (existing != null && existing.getStatus() == UploadStatus.PROCESSING
                    && uploadedSize > existing.getUploadedSize()) {
                ctx.getUploads().put(id, existing.toBuilder()
                        .uploadedSize(uploadedSize)
                        .updatedAt(ctx.now())
                        .build());
            }
            return Boolean.TRUE;
        }).then();
    }

    @Override
    public Flux<Upload> findByUser(String userId, UploadStatus status, int limit) {
        return ctx.txMany(() -> ctx.getUploads().values().stream()
                .filter(upload -> upload.getUserId() != null && upload.getUserId().equals(userId))
                .filter(upload -> status == null || upload.getStatus() == status)
                .sorted(Comparator.comparing(Upload::getCreatedAt).reversed())
                .limit(limit)
                .map(upload -> upload.toBuilder().build())
                .collect(Collectors.toList()));
    }
}
