package win.ixuni.bkt.store.postgresql;

import io.r2dbc.spi.Row;
import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.exception.UploadNotFoundException;
import win.ixuni.bkt.core.model.Upload;
import win.ixuni.bkt.core.model.UploadStatus;
import win.ixuni.bkt.core.store.UploadStore;

import java.time.Instant;
import java.util.UUID;

import static win.ixuni.bkt.store.postgresql.PostgresStoreContext.param;

/**
 * PostgreSQL 异步上传记录存储
 * <p>
 * Progress writes only move forward and only while the upload is processing, so a late progress
 * tick can never overwrite a terminal state.
 */
@RequiredArgsConstructor
public class PostgresUploadStore implements UploadStore {

    private static final String COLUMNS = "id, user_id, bucket_name, object_key, filename, content_type, "
            + "total_size, uploaded_size, status, error_message, object_id, created_at, updated_at, completed_at";

    private final PostgresStoreContext ctx;

    @Override
    public Mono<Upload> insert(Upload upload) {
        Instant now = ctx.now();
        String id = upload.getId() != null ? upload.getId() : UUID.randomUUID().toString();
        return ctx.queryOne("INSERT INTO uploads (" + COLUMNS + ") "
                        + "VALUES ($1, $2, $3, $4, $5, $6, $7, $8, $9, $10, $11, $12, $12, $13) RETURNING " + COLUMNS,
                PostgresUploadStore::map,
                id,
                param(upload.getUserId(), String.class),
                upload.getBucketName(),
                upload.getObjectKey(),
                param(upload.getFilename(), String.class),
                param(upload.getContentType(), String.class),
                upload.getTotalSize(),
                upload.getUploadedSize(),
                upload.getStatus().getValue(),
                param(upload.getErrorMessage(), String.class),
                param(upload.getObjectId(), String.class),
                now,
                param(upload.getCompletedAt(), Instant.class));
    }

    @Override
    public Mono<Upload> findById(String id) {
        return ctx.queryOne("SELECT " + COLUMNS + " FROM uploads WHERE id = $1", PostgresUploadStore::map, id);
    }

    @Override
    public Mono<Upload> findByIdAndUser(String id, String userId) {
        if (userId == null) {
            return Mono.empty();
        }
        return ctx.queryOne("SELECT " + COLUMNS + " FROM uploads WHERE id = $1 AND user_id = $2",
                PostgresUploadStore::map, id, userId);
    }

    @Override
    public Mono<Upload> update(Upload upload) {
        return ctx.queryOne("UPDATE uploads SET total_size = $2, uploaded_size = $3, status = $4, "
                                + "error_message = $5, object_id = $6, updated_at = $7, completed_at = $8, "
                                + "content_type = $9 WHERE id = $1 RETURNING " + COLUMNS,
                        PostgresUploadStore::map,
                        upload.getId(),
                        upload.getTotalSize(),
                        upload.getUploadedSize(),
                        upload.getStatus().getValue(),
                        param(upload.getErrorMessage(), String.class),
                        param(upload.getObjectId(), String.class),
                        ctx.now(),
                        param(upload.getCompletedAt(), Instant.class),
                        param(upload.getContentType(), String.class))
                .switchIfEmpty(Mono.error(() -> new UploadNotFoundException(upload.getId())));
    }

    @Override
    public Mono<Void> updateProgress(String id, long uploadedSize) {
        return ctx.update("UPDATE uploads SET uploaded_size = $2, updated_at = $3 "
                                + "WHERE id = $1 AND status = $4 AND uploaded_size < $2",
                        id, uploadedSize, ctx.now(), UploadStatus.PROCESSING.getValue())
                .then();
    }

    @Override
    public Flux<Upload> findByUser(String userId, UploadStatus status, int limit) {
        if (status == null) {
            return ctx.query("SELECT " + COLUMNS + " FROM uploads WHERE user_id = $1 "
                    + "ORDER BY created_at DESC LIMIT $2", PostgresUploadStore::map, userId, limit);
        }
        return ctx.query("SELECT " + COLUMNS + " FROM uploads WHERE user_id = $1 AND status = $2 "
                        + "ORDER BY created_at DESC LIMIT $3",
                PostgresUploadStore::map, userId, status.getValue(), limit);
    }

    static Upload map(Row row) {
        Long totalSize = row.get("total_size", Long.class);
        Long uploadedSize = row.get("uploaded_size", Long.class);
        return Upload.builder()
                .id(row.get("id", String.class))
                .userId(row.get("user_id", String.class))
                .bucketName(row.get("bucket_name", String.class))
                .objectKey(row.get("object_key", String.class))
                .filename(row.get("filename", String.class))
                .contentType(row.get("content_type", String.class))
                .totalSize(totalSize != null ? totalSize : 0L)
                .uploadedSize(uploadedSize != null ? uploadedSize : 0L)
                .status(UploadStatus.fromValue(row.get("status", String.class)))
                .errorMessage(row.get("error_message", String.class))
                .objectId(row.get("object_id", String.class))
                .createdAt(row.get("created_at", Instant.class))
                .updatedAt(row.get("updated_at", Instant.class))
                .completedAt(row.get("completed_at", Instant.class))
                .build();
    }
}
