package win.ixuni.bkt.core.store;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.model.Upload;
import win.ixuni.bkt.core.model.UploadStatus;

/**
 * 异步上传任务存储
 */
public interface UploadStore {

    Mono<Upload> insert(Upload upload);

    Mono<Upload> findById(String id);

    /**
     * Lookup scoped to the owner; another user's upload is reported as missing
     */
    Mono<Upload> findByIdAndUser(String id, String userId);

    /**
     * Replace status, sizes, error, object id and timestamps
     */
    Mono<Upload> update(Upload upload);

    /**
     * Raise {@code uploadedSize} while the upload is processing. Never lowers the value and
     * never touches a finished upload, so late progress writes cannot undo a completion.
     */
    Mono<Void> updateProgress(String id, long uploadedSize);

    /**
     * Newest first
     *
     * @param status optional filter, null for all
     */
    Flux<Upload> findByUser(String userId, UploadStatus status, int limit);
}
