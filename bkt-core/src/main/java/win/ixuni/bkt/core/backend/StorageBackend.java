package win.ixuni.bkt.core.backend;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.model.ObjectContent;
import win.ixuni.bkt.core.model.ObjectInfo;
import win.ixuni.bkt.core.operation.BackendContext;
import win.ixuni.bkt.core.operation.Operation;
import win.ixuni.bkt.core.operation.OperationHandlerRegistry;
import win.ixuni.bkt.core.operation.bucket.BucketExistsOperation;
import win.ixuni.bkt.core.operation.bucket.CreateBucketOperation;
import win.ixuni.bkt.core.operation.bucket.DeleteBucketOperation;
import win.ixuni.bkt.core.operation.object.CopyObjectOperation;
import win.ixuni.bkt.core.operation.object.DeleteObjectOperation;
import win.ixuni.bkt.core.operation.object.GetObjectInfoOperation;
import win.ixuni.bkt.core.operation.object.GetObjectOperation;
import win.ixuni.bkt.core.operation.object.ListObjectsOperation;
import win.ixuni.bkt.core.operation.object.PutObjectOperation;

import java.nio.ByteBuffer;
import java.util.List;

/**
 * 存储后端接口
 * <p>
 * Command-pattern contract: every call goes through {@link #execute(Operation)} and the
 * handler registry of the backend. The typed methods below are shortcuts that build the
 * matching operation.
 */
public interface StorageBackend {

    // ==================== Core Methods ====================

    OperationHandlerRegistry getHandlerRegistry();

    BackendContext getBackendContext();

    /**
     * Execute an operation through the interceptor chain
     *
     * @param operation the operation instance
     * @param <O>       operation type
     * @param <R>       return type
     * @return operation result
     */
    default <O extends Operation<R>, R> Mono<R> execute(O operation) {
        return getHandlerRegistry().execute(operation, getBackendContext());
    }

    // ==================== Contract ====================

    default Mono<Void> createBucket(String bucketName, String region) {
        return execute(new CreateBucketOperation(bucketName, region));
    }

    default Mono<Boolean> bucketExists(String bucketName) {
        return execute(new BucketExistsOperation(bucketName));
    }

    default Mono<Void> deleteBucket(String bucketName) {
        return execute(new DeleteBucketOperation(bucketName));
    }

    default Mono<Void> putObject(String bucketName, String key, Flux<ByteBuffer> content,
                                 long size, String contentType) {
        return execute(PutObjectOperation.builder()
                .bucketName(bucketName)
                .key(key)
                .content(content)
                .size(size)
                .contentType(contentType)
                .build());
    }

    default Mono<ObjectContent> getObject(String bucketName, String key) {
        return execute(new GetObjectOperation(bucketName, key));
    }

    default Mono<ObjectInfo> getObjectInfo(String bucketName, String key) {
        return execute(new GetObjectInfoOperation(bucketName, key));
    }

    default Mono<Void> deleteObject(String bucketName, String key) {
        return execute(new DeleteObjectOperation(bucketName, key));
    }

    default Mono<Void> copyObject(String bucketName, String sourceKey, String destinationKey) {
        return execute(new CopyObjectOperation(bucketName, sourceKey, destinationKey));
    }

    default Mono<List<ObjectInfo>> listObjects(String bucketName, String prefix) {
        return execute(new ListObjectsOperation(bucketName, prefix));
    }

    // ==================== Backend Metadata ====================

    /**
     * @return backend type ("local" or "s3")
     */
    String getBackendType();

    /**
     * @return instance name
     */
    String getBackendName();

    Mono<Void> initialize();

    /**
     * Release clients and other resources
     */
    Mono<Void> shutdown();
}
