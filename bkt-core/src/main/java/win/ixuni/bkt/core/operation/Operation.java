package win.ixuni.bkt.core.operation;

/**
 * 存储后端操作基础接口
 * <p>
 * Every call a storage backend understands (CreateBucket, PutObject, ...) is one command class.
 * 泛型参数 R 表示操作的返回类型。
 *
 * @param <R> 操作返回类型
 */
public interface Operation<R> {

    /**
     * Logical bucket name the operation targets
     */
    String getBucketName();

    /**
     * Object key the operation targets, null for bucket-level operations
     */
    default String getKey() {
        return null;
    }

    /**
     * Operation name used in logs
     *
     * @return 操作名称，如 "CreateBucket", "PutObject"
     */
    default String getOperationName() {
        String className = getClass().getSimpleName();
        if (className.endsWith("Operation")) {
            return className.substring(0, className.length() - 9);
        }
        return className;
    }
}
