package win.ixuni.bkt.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 存储后端类型
 */
public enum StorageBackendType {

    LOCAL("local"),
    S3("s3");

    private final String value;

    StorageBackendType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static StorageBackendType fromValue(String value) {
        if (value == null || value.isEmpty()) {
            return LOCAL;
        }
        for (StorageBackendType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown storage backend: " + value);
    }
}
