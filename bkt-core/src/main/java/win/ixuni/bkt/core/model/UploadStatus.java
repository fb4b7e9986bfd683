package win.ixuni.bkt.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 异步上传状态: pending → processing → completed | failed
 */
public enum UploadStatus {

    PENDING("pending"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    UploadStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public static UploadStatus fromValue(String value) {
        for (UploadStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown upload status: " + value);
    }
}
