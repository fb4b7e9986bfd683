package win.ixuni.bkt.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 异步上传任务记录
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Upload {

    private String id;

    private String userId;

    private String bucketName;

    private String objectKey;

    private String filename;

    private String contentType;

    private long totalSize;

    private long uploadedSize;

    @Builder.Default
    private UploadStatus status = UploadStatus.PENDING;

    private String errorMessage;

    /**
     * Set once the upload completed
     */
    private String objectId;

    private Instant createdAt;

    private Instant updatedAt;

    private Instant completedAt;

    /**
     * uploaded / total * 100, 0 when the total is unknown
     */
    public double getProgressPercent() {
        if (totalSize <= 0) {
            return status == UploadStatus.COMPLETED ? 100.0 : 0.0;
        }
        return (double) uploadedSize / (double) totalSize * 100.0;
    }
}
