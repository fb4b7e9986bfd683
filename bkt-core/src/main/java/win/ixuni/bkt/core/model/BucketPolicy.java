package win.ixuni.bkt.core.model;

import com.fasterxml.jackson.annotation.JsonRawValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Bucket 策略，每个 Bucket 至多一份
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BucketPolicy {

    private String bucketId;

    @JsonRawValue
    private String document;

    private Instant updatedAt;
}
