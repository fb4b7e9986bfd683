package win.ixuni.bkt.core.model;

import com.fasterxml.jackson.annotation.JsonRawValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 命名策略，可挂载到多个用户
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Policy {

    private String id;

    private String name;

    private String description;

    /**
     * Validated and re-serialized policy document JSON
     */
    @JsonRawValue
    private String document;

    private Instant createdAt;

    private Instant updatedAt;
}
