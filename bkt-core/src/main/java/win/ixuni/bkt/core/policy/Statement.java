package win.ixuni.bkt.core.policy;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 策略语句
 * <p>
 * {@code Action} and {@code Resource} accept either a single string or an array on input and
 * are always written back as arrays. {@code Condition} is carried verbatim but never evaluated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class Statement {

    @JsonProperty("Sid")
    private String sid;

    @JsonProperty("Effect")
    private String effect;

    @JsonProperty("Action")
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    @Builder.Default
    private List<String> actions = new ArrayList<>();

    @JsonProperty("Resource")
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    @Builder.Default
    private List<String> resources = new ArrayList<>();

    @JsonProperty("Condition")
    private Map<String, Object> condition;

    @JsonIgnore
    public Effect getEffectType() {
        return Effect.fromValue(effect);
    }

    /**
     * @return true when the statement covers the given action and resource
     */
    public boolean matches(String action, String resource) {
        return PolicyMatcher.anyMatches(actions, action) && PolicyMatcher.anyMatches(resources, resource);
    }
}
