package win.ixuni.bkt.core.policy;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * IAM 风格策略文档
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PolicyDocument {

    public static final String VERSION = "2012-10-17";

    @JsonProperty("Version")
    private String version;

    @JsonProperty("Statement")
    @Builder.Default
    private List<Statement> statements = new ArrayList<>();
}
