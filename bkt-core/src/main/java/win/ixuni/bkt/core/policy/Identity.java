package win.ixuni.bkt.core.policy;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * 调用者身份
 * <p>
 * Resolved by the upstream authentication layer; the gateway only loads the admin flag and
 * the attached policies.
 */
@Value
@Builder
public class Identity {

    private static final Identity ANONYMOUS = Identity.builder()
            .userId(null)
            .username("anonymous")
            .admin(false)
            .policies(Collections.emptyList())
            .build();

    String userId;

    String username;

    boolean admin;

    /**
     * Parsed documents of every policy attached to the user
     */
    @Builder.Default
    List<PolicyDocument> policies = Collections.emptyList();

    public static Identity anonymous() {
        return ANONYMOUS;
    }

    public boolean isAnonymous() {
        return userId == null;
    }
}
