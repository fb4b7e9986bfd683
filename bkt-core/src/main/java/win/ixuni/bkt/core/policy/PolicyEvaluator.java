package win.ixuni.bkt.core.policy;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 策略求值器
 * <p>
 * Evaluation order:
 * <ol>
 *     <li>admin identity: ALLOW</li>
 *     <li>gather the statements of every given document</li>
 *     <li>any matching Deny: DENY</li>
 *     <li>any matching Allow: ALLOW</li>
 *     <li>otherwise DENY</li>
 * </ol>
 * The outcome does not depend on statement or document order.
 */
@Slf4j
public class PolicyEvaluator {

    /**
     * @param identity caller
     * @param action   e.g. {@code s3:GetObject}
     * @param resource ARN of the bucket or object
     * @param policies the caller's attached policies plus the bucket policy, if any
     * @return decision
     */
    public PolicyDecision evaluate(Identity identity, String action, String resource,
                                   Collection<PolicyDocument> policies) {
        if (identity != null && identity.isAdmin()) {
            return PolicyDecision.ALLOW;
        }

        boolean allowed = false;
        for (Statement statement : collectStatements(policies)) {
            if (!statement.matches(action, resource)) {
                continue;
            }
            Effect effect = statement.getEffectType();
            if (effect == Effect.DENY) {
                log.debug("Explicit deny for {} on {} (sid={})", action, resource, statement.getSid());
                return PolicyDecision.DENY;
            }
            if (effect == Effect.ALLOW) {
                allowed = true;
            }
        }
        return allowed ? PolicyDecision.ALLOW : PolicyDecision.DENY;
    }

    /**
     * Convenience overload for the identity's own policies plus an optional bucket policy
     */
    public PolicyDecision evaluate(Identity identity, String action, String resource,
                                   PolicyDocument bucketPolicy) {
        List<PolicyDocument> all = new ArrayList<>();
        if (identity != null) {
            all.addAll(identity.getPolicies());
        }
        if (bucketPolicy != null) {
            all.add(bucketPolicy);
        }
        return evaluate(identity, action, resource, all);
    }

    private static List<Statement> collectStatements(Collection<PolicyDocument> policies) {
        List<Statement> statements = new ArrayList<>();
        if (policies == null) {
            return statements;
        }
        for (PolicyDocument document : policies) {
            if (document != null && document.getStatements() != null) {
                statements.addAll(document.getStatements());
            }
        }
        return statements;
    }
}
