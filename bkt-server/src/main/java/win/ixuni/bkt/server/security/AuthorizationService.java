package win.ixuni.bkt.server.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.exception.AccessDeniedException;
import win.ixuni.bkt.core.model.Bucket;
import win.ixuni.bkt.core.policy.Identity;
import win.ixuni.bkt.core.policy.PolicyDecision;
import win.ixuni.bkt.core.policy.PolicyDocument;
import win.ixuni.bkt.core.policy.PolicyEvaluator;
import win.ixuni.bkt.core.policy.PolicyValidator;
import win.ixuni.bkt.core.policy.ResourceArns;
import win.ixuni.bkt.core.store.PolicyStore;

/**
 * 授权服务
 * <p>
 * Evaluates the caller's attached policies plus the bucket policy, if the bucket has one.
 * Every method completes empty when allowed and errors with {@link AccessDeniedException}
 * otherwise, so callers chain it before any side effect.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthorizationService {

    private final PolicyEvaluator evaluator;
    private final PolicyStore policyStore;

    public Mono<Void> checkBucket(Identity identity, String action, Bucket bucket) {
        return check(identity, action, ResourceArns.bucket(bucket.getName()), bucket);
    }

    public Mono<Void> checkBucket(Identity identity, String action, String bucketName) {
        return check(identity, action, ResourceArns.bucket(bucketName), null);
    }

    public Mono<Void> checkObject(Identity identity, String action, Bucket bucket, String key) {
        return check(identity, action, ResourceArns.object(bucket.getName(), key), bucket);
    }

    public Mono<Void> checkGlobal(Identity identity, String action) {
        return check(identity, action, ResourceArns.all(), null);
    }

    /**
     * Management operations without a resource (policies, S3 configurations)
     */
    public Mono<Void> requireAdmin(Identity identity) {
        if (identity.isAdmin()) {
            return Mono.empty();
        }
        return Mono.error(new AccessDeniedException("Administrator privileges required"));
    }

    /**
     * Non-failing variant for list filtering
     */
    public Mono<Boolean> isAllowed(Identity identity, String action, String resource, Bucket bucket) {
        if (identity.isAdmin()) {
            return Mono.just(true);
        }
        return bucketPolicy(bucket)
                .map(policy -> evaluator.evaluate(identity, action, resource, policy))
                .switchIfEmpty(Mono.fromSupplier(
                        () -> evaluator.evaluate(identity, action, resource, (PolicyDocument) null)))
                .map(PolicyDecision::isAllowed);
    }

    private Mono<Void> check(Identity identity, String action, String resource, Bucket bucket) {
        return isAllowed(identity, action, resource, bucket)
                .flatMap(allowed -> {
                    if (allowed) {
                        return Mono.empty();
                    }
                    log.debug("Denied {} on {} for {}", action, resource, identity.getUsername());
                    return Mono.error(AccessDeniedException.forAction(action, resource));
                });
    }

    private Mono<PolicyDocument> bucketPolicy(Bucket bucket) {
        if (bucket == null || bucket.getId() == null) {
            return Mono.empty();
        }
        return policyStore.findBucketPolicy(bucket.getId())
                .map(policy -> PolicyValidator.readStored(policy.getDocument()));
    }
}
