package win.ixuni.bkt.server.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.exception.PolicyNotFoundException;
import win.ixuni.bkt.core.exception.UserNotFoundException;
import win.ixuni.bkt.core.exception.ValidationException;
import win.ixuni.bkt.core.model.Policy;
import win.ixuni.bkt.core.policy.Identity;
import win.ixuni.bkt.core.policy.PolicyDocument;
import win.ixuni.bkt.core.policy.PolicyTemplates;
import win.ixuni.bkt.core.policy.PolicyValidator;
import win.ixuni.bkt.core.store.PolicyStore;
import win.ixuni.bkt.core.store.UserStore;
import win.ixuni.bkt.server.security.AuthorizationService;

import java.util.Map;

/**
 * 策略管理服务
 * <p>
 * Mutations are admin only. Documents are validated and stored in their re-serialized form.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PolicyService {

    private final PolicyStore policyStore;
    private final UserStore userStore;
    private final PolicyValidator policyValidator;
    private final AuthorizationService authorization;

    /**
     * Admins see every policy, everybody else the policies attached to them
     */
    public Flux<Policy> listPolicies(Identity identity) {
        if (identity.isAdmin()) {
            return policyStore.findAll();
        }
        if (identity.isAnonymous()) {
            return Flux.empty();
        }
        return policyStore.findByUser(identity.getUserId());
    }

    public Mono<Policy> getPolicy(Identity identity, String id) {
        return authorization.requireAdmin(identity)
                .then(find(id));
    }

    public Mono<Policy> createPolicy(Identity identity, String name, String description, String documentJson) {
        return authorization.requireAdmin(identity)
                .then(Mono.fromCallable(() -> {
                    requireName(name);
                    return canonical(documentJson);
                }))
                .flatMap(document -> policyStore.insert(Policy.builder()
                        .name(name.trim())
                        .description(description)
                        .document(document)
                        .build()))
                .doOnSuccess(policy -> log.info("Created policy {} ({})", policy.getName(), policy.getId()));
    }

    /**
     * Null fields keep their current value
     */
    public Mono<Policy> updatePolicy(Identity identity, String id, String name, String description,
                                     String documentJson) {
        return authorization.requireAdmin(identity)
                .then(find(id))
                .flatMap(existing -> Mono.fromCallable(() -> {
                    Policy.PolicyBuilder updated = existing.toBuilder();
                    if (name != null) {
                        requireName(name);
                        updated.name(name.trim());
                    }
                    if (description != null) {
                        updated.description(description);
                    }
                    if (documentJson != null) {
                        updated.document(canonical(documentJson));
                    }
                    return updated.build();
                }))
                .flatMap(policyStore::update)
                .doOnSuccess(policy -> log.info("Updated policy {} ({})", policy.getName(), policy.getId()));
    }

    public Mono<Void> deletePolicy(Identity identity, String id) {
        return authorization.requireAdmin(identity)
                .then(find(id))
                .flatMap(policy -> policyStore.delete(policy.getId()))
                .doOnSuccess(v -> log.info("Deleted policy {}", id));
    }

    public Mono<Void> attach(Identity identity, String userId, String policyId) {
        return authorization.requireAdmin(identity)
                .then(userStore.findById(userId)
                        .switchIfEmpty(Mono.error(() -> new UserNotFoundException(userId))))
                .then(find(policyId))
                .flatMap(policy -> policyStore.attach(userId, policy.getId()))
                .doOnSuccess(v -> log.info("Attached policy {} to user {}", policyId, userId));
    }

    /**
     * @return false when the policy was not attached
     */
    public Mono<Boolean> detach(Identity identity, String userId, String policyId) {
        return authorization.requireAdmin(identity)
                .then(policyStore.detach(userId, policyId))
                .doOnNext(detached -> {
                    if (detached) {
                        log.info("Detached policy {} from user {}", policyId, userId);
                    }
                });
    }

    public Map<String, PolicyDocument> templates() {
        return PolicyTemplates.all();
    }

    private Mono<Policy> find(String id) {
        return policyStore.findById(id)
                .switchIfEmpty(Mono.error(() -> new PolicyNotFoundException(id)));
    }

    private String canonical(String documentJson) {
        return policyValidator.toJson(policyValidator.parse(documentJson));
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Policy name is required");
        }
    }
}
