package win.ixuni.bkt.server.controller.api;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.exception.PolicyNotFoundException;
import win.ixuni.bkt.core.exception.ValidationException;
import win.ixuni.bkt.core.model.Policy;
import win.ixuni.bkt.core.policy.Identity;
import win.ixuni.bkt.core.policy.PolicyDocument;
import win.ixuni.bkt.server.controller.api.dto.AttachPolicyRequest;
import win.ixuni.bkt.server.controller.api.dto.PolicyRequest;
import win.ixuni.bkt.server.security.IdentityFilter;
import win.ixuni.bkt.server.service.PolicyService;

import java.util.List;
import java.util.Map;

/**
 * 策略管理接口
 */
@RestController
@RequestMapping(value = "/api/policies", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class PolicyApiController {

    private final PolicyService policyService;

    @GetMapping
    public Mono<List<Policy>> listPolicies(@RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity) {
        return policyService.listPolicies(identity).collectList();
    }

    @GetMapping("/templates")
    public Map<String, PolicyDocument> templates() {
        return policyService.templates();
    }

    @GetMapping("/{id}")
    public Mono<Policy> getPolicy(@RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
                                  @PathVariable String id) {
        return policyService.getPolicy(identity, id);
    }

    @PostMapping
    public Mono<ResponseEntity<Policy>> createPolicy(
            @RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
            @RequestBody PolicyRequest request) {
        if (request.documentJson() == null) {
            return Mono.error(ValidationException.malformedPolicy("document is required"));
        }
        return policyService.createPolicy(identity, request.name(), request.description(), request.documentJson())
                .map(policy -> ResponseEntity.status(HttpStatus.CREATED).body(policy));
    }

    @PutMapping("/{id}")
    public Mono<Policy> updatePolicy(@RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
                                     @PathVariable String id,
                                     @RequestBody PolicyRequest request) {
        return policyService.updatePolicy(identity, id, request.name(), request.description(),
                request.documentJson());
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> deletePolicy(
            @RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
            @PathVariable String id) {
        return policyService.deletePolicy(identity, id)
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    @PostMapping("/users/{userId}/attach")
    public Mono<ResponseEntity<Void>> attach(@RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
                                             @PathVariable String userId,
                                             @RequestBody AttachPolicyRequest request) {
        if (request.policyId() == null || request.policyId().isBlank()) {
            return Mono.error(new ValidationException("policy_id is required"));
        }
        return policyService.attach(identity, userId, request.policyId())
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    @DeleteMapping("/users/{userId}/detach/{policyId}")
    public Mono<ResponseEntity<Void>> detach(@RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
                                             @PathVariable String userId,
                                             @PathVariable String policyId) {
        return policyService.detach(identity, userId, policyId)
                .flatMap(detached -> detached
                        ? Mono.just(ResponseEntity.noContent().<Void>build())
                        : Mono.error(new PolicyNotFoundException(policyId + " attached to user " + userId)));
    }
}
