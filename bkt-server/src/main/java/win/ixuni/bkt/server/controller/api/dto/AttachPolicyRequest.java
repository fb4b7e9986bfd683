package win.ixuni.bkt.server.controller.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AttachPolicyRequest(@JsonProperty("policy_id") String policyId) {
}
