package com.expertagent.authzservice.api;

import com.expertagent.authz.Decision;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response body of the decision endpoint.
 */
public record DecisionResponse(
        @JsonProperty("isAuthorized") boolean isAuthorized, String reason, DiagnosticsBody diagnostics) {

    public static DecisionResponse from(Decision decision) {
        return new DecisionResponse(
                decision.isAuthorized(),
                decision.reason(),
                new DiagnosticsBody(
                        decision.diagnostics().policiesEvaluated(), decision.diagnostics().matchedPolicyId()));
    }

    public record DiagnosticsBody(int policiesEvaluated, String matchedPolicyId) {
    }
}
