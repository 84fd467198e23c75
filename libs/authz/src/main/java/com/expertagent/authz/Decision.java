package com.expertagent.authz;

import java.util.Optional;

/**
 * Outcome of an authorization check.
 *
 * @param authorized  whether access is granted
 * @param reason      human-readable explanation: the matched policy's description, the default-deny
 *                    message, or the reason a request was rejected as malformed
 * @param diagnostics evaluation details for audit logs
 */
public record Decision(boolean authorized, String reason, Diagnostics diagnostics) {

    public static final String DEFAULT_DENY_REASON = "No matching policy (default deny)";
    public static final String EVALUATION_FAILED_REASON = "Policy evaluation failed (default deny)";

    public Decision {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason must not be null or blank");
        }
        if (diagnostics == null) {
            diagnostics = Diagnostics.none();
        }
    }

    public boolean isAuthorized() {
        return authorized;
    }

    public static Decision permit(String policyId, String reason, int policiesEvaluated) {
        return new Decision(true, reason, new Diagnostics(policiesEvaluated, policyId));
    }

    public static Decision deny(String policyId, String reason, int policiesEvaluated) {
        return new Decision(false, reason, new Diagnostics(policiesEvaluated, policyId));
    }

    public static Decision defaultDeny(int policiesEvaluated) {
        return new Decision(false, DEFAULT_DENY_REASON, new Diagnostics(policiesEvaluated, null));
    }

    public static Decision malformed(String problem) {
        return new Decision(false, "Malformed authorization request: " + problem, Diagnostics.none());
    }

    public static Decision evaluationFailed(int policiesEvaluated) {
        return new Decision(false, EVALUATION_FAILED_REASON, new Diagnostics(policiesEvaluated, null));
    }

    /**
     * @param policiesEvaluated number of policies whose patterns and conditions were checked
     * @param matchedPolicyId   id of the policy that decided the outcome; null on default deny
     */
    public record Diagnostics(int policiesEvaluated, String matchedPolicyId) {

        public static Diagnostics none() {
            return new Diagnostics(0, null);
        }

        public Optional<String> matchedPolicy() {
            return Optional.ofNullable(matchedPolicyId);
        }
    }
}
