package com.expertagent.authz;

import com.expertagent.authz.condition.Condition;
import com.expertagent.authz.condition.EvaluationContext;
import com.expertagent.authz.policy.Policy;

/**
 * A loaded policy with its condition parsed.
 *
 * @param condition compiled condition, or null when the policy is unconditional
 */
public record CompiledPolicy(Policy policy, Condition condition) {

    public String id() {
        return policy.id();
    }

    /**
     * Checks the full principal, action and resource patterns, then the condition.
     */
    boolean applies(AuthorizationRequest request, EvaluationContext context) {
        return policy.principal().matches(request.principal())
                && policy.actions().matches(request.action().id())
                && policy.resource().matches(request.resource())
                && (condition == null || condition.test(context));
    }
}
