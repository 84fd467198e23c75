package com.expertagent.authzservice.api;

import com.expertagent.authz.CompiledPolicy;
import com.expertagent.authz.PolicyStore;
import com.expertagent.authz.model.Actions;
import com.expertagent.authz.model.ResourceTypes;
import com.expertagent.authz.policy.Policy;
import com.expertagent.authzservice.security.RequiresAuthorization;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only inventory of the loaded policy set.
 */
@RestController
@RequestMapping("/api/v1/authz")
public class PolicyController {

    private final PolicyStore policyStore;

    public PolicyController(PolicyStore policyStore) {
        this.policyStore = policyStore;
    }

    @RequiresAuthorization(action = Actions.VIEW_POLICIES, resourceType = ResourceTypes.POLICY)
    @GetMapping("/policies")
    public PolicyInventory policies() {
        List<PolicySummary> summaries = policyStore.policies().stream()
                .map(CompiledPolicy::policy)
                .map(PolicySummary::from)
                .toList();
        return new PolicyInventory(policyStore.version(), summaries.size(), summaries);
    }

    public record PolicyInventory(String version, int count, List<PolicySummary> policies) {
    }

    /**
     * One policy as shown to operators. A null type or id means "any"; an empty action list means
     * every action.
     */
    public record PolicySummary(
            String id,
            String description,
            String effect,
            String principalType,
            String principalId,
            List<String> actions,
            String resourceType,
            String resourceId,
            String condition) {

        static PolicySummary from(Policy policy) {
            return new PolicySummary(
                    policy.id(),
                    policy.description(),
                    policy.effect().value(),
                    policy.principal().type() == null ? null : policy.principal().type().value(),
                    policy.principal().id(),
                    policy.actions().anyAction() ? List.of() : List.copyOf(policy.actions().actionIds()),
                    policy.resource().type(),
                    policy.resource().id(),
                    policy.condition());
        }
    }
}
