package com.expertagent.authz.policy;

import com.expertagent.authz.model.PrincipalType;

import java.util.Set;

/**
 * A declarative authorization rule as authored, before compilation.
 * <p>
 * {@code condition} holds the expression source; it is parsed and checked against the attribute
 * schema when the policy set is loaded into a store. A null condition always holds.
 *
 * @param id          unique, stable identifier reported in decisions and audit logs
 * @param description human-readable text used as the decision reason when this policy decides
 */
public record Policy(
        String id,
        String description,
        Effect effect,
        PrincipalPattern principal,
        ActionPattern actions,
        ResourcePattern resource,
        String condition
) {

    public Policy {
        if (principal == null) {
            principal = PrincipalPattern.any();
        }
        if (actions == null) {
            actions = ActionPattern.any();
        }
        if (resource == null) {
            resource = ResourcePattern.any();
        }
        if (condition != null && condition.isBlank()) {
            condition = null;
        }
    }

    public static Builder permit(String id) {
        return new Builder(id, Effect.PERMIT);
    }

    public static Builder forbid(String id) {
        return new Builder(id, Effect.FORBID);
    }

    public boolean isForbid() {
        return effect == Effect.FORBID;
    }

    /**
     * Fluent authoring helper:
     * <pre>{@code
     * Policy.permit("member-read-org")
     *         .describedAs("Members can view their organization")
     *         .principal(PrincipalType.USER)
     *         .actions(Actions.GET_ORG)
     *         .resourceType(ResourceTypes.ORG)
     *         .when("principal.roles[resource.id] >= \"MEMBER\"")
     *         .build();
     * }</pre>
     */
    public static final class Builder {

        private final String id;
        private final Effect effect;
        private String description;
        private PrincipalPattern principal = PrincipalPattern.any();
        private ActionPattern actions = ActionPattern.any();
        private ResourcePattern resource = ResourcePattern.any();
        private String condition;

        private Builder(String id, Effect effect) {
            this.id = id;
            this.effect = effect;
        }

        public Builder describedAs(String description) {
            this.description = description;
            return this;
        }

        public Builder principal(PrincipalType type) {
            this.principal = PrincipalPattern.ofType(type);
            return this;
        }

        public Builder principal(PrincipalType type, String principalId) {
            this.principal = PrincipalPattern.exactly(type, principalId);
            return this;
        }

        public Builder actions(String... actionIds) {
            this.actions = ActionPattern.of(actionIds);
            return this;
        }

        public Builder actions(Set<String> actionIds) {
            this.actions = ActionPattern.of(actionIds);
            return this;
        }

        public Builder anyAction() {
            this.actions = ActionPattern.any();
            return this;
        }

        public Builder resourceType(String type) {
            this.resource = ResourcePattern.ofType(type);
            return this;
        }

        public Builder resource(String type, String resourceId) {
            this.resource = ResourcePattern.exactly(type, resourceId);
            return this;
        }

        public Builder when(String condition) {
            this.condition = condition;
            return this;
        }

        public Policy build() {
            return new Policy(id, description == null ? id : description, effect, principal, actions, resource,
                    condition);
        }
    }
}
