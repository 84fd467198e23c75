package com.expertagent.authz;

import com.expertagent.authz.condition.AttributeSchema;
import com.expertagent.authz.condition.Root;
import com.expertagent.authz.model.PrincipalType;
import com.expertagent.authz.policy.Policy;
import com.expertagent.authz.policy.PolicyConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PolicyStore")
class PolicyStoreTest {

    @Test
    @DisplayName("policiesFor() filters by principal type, action and resource type in declaration order")
    void candidateSelection() {
        var store = PolicyStore.load(List.of(
                Policy.permit("users-orgs").principal(PrincipalType.USER).actions("GetOrg").resourceType("Org").build(),
                Policy.forbid("anyone-anything").build(),
                Policy.permit("anon-agents").principal(PrincipalType.ANONYMOUS).actions("GetAgent")
                        .resourceType("Agent").build(),
                Policy.permit("users-any-resource").principal(PrincipalType.USER).actions("GetOrg", "GetAgent").build()));

        assertThat(store.policiesFor(PrincipalType.USER, "GetOrg", "Org"))
                .extracting(CompiledPolicy::id)
                .containsExactly("users-orgs", "anyone-anything", "users-any-resource");
        assertThat(store.policiesFor(PrincipalType.ANONYMOUS, "GetAgent", "Agent"))
                .extracting(CompiledPolicy::id)
                .containsExactly("anyone-anything", "anon-agents");
        assertThat(store.policiesFor(PrincipalType.SERVICE, "GetOrg", "Org"))
                .extracting(CompiledPolicy::id)
                .containsExactly("anyone-anything");
    }

    @Test
    @DisplayName("compiles conditions and leaves unconditional policies without one")
    void compiles() {
        var store = PolicyStore.load(List.of(
                Policy.permit("with").when("resource.isPublic").build(),
                Policy.permit("without").build()));

        assertThat(store.policies().get(0).condition()).isNotNull();
        assertThat(store.policies().get(1).condition()).isNull();
        assertThat(store.size()).isEqualTo(2);
        assertThat(store.version()).isEqualTo("unversioned");
    }

    @Test
    @DisplayName("rejects an invalid set with every error")
    void failsFast() {
        assertThatThrownBy(() -> PolicyStore.load(List.of(
                Policy.permit("a").when("resource.isPublic ==").build(),
                Policy.permit("a").build())))
                .isInstanceOf(PolicyConfigurationException.class)
                .satisfies(e -> assertThat(((PolicyConfigurationException) e).errors()).hasSize(2));
    }

    @Test
    @DisplayName("honours a custom attribute schema")
    void customSchema() {
        var schema = AttributeSchema.builder().attributes(Root.RESOURCE, "tier").build();

        var store = PolicyStore.load("v2", List.of(Policy.permit("tiered").when("resource.tier == \"gold\"").build()),
                schema);

        assertThat(store.version()).isEqualTo("v2");
        assertThatThrownBy(() -> PolicyStore.load("v2",
                List.of(Policy.permit("x").when("resource.isPublic").build()), schema))
                .isInstanceOf(PolicyConfigurationException.class);
    }
}
