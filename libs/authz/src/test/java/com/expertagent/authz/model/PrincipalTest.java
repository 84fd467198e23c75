package com.expertagent.authz.model;

import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Principal and Resource")
class PrincipalTest {

    @Test
    @DisplayName("anonymous principal defaults its id")
    void anonymousDefaults() {
        var principal = Principal.anonymous();

        assertThat(principal.type()).isEqualTo(PrincipalType.ANONYMOUS);
        assertThat(principal.id()).isEqualTo("anonymous");
        assertThat(principal.attributes()).isEmpty();
        assertThat(principal.describe()).isEqualTo("Anonymous::anonymous");
    }

    @Test
    @DisplayName("attribute map is copied and unmodifiable")
    void attributesCopied() {
        var attributes = new HashMap<String, Object>();
        attributes.put("email", "a@example.com");
        var principal = Principal.user("u1", attributes);
        attributes.put("email", "changed@example.com");

        assertThat(principal.attributes()).containsEntry("email", "a@example.com");
        assertThatThrownBy(() -> principal.attributes().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("rejects a blank id")
    void blankId() {
        assertThatThrownBy(() -> Principal.user(" ", Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("id");
    }

    @Test
    @DisplayName("membershipOrgIds defaults to the organizations of the roles map")
    void membershipFromRoles() {
        var principal = Principal.user("u1", Map.of(Principal.ATTR_ROLES, Map.of("org-1", "MEMBER")));

        assertThat(principal.attributes().get(Principal.ATTR_MEMBERSHIP_ORG_IDS))
                .asInstanceOf(InstanceOfAssertFactories.LIST)
                .containsExactly("org-1");
    }

    @Test
    @DisplayName("an explicit membershipOrgIds is kept as given")
    void explicitMembership() {
        var principal = Principal.user("u1", Map.of(
                Principal.ATTR_ROLES, Map.of("org-1", "MEMBER"),
                Principal.ATTR_MEMBERSHIP_ORG_IDS, List.of()));

        assertThat(principal.attributes()).containsEntry(Principal.ATTR_MEMBERSHIP_ORG_IDS, List.of());
    }

    @Test
    @DisplayName("PrincipalType.fromString() accepts canonical values and enum names")
    void principalTypeLookup() {
        assertThat(PrincipalType.fromString("User")).contains(PrincipalType.USER);
        assertThat(PrincipalType.fromString("SERVICE")).contains(PrincipalType.SERVICE);
        assertThat(PrincipalType.fromString("Robot")).isEmpty();
    }

    @Test
    @DisplayName("agent resources always carry allowedOrgIds")
    void agentResource() {
        var agent = Resource.agent("ux-analyst", true, false, null);

        assertThat(agent.type()).isEqualTo(ResourceTypes.AGENT);
        assertThat(agent.attributes())
                .containsEntry(Resource.ATTR_IS_PUBLIC, true)
                .containsEntry(Resource.ATTR_IS_BETA, false)
                .containsKey(Resource.ATTR_ALLOWED_ORG_IDS);
        assertThat(agent.describe()).isEqualTo("Agent::ux-analyst");
    }

    @Test
    @DisplayName("request context leaves unset fields out of its attributes")
    void contextAttributes() {
        var context = RequestContext.forEnvironment("production");

        assertThat(context.asAttributes()).containsExactly(Map.entry("environment", "production"));
    }

    @Test
    @DisplayName("every registered action is unique")
    void actionRegistry() {
        assertThat(Actions.all()).doesNotHaveDuplicates().contains(Actions.HEALTH_CHECK, Actions.VIEW_AUDIT_LOG);
        assertThat(Actions.isKnown("LaunchRocket")).isFalse();
    }
}
