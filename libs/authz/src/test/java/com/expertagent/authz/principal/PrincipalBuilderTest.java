package com.expertagent.authz.principal;

import com.expertagent.authz.model.Principal;
import com.expertagent.authz.model.PrincipalType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PrincipalBuilder")
class PrincipalBuilderTest {

    @Nested
    @DisplayName("fromSession()")
    class FromSession {

        @Test
        @DisplayName("no session yields the anonymous principal")
        void anonymous() {
            var principal = PrincipalBuilder.fromSession(Optional.empty(), List.of());

            assertThat(principal.type()).isEqualTo(PrincipalType.ANONYMOUS);
            assertThat(principal.id()).isEqualTo(Principal.ANONYMOUS_ID);
        }

        @Test
        @DisplayName("a session yields a user with roles and membership org ids")
        void user() {
            var principal = PrincipalBuilder.fromSession(
                    Optional.of(new SessionUser("u1", "ada@example.com", "google")),
                    List.of(new Membership("org-1", "owner"), new Membership("org-2", "billing_manager")));

            assertThat(principal.type()).isEqualTo(PrincipalType.USER);
            assertThat(principal.id()).isEqualTo("u1");
            assertThat(principal.attributes())
                    .containsEntry(Principal.ATTR_IS_AUTHENTICATED, true)
                    .containsEntry(Principal.ATTR_EMAIL, "ada@example.com")
                    .containsEntry(Principal.ATTR_AUTH_PROVIDER, "google")
                    .containsEntry(Principal.ATTR_ROLES, Map.of("org-1", "OWNER", "org-2", "BILLING_MANAGER"))
                    .containsEntry(Principal.ATTR_MEMBERSHIP_ORG_IDS, List.of("org-1", "org-2"));
        }

        @Test
        @DisplayName("falls back to email, then to 'unknown', for the user id")
        void idFallback() {
            var byEmail = PrincipalBuilder.fromSession(Optional.of(new SessionUser(null, "ada@example.com", null)),
                    List.of());
            var unknown = PrincipalBuilder.fromSession(Optional.of(new SessionUser(" ", null, null)), List.of());

            assertThat(byEmail.id()).isEqualTo("ada@example.com");
            assertThat(unknown.id()).isEqualTo("unknown");
            assertThat(unknown.attributes()).doesNotContainKey(Principal.ATTR_EMAIL);
        }

        @Test
        @DisplayName("memberships with unknown roles are skipped")
        void unknownRole() {
            var principal = PrincipalBuilder.fromSession(Optional.of(new SessionUser("u1", null, null)),
                    List.of(new Membership("org-1", "superuser"), new Membership("org-2", "member")));

            assertThat(principal.attributes().get(Principal.ATTR_ROLES)).isEqualTo(Map.of("org-2", "MEMBER"));
            assertThat(principal.attributes().get(Principal.ATTR_MEMBERSHIP_ORG_IDS)).isEqualTo(List.of("org-2"));
        }
    }

    @Nested
    @DisplayName("forUser()")
    class ForUser {

        @Test
        @DisplayName("looks up memberships by the resolved user id")
        void lookup() {
            var requested = new ArrayList<String>();
            var builder = new PrincipalBuilder(userId -> {
                requested.add(userId);
                return List.of(new Membership("org-9", "admin"));
            });

            var principal = builder.forUser(Optional.of(new SessionUser("u9", null, null)));

            assertThat(requested).containsExactly("u9");
            assertThat(principal.attributes().get(Principal.ATTR_ROLES)).isEqualTo(Map.of("org-9", "ADMIN"));
        }

        @Test
        @DisplayName("skips the lookup for anonymous and unidentifiable sessions")
        void noLookup() {
            var requested = new ArrayList<String>();
            var builder = new PrincipalBuilder(userId -> {
                requested.add(userId);
                return List.of();
            });

            builder.forUser(Optional.empty());
            builder.forUser(Optional.of(new SessionUser(null, null, null)));

            assertThat(requested).isEmpty();
        }
    }
}
