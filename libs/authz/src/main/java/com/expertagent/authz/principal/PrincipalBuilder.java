package com.expertagent.authz.principal;

import com.expertagent.authz.model.Principal;
import com.expertagent.authz.model.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds request principals from the caller's session and memberships.
 * <p>
 * Principals are rebuilt on every request so role changes take effect immediately.
 */
public final class PrincipalBuilder {

    private static final Logger log = LoggerFactory.getLogger(PrincipalBuilder.class);

    static final String UNKNOWN_USER_ID = "unknown";

    private final MembershipLookup membershipLookup;

    public PrincipalBuilder(MembershipLookup membershipLookup) {
        this.membershipLookup = membershipLookup;
    }

    /**
     * Builds the principal for a session, looking up the user's memberships.
     */
    public Principal forUser(Optional<SessionUser> session) {
        if (session.isEmpty()) {
            return Principal.anonymous();
        }
        String userId = userId(session.get());
        List<Membership> memberships = UNKNOWN_USER_ID.equals(userId)
                ? List.of()
                : membershipLookup.membershipsFor(userId);
        return fromSession(session, memberships);
    }

    /**
     * Anonymous principal when there is no session; otherwise a User principal with
     * {@code roles} (org id to role name) and {@code membershipOrgIds}.
     * <p>
     * Memberships with unrecognized role names are skipped.
     */
    public static Principal fromSession(Optional<SessionUser> session, List<Membership> memberships) {
        if (session.isEmpty()) {
            return Principal.anonymous();
        }
        SessionUser user = session.get();
        Map<String, Object> roles = new LinkedHashMap<>();
        for (Membership membership : memberships == null ? List.<Membership>of() : memberships) {
            Optional<Role> role = Role.fromString(membership.role());
            if (membership.orgId() == null || role.isEmpty()) {
                log.warn("Skipping membership with unknown role user={} org={} role={}",
                        user.id(), membership.orgId(), membership.role());
                continue;
            }
            roles.put(membership.orgId(), role.get().name());
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(Principal.ATTR_IS_AUTHENTICATED, true);
        if (user.email() != null) {
            attributes.put(Principal.ATTR_EMAIL, user.email());
        }
        if (user.authProvider() != null) {
            attributes.put(Principal.ATTR_AUTH_PROVIDER, user.authProvider());
        }
        attributes.put(Principal.ATTR_ROLES, roles);
        attributes.put(Principal.ATTR_MEMBERSHIP_ORG_IDS, new ArrayList<>(roles.keySet()));
        return Principal.user(userId(user), attributes);
    }

    private static String userId(SessionUser user) {
        if (user.id() != null && !user.id().isBlank()) {
            return user.id();
        }
        if (user.email() != null && !user.email().isBlank()) {
            return user.email();
        }
        return UNKNOWN_USER_ID;
    }
}
