package com.expertagent.authz.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The actor requesting authorization.
 * <p>
 * User principals conventionally carry {@value #ATTR_ROLES} (organization id to role name) and
 * {@value #ATTR_MEMBERSHIP_ORG_IDS} (the key set of the roles map). Principals are built fresh
 * for every request and are never stored by the engine.
 *
 * @param type       principal kind
 * @param id         stable identifier (user id, service name, or a logging tag for anonymous callers)
 * @param attributes attribute map read by policy conditions; never null, unmodifiable
 */
public record Principal(PrincipalType type, String id, Map<String, Object> attributes) {

    public static final String ATTR_ROLES = "roles";
    public static final String ATTR_MEMBERSHIP_ORG_IDS = "membershipOrgIds";
    public static final String ATTR_IS_AUTHENTICATED = "isAuthenticated";
    public static final String ATTR_EMAIL = "email";
    public static final String ATTR_AUTH_PROVIDER = "authProvider";
    public static final String ATTR_IS_TEST_PRINCIPAL = "isTestPrincipal";

    /** Identifier used for anonymous principals when the caller supplies none. */
    public static final String ANONYMOUS_ID = "anonymous";

    public Principal {
        if (type == null) {
            throw new IllegalArgumentException("principal type must not be null");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("principal id must not be null or blank");
        }
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(withMembershipOrgIds(attributes));
    }

    /** Fills {@value #ATTR_MEMBERSHIP_ORG_IDS} from the keys of {@value #ATTR_ROLES} when only roles are given. */
    private static Map<String, Object> withMembershipOrgIds(Map<String, Object> attributes) {
        Map<String, Object> copy = new LinkedHashMap<>(attributes);
        if (!copy.containsKey(ATTR_MEMBERSHIP_ORG_IDS) && copy.get(ATTR_ROLES) instanceof Map<?, ?> roles) {
            List<String> orgIds = new ArrayList<>();
            roles.keySet().forEach(orgId -> orgIds.add(String.valueOf(orgId)));
            copy.put(ATTR_MEMBERSHIP_ORG_IDS, Collections.unmodifiableList(orgIds));
        }
        return copy;
    }

    public static Principal anonymous() {
        return anonymous(ANONYMOUS_ID);
    }

    public static Principal anonymous(String id) {
        return new Principal(PrincipalType.ANONYMOUS, id, Map.of());
    }

    public static Principal user(String id, Map<String, Object> attributes) {
        return new Principal(PrincipalType.USER, id, attributes);
    }

    public static Principal service(String serviceName) {
        return new Principal(PrincipalType.SERVICE, serviceName, Map.of());
    }

    /** Renders the principal as {@code Type::id} for logs. */
    public String describe() {
        return type.value() + "::" + id;
    }
}
