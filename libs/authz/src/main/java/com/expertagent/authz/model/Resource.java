package com.expertagent.authz.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The target of an action.
 * <p>
 * Attribute keys vary by type. For {@code Agent}: {@value #ATTR_IS_PUBLIC}, {@value #ATTR_IS_BETA}
 * and {@value #ATTR_ALLOWED_ORG_IDS}; for org-scoped resources such as files and sessions:
 * {@value #ATTR_ORG_ID} and {@value #ATTR_OWNER_ID}. An empty {@value #ATTR_ALLOWED_ORG_IDS}
 * means the agent is available to every organization, so callers always set the attribute,
 * even when empty, rather than leaving it out.
 *
 * @param type       resource type (see {@link ResourceTypes})
 * @param id         resource identifier; {@value #ANY_ID} for collection-level checks
 * @param attributes attribute map read by policy conditions; never null, unmodifiable
 */
public record Resource(String type, String id, Map<String, Object> attributes) {

    public static final String ATTR_ORG_ID = "orgId";
    public static final String ATTR_OWNER_ID = "ownerId";
    public static final String ATTR_USER_ID = "userId";
    public static final String ATTR_IS_PUBLIC = "isPublic";
    public static final String ATTR_IS_BETA = "isBeta";
    public static final String ATTR_ALLOWED_ORG_IDS = "allowedOrgIds";

    /** Id used when authorizing a collection rather than a single resource. */
    public static final String ANY_ID = "*";

    public Resource {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("resource type must not be null or blank");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("resource id must not be null or blank");
        }
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static Resource of(String type, String id) {
        return new Resource(type, id, Map.of());
    }

    public static Resource org(String orgId) {
        return new Resource(ResourceTypes.ORG, orgId, Map.of());
    }

    /**
     * Builds an agent resource with the availability attributes agent policies read.
     */
    public static Resource agent(String agentId, boolean isPublic, boolean isBeta, List<String> allowedOrgIds) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(ATTR_IS_PUBLIC, isPublic);
        attributes.put(ATTR_IS_BETA, isBeta);
        attributes.put(ATTR_ALLOWED_ORG_IDS, allowedOrgIds == null ? List.of() : List.copyOf(allowedOrgIds));
        return new Resource(ResourceTypes.AGENT, agentId, attributes);
    }

    /** Renders the resource as {@code Type::id} for logs. */
    public String describe() {
        return type + "::" + id;
    }
}
