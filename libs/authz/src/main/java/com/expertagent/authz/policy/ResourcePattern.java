package com.expertagent.authz.policy;

import com.expertagent.authz.model.Resource;

/**
 * Which resources a policy applies to. A null component matches anything.
 *
 * @param type resource type to match, or null for any type
 * @param id   exact resource id to match, or null for any id
 */
public record ResourcePattern(String type, String id) {

    private static final ResourcePattern ANY = new ResourcePattern(null, null);

    public static ResourcePattern any() {
        return ANY;
    }

    public static ResourcePattern ofType(String type) {
        return new ResourcePattern(type, null);
    }

    public static ResourcePattern exactly(String type, String id) {
        return new ResourcePattern(type, id);
    }

    public boolean matchesType(String candidate) {
        return type == null || type.equals(candidate);
    }

    public boolean matches(Resource resource) {
        return matchesType(resource.type()) && (id == null || id.equals(resource.id()));
    }
}
