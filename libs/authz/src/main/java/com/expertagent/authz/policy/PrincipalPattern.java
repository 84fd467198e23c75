package com.expertagent.authz.policy;

import com.expertagent.authz.model.Principal;
import com.expertagent.authz.model.PrincipalType;

/**
 * Which principals a policy applies to. A null component matches anything.
 *
 * @param type principal type to match, or null for any type
 * @param id   exact principal id to match, or null for any id
 */
public record PrincipalPattern(PrincipalType type, String id) {

    private static final PrincipalPattern ANY = new PrincipalPattern(null, null);

    public static PrincipalPattern any() {
        return ANY;
    }

    public static PrincipalPattern ofType(PrincipalType type) {
        return new PrincipalPattern(type, null);
    }

    public static PrincipalPattern exactly(PrincipalType type, String id) {
        return new PrincipalPattern(type, id);
    }

    public boolean matchesType(PrincipalType candidate) {
        return type == null || type == candidate;
    }

    public boolean matches(Principal principal) {
        return matchesType(principal.type()) && (id == null || id.equals(principal.id()));
    }
}
