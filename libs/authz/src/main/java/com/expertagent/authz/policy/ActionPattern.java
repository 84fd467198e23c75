package com.expertagent.authz.policy;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Which actions a policy applies to: every action, or an explicit set of ids.
 *
 * @param anyAction true to match every action
 * @param actionIds ids to match when {@code anyAction} is false
 */
public record ActionPattern(boolean anyAction, Set<String> actionIds) {

    private static final ActionPattern ANY = new ActionPattern(true, Set.of());

    public ActionPattern {
        actionIds = actionIds == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(actionIds));
    }

    public static ActionPattern any() {
        return ANY;
    }

    public static ActionPattern of(String... actionIds) {
        return new ActionPattern(false, new LinkedHashSet<>(Arrays.asList(actionIds)));
    }

    public static ActionPattern of(Set<String> actionIds) {
        return new ActionPattern(false, actionIds);
    }

    public boolean matches(String actionId) {
        return anyAction || actionIds.contains(actionId);
    }
}
