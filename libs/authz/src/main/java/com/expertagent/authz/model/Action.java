package com.expertagent.authz.model;

/**
 * A named operation being authorized. Action ids are opaque and matched exactly by policies;
 * see {@link Actions} for the ids the platform's routes use.
 *
 * @param id action identifier (e.g., "QueryAgent")
 */
public record Action(String id) {

    /** Entity type name used for actions in wire formats. */
    public static final String TYPE = "Action";

    public Action {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("action id must not be null or blank");
        }
    }

    public static Action of(String id) {
        return new Action(id);
    }
}
