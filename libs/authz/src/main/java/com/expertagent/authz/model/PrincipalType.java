package com.expertagent.authz.model;

import java.util.Optional;

/**
 * Kinds of principals that can request access.
 */
public enum PrincipalType {

    /** Unauthenticated caller. Carries only an identifier for logging. */
    ANONYMOUS("Anonymous"),
    /** Authenticated end user with per-organization roles. */
    USER("User"),
    /** Trusted internal caller such as a scheduled job. */
    SERVICE("Service");

    private final String value;

    PrincipalType(String value) {
        this.value = value;
    }

    /** The canonical string used in policies and wire formats (e.g., "User"). */
    public String value() {
        return value;
    }

    /**
     * Looks up a principal type by its canonical value or enum name, ignoring case.
     */
    public static Optional<PrincipalType> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (PrincipalType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
