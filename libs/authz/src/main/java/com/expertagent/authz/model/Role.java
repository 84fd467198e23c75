package com.expertagent.authz.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Organization-scoped membership roles, ordered by privilege.
 * <p>
 * A user holds at most one role per organization, and may hold different roles in different
 * organizations. Privilege order is {@code OWNER > ADMIN > BILLING_MANAGER = AUDITOR > MEMBER}:
 * billing managers and auditors sit at the same rank with different, parallel scopes, so
 * neither implies the other through {@link #isAtLeast(Role)} alone except by rank.
 */
public enum Role {

    OWNER("owner", 40),
    ADMIN("admin", 30),
    BILLING_MANAGER("billing_manager", 20),
    AUDITOR("auditor", 20),
    MEMBER("member", 10);

    private final String value;
    private final int rank;

    Role(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    /** The canonical lower-case representation stored with memberships (e.g., "billing_manager"). */
    public String value() {
        return value;
    }

    /** Privilege rank; higher is more privileged. */
    public int rank() {
        return rank;
    }

    /**
     * Checks whether this role is at least as privileged as {@code required}.
     * <p>
     * {@code OWNER.isAtLeast(ADMIN)} is true, {@code MEMBER.isAtLeast(ADMIN)} is false.
     */
    public boolean isAtLeast(Role required) {
        return rank >= required.rank;
    }

    /**
     * Looks up a role by name, ignoring case. Both the enum name ({@code "BILLING_MANAGER"}) and
     * the stored value ({@code "billing_manager"}) are accepted.
     *
     * @param value the string to match
     * @return the matching role, or empty if not found
     */
    public static Optional<Role> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        for (Role role : values()) {
            if (role.value.equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    /**
     * Interprets an attribute value as a role: a {@link Role} instance or a role name.
     */
    public static Optional<Role> fromValue(Object value) {
        if (value instanceof Role role) {
            return Optional.of(role);
        }
        if (value instanceof String s) {
            return fromString(s);
        }
        return Optional.empty();
    }

    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
