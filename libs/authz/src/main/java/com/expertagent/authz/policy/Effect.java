package com.expertagent.authz.policy;

import java.util.Locale;
import java.util.Optional;

/**
 * What a matching policy does. Any matching {@link #FORBID} overrides every {@link #PERMIT}.
 */
public enum Effect {

    PERMIT("permit"),
    FORBID("forbid");

    private final String value;

    Effect(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<Effect> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        for (Effect effect : values()) {
            if (effect.value.equals(normalized)) {
                return Optional.of(effect);
            }
        }
        return Optional.empty();
    }
}
