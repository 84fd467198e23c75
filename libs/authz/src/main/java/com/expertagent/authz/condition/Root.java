package com.expertagent.authz.condition;

import java.util.Optional;
import java.util.Set;

/**
 * The entities a condition path can start from. Each root exposes a fixed set of entity fields
 * (such as {@code principal.id}); any other first segment reads the entity's attribute map.
 */
public enum Root {

    PRINCIPAL("principal", Set.of("id", "type")),
    ACTION("action", Set.of("id")),
    RESOURCE("resource", Set.of("id", "type")),
    CONTEXT("context", Set.of());

    private final String keyword;
    private final Set<String> entityFields;

    Root(String keyword, Set<String> entityFields) {
        this.keyword = keyword;
        this.entityFields = entityFields;
    }

    public String keyword() {
        return keyword;
    }

    public boolean isEntityField(String name) {
        return entityFields.contains(name);
    }

    public static Optional<Root> fromKeyword(String keyword) {
        for (Root root : values()) {
            if (root.keyword.equals(keyword)) {
                return Optional.of(root);
            }
        }
        return Optional.empty();
    }
}
