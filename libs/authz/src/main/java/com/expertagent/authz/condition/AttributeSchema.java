package com.expertagent.authz.condition;

import com.expertagent.authz.model.Principal;
import com.expertagent.authz.model.Resource;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * The attribute names conditions may reference, per root.
 * <p>
 * Conditions are checked against the schema when policies load, so a misspelled attribute fails
 * startup instead of silently evaluating to absent. Only the first segment of a path is checked;
 * map contents such as the keys of {@code principal.roles} are data.
 * <p>
 * Attributes registered with {@link Builder#allowedSet(Root, String)} follow the "empty means
 * unrestricted" convention when used as the set side of {@code in} or {@code intersects}.
 */
public final class AttributeSchema {

    private static final AttributeSchema DEFAULTS = builder()
            .attributes(Root.PRINCIPAL,
                    Principal.ATTR_ROLES,
                    Principal.ATTR_MEMBERSHIP_ORG_IDS,
                    Principal.ATTR_IS_AUTHENTICATED,
                    Principal.ATTR_EMAIL,
                    Principal.ATTR_AUTH_PROVIDER,
                    Principal.ATTR_IS_TEST_PRINCIPAL)
            .attributes(Root.RESOURCE,
                    Resource.ATTR_ORG_ID,
                    Resource.ATTR_OWNER_ID,
                    Resource.ATTR_USER_ID,
                    Resource.ATTR_IS_PUBLIC,
                    Resource.ATTR_IS_BETA)
            .allowedSet(Root.RESOURCE, Resource.ATTR_ALLOWED_ORG_IDS)
            .attributes(Root.CONTEXT, "activeOrgId", "ipAddress", "userAgent", "timestamp", "environment")
            .build();

    private final Map<Root, Set<String>> attributes;
    private final Map<Root, Set<String>> allowedSets;

    private AttributeSchema(Map<Root, Set<String>> attributes, Map<Root, Set<String>> allowedSets) {
        this.attributes = attributes;
        this.allowedSets = allowedSets;
    }

    /** The attributes the platform's principal and resource builders populate. */
    public static AttributeSchema defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** A builder pre-populated with this schema, for adding attributes. */
    public Builder toBuilder() {
        Builder builder = new Builder();
        attributes.forEach((root, names) -> builder.attributes(root, names.toArray(String[]::new)));
        allowedSets.forEach((root, names) -> names.forEach(name -> builder.allowedSet(root, name)));
        return builder;
    }

    public boolean isKnown(Root root, String name) {
        return root.isEntityField(name) || attributes.getOrDefault(root, Set.of()).contains(name);
    }

    /**
     * Whether the path is a single-segment reference to an allowed-set attribute.
     */
    public boolean isAllowedSet(AttributePath path) {
        return path.segments().size() == 1
                && allowedSets.getOrDefault(path.root(), Set.of()).contains(path.head());
    }

    public Set<String> attributes(Root root) {
        return attributes.getOrDefault(root, Set.of());
    }

    public static final class Builder {

        private final Map<Root, Set<String>> attributes = new EnumMap<>(Root.class);
        private final Map<Root, Set<String>> allowedSets = new EnumMap<>(Root.class);

        private Builder() {
        }

        public Builder attributes(Root root, String... names) {
            Set<String> target = attributes.computeIfAbsent(root, r -> new HashSet<>());
            for (String name : names) {
                if (name == null || name.isBlank()) {
                    throw new IllegalArgumentException("attribute name must not be blank");
                }
                if (root.isEntityField(name)) {
                    throw new IllegalArgumentException(
                            "'" + name + "' is an entity field of " + root.keyword() + ", not an attribute");
                }
                target.add(name);
            }
            return this;
        }

        public Builder allowedSet(Root root, String name) {
            attributes(root, name);
            allowedSets.computeIfAbsent(root, r -> new HashSet<>()).add(name);
            return this;
        }

        public AttributeSchema build() {
            return new AttributeSchema(freeze(attributes), freeze(allowedSets));
        }

        private static Map<Root, Set<String>> freeze(Map<Root, Set<String>> source) {
            Map<Root, Set<String>> copy = new EnumMap<>(Root.class);
            source.forEach((root, names) -> copy.put(root, Set.copyOf(names)));
            return Collections.unmodifiableMap(copy);
        }
    }
}
