package com.expertagent.authz.condition;

import java.util.List;
import java.util.Map;

/**
 * A dotted path into an entity, such as {@code resource.allowedOrgIds} or
 * {@code principal.roles[resource.id]}.
 * <p>
 * The first segment is always a {@link Field}. It names an entity field (see
 * {@link Root#isEntityField(String)}) or an attribute. Later segments step into nested maps.
 * Missing keys, {@code null} values and non-map intermediates all resolve to absent.
 */
public record AttributePath(Root root, List<Segment> segments) implements Operand {

    public AttributePath {
        segments = List.copyOf(segments);
        if (segments.isEmpty() || !(segments.get(0) instanceof Field)) {
            throw new IllegalArgumentException("attribute path must start with a field name");
        }
    }

    /** The first segment's name, e.g. {@code roles} for {@code principal.roles[resource.id]}. */
    public String head() {
        return ((Field) segments.get(0)).name();
    }

    @Override
    public Object resolve(EvaluationContext context) {
        Object current = context.lookup(root, head());
        for (int i = 1; i < segments.size() && current != null; i++) {
            Segment segment = segments.get(i);
            String key;
            if (segment instanceof Field field) {
                key = field.name();
            } else {
                Object resolvedKey = ((Index) segment).key().resolve(context);
                if (!(resolvedKey instanceof String) && !(resolvedKey instanceof Number)) {
                    return null;
                }
                key = resolvedKey.toString();
            }
            current = current instanceof Map<?, ?> map ? map.get(key) : null;
        }
        return current;
    }

    public String render() {
        StringBuilder out = new StringBuilder(root.keyword());
        for (Segment segment : segments) {
            if (segment instanceof Field field) {
                out.append('.').append(field.name());
            } else {
                Operand key = ((Index) segment).key();
                out.append('[');
                if (key instanceof AttributePath path) {
                    out.append(path.render());
                } else {
                    out.append('"').append(((Literal) key).value()).append('"');
                }
                out.append(']');
            }
        }
        return out.toString();
    }

    /** One step of a path. */
    public sealed interface Segment permits Field, Index {
    }

    /** {@code .name} */
    public record Field(String name) implements Segment {
    }

    /** {@code [key]}, where the key is a string literal or another path. */
    public record Index(Operand key) implements Segment {
    }
}
