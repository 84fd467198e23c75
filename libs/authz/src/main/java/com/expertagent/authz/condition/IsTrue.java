package com.expertagent.authz.condition;

/**
 * A bare path used as a condition, e.g. {@code resource.isPublic}. True only when the value is
 * the boolean {@code true}; strings such as {@code "true"} do not count.
 */
public record IsTrue(AttributePath path) implements Condition {

    @Override
    public boolean test(EvaluationContext context) {
        return Boolean.TRUE.equals(path.resolve(context));
    }
}
