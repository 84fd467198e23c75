package com.expertagent.authz.condition;

/**
 * {@code has path}: true when the attribute is present and non-null.
 */
public record Has(AttributePath path) implements Condition {

    @Override
    public boolean test(EvaluationContext context) {
        return path.resolve(context) != null;
    }
}
