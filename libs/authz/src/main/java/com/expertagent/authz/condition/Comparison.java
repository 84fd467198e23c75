package com.expertagent.authz.condition;

import java.util.Collection;
import java.util.OptionalInt;
import java.util.function.IntPredicate;

/**
 * {@code left <op> right}.
 * <p>
 * Any comparison with an absent operand is false, {@code !=} included. Ordering operators apply
 * to numbers and to role constants (by privilege rank) and are false for anything else.
 *
 * @param emptyMeansUnrestricted set on {@code in} and {@code intersects} when the set side is an
 *                               "allowed set" attribute: an empty value then matches everything
 */
public record Comparison(Operand left, Operator operator, Operand right, boolean emptyMeansUnrestricted)
        implements Condition {

    public Comparison(Operand left, Operator operator, Operand right) {
        this(left, operator, right, false);
    }

    @Override
    public boolean test(EvaluationContext context) {
        Object l = left.resolve(context);
        Object r = right.resolve(context);
        if (l == null || r == null) {
            return false;
        }
        return switch (operator) {
            case EQ -> Values.areEqual(l, r);
            case NE -> !Values.areEqual(l, r);
            case GT -> ordered(l, r, c -> c > 0);
            case GE -> ordered(l, r, c -> c >= 0);
            case LT -> ordered(l, r, c -> c < 0);
            case LE -> ordered(l, r, c -> c <= 0);
            case IN -> in(l, r);
            case CONTAINS -> contains(l, r);
            case INTERSECTS -> intersects(l, r);
        };
    }

    private static boolean ordered(Object l, Object r, IntPredicate accept) {
        OptionalInt result = Values.compare(l, r);
        return result.isPresent() && accept.test(result.getAsInt());
    }

    private boolean in(Object candidate, Object set) {
        Collection<?> items = Values.asCollection(set);
        if (items == null) {
            return false;
        }
        if (items.isEmpty()) {
            return emptyMeansUnrestricted;
        }
        return Values.containsEqual(items, candidate);
    }

    private static boolean contains(Object set, Object candidate) {
        Collection<?> items = Values.asCollection(set);
        return items != null && Values.containsEqual(items, candidate);
    }

    private boolean intersects(Object l, Object r) {
        Collection<?> allowed = Values.asCollection(l);
        Collection<?> others = Values.asCollection(r);
        if (allowed == null || others == null) {
            return false;
        }
        if (allowed.isEmpty()) {
            return emptyMeansUnrestricted;
        }
        for (Object item : allowed) {
            if (Values.containsEqual(others, item)) {
                return true;
            }
        }
        return false;
    }
}
