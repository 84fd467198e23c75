package com.expertagent.authz.condition;

import com.expertagent.authz.model.Role;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Comparison rules shared by condition operators. A {@code null} operand means absent and is
 * handled by the caller.
 */
final class Values {

    private Values() {
    }

    /**
     * Equality across the value shapes attributes take. Numbers compare by value
     * ({@code 1 == 1.0}) and collections compare as sets. A {@link Role} equals a role name in any
     * case ({@code OWNER == "owner"}); two plain strings must match exactly.
     */
    static boolean areEqual(Object left, Object right) {
        if (left == null || right == null) {
            return false;
        }
        if (left instanceof Number a && right instanceof Number b) {
            return compareNumbers(a, b) == 0;
        }
        Collection<?> leftItems = asCollection(left);
        Collection<?> rightItems = asCollection(right);
        if (leftItems != null || rightItems != null) {
            return leftItems != null && rightItems != null
                    && new HashSet<>(leftItems).equals(new HashSet<>(rightItems));
        }
        if (left instanceof Role || right instanceof Role) {
            Optional<Role> a = Role.fromValue(left);
            return a.isPresent() && a.equals(Role.fromValue(right));
        }
        return left.equals(right);
    }

    /**
     * Orders two values when they are both numbers, or when one is a {@link Role} and the other
     * names a role; empty otherwise.
     */
    static OptionalInt compare(Object left, Object right) {
        if (left instanceof Number a && right instanceof Number b) {
            return OptionalInt.of(compareNumbers(a, b));
        }
        if (!(left instanceof Role) && !(right instanceof Role)) {
            return OptionalInt.empty();
        }
        Optional<Role> a = Role.fromValue(left);
        Optional<Role> b = Role.fromValue(right);
        if (a.isPresent() && b.isPresent()) {
            return OptionalInt.of(Integer.compare(a.get().rank(), b.get().rank()));
        }
        return OptionalInt.empty();
    }

    static boolean containsEqual(Collection<?> items, Object candidate) {
        for (Object item : items) {
            if (areEqual(item, candidate)) {
                return true;
            }
        }
        return false;
    }

    /** Views arrays and collections uniformly; {@code null} for anything else. */
    static Collection<?> asCollection(Object value) {
        if (value instanceof Collection<?> collection) {
            return collection;
        }
        if (value instanceof Object[] array) {
            return Arrays.asList(array);
        }
        return null;
    }

    private static int compareNumbers(Number a, Number b) {
        try {
            return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString()));
        } catch (NumberFormatException e) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
    }
}
