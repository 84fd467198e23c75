package com.expertagent.authz.condition;

import java.util.List;

/**
 * A compiled policy condition.
 * <p>
 * Evaluation is total: absent attributes never raise, they make the enclosing comparison false.
 * Use {@link Has} to test presence explicitly.
 */
public sealed interface Condition
        permits Condition.AllOf, Condition.AnyOf, Condition.Not, Condition.Constant,
        Has, IsTrue, Comparison {

    boolean test(EvaluationContext context);

    /** {@code a && b && ...}, short-circuiting left to right. */
    record AllOf(List<Condition> operands) implements Condition {

        public AllOf {
            operands = List.copyOf(operands);
        }

        @Override
        public boolean test(EvaluationContext context) {
            for (Condition operand : operands) {
                if (!operand.test(context)) {
                    return false;
                }
            }
            return true;
        }
    }

    /** {@code a || b || ...}, short-circuiting left to right. */
    record AnyOf(List<Condition> operands) implements Condition {

        public AnyOf {
            operands = List.copyOf(operands);
        }

        @Override
        public boolean test(EvaluationContext context) {
            for (Condition operand : operands) {
                if (operand.test(context)) {
                    return true;
                }
            }
            return false;
        }
    }

    record Not(Condition operand) implements Condition {

        @Override
        public boolean test(EvaluationContext context) {
            return !operand.test(context);
        }
    }

    /** A literal {@code true} or {@code false}. */
    record Constant(boolean value) implements Condition {

        @Override
        public boolean test(EvaluationContext context) {
            return value;
        }
    }
}
