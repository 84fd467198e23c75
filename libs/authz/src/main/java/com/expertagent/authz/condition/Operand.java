package com.expertagent.authz.condition;

/**
 * A value-producing term of a comparison: an attribute path or a literal.
 */
public sealed interface Operand permits AttributePath, Literal, SetLiteral {

    /**
     * Resolves the operand against the request.
     *
     * @return the value, or {@code null} when the attribute is absent
     */
    Object resolve(EvaluationContext context);
}
