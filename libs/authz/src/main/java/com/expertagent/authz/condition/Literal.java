package com.expertagent.authz.condition;

/**
 * A string, number, boolean or {@link com.expertagent.authz.model.Role} constant.
 */
public record Literal(Object value) implements Operand {

    @Override
    public Object resolve(EvaluationContext context) {
        return value;
    }
}
