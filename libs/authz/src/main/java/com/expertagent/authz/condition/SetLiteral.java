package com.expertagent.authz.condition;

import java.util.List;

/**
 * A non-empty list of constants, written {@code ["a", "b"]}.
 */
public record SetLiteral(List<Object> values) implements Operand {

    public SetLiteral {
        values = List.copyOf(values);
    }

    @Override
    public Object resolve(EvaluationContext context) {
        return values;
    }
}
