package com.expertagent.authz.condition;

import java.util.Optional;

/**
 * Binary comparison operators.
 */
public enum Operator {

    EQ("=="),
    NE("!="),
    GT(">"),
    GE(">="),
    LT("<"),
    LE("<="),
    /** Scalar membership in a set. */
    IN("in"),
    /** Set contains a scalar. */
    CONTAINS("contains"),
    /** Two sets share at least one element. */
    INTERSECTS("intersects");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isOrdering() {
        return this == GT || this == GE || this == LT || this == LE;
    }

    public static Optional<Operator> fromSymbol(String symbol) {
        for (Operator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }
}
