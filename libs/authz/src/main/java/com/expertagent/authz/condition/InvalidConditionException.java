package com.expertagent.authz.condition;

/**
 * Thrown when a condition expression cannot be compiled: a syntax error, an unknown attribute
 * or an operand of the wrong shape for its operator.
 */
public class InvalidConditionException extends RuntimeException {

    private final int position;

    public InvalidConditionException(String message, int position) {
        super("Invalid condition at position " + position + ": " + message);
        this.position = position;
    }

    /** Zero-based character offset where the problem was detected. */
    public int position() {
        return position;
    }
}
