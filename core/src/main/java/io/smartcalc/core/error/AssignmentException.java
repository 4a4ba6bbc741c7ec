package io.smartcalc.core.error;

import java.util.Objects;

/**
 * Thrown when a {@code name = value} line is rejected. The variable store is never written when
 * this is thrown.
 */
public final class AssignmentException extends CalculatorException {

    private static final long serialVersionUID = 1L;

    /** Why the assignment was rejected. */
    public enum Reason {
        /** Left-hand side is not a letters-only name. */
        INVALID_IDENTIFIER,

        /** Right-hand side is neither an integer literal nor a name. */
        INVALID_RIGHT_HAND_SIDE,

        /** The line does not contain exactly one {@code =}. */
        MULTIPLE_EQUALS
    }

    private final Reason reason;

    public AssignmentException(Reason reason, String message, String token) {
        super(message, token, Phase.ASSIGNMENT);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    public Reason reason() {
        return reason;
    }
}
