package io.smartcalc.core.error;

import java.util.Objects;

/**
 * Thrown when a postfix sequence cannot be evaluated (unbound variable, division by zero, operand
 * stack underflow or leftovers).
 */
public final class ExpressionEvalException extends CalculatorException {

    private static final long serialVersionUID = 1L;

    /** Why evaluation stopped. */
    public enum Reason {
        UNKNOWN_VARIABLE,
        DIVISION_BY_ZERO,
        MALFORMED_EXPRESSION
    }

    private final Reason reason;

    public ExpressionEvalException(Reason reason, String message, String token) {
        super(message, token, Phase.EVALUATION);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    public Reason reason() {
        return reason;
    }

    /** Shortcut for the unbound-variable case, shared by evaluation and assignment. */
    public static ExpressionEvalException unknownVariable(String name) {
        return new ExpressionEvalException(Reason.UNKNOWN_VARIABLE, "Unknown variable: '" + name + "'", name);
    }
}
