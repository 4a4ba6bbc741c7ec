package io.smartcalc.core.error;

import java.util.Objects;

/** Thrown when an expression cannot be converted to postfix form. */
public final class ExpressionSyntaxException extends CalculatorException {

    private static final long serialVersionUID = 1L;

    /** What made the expression unparseable. */
    public enum Reason {
        /** A {@code )} without its {@code (}, or a {@code (} never closed. */
        UNBALANCED_PARENTHESES,

        /** Neither a number, an identifier, an operator nor a parenthesis. */
        INVALID_TOKEN,

        /** {@code **}, {@code //} and other operator runs that do not collapse like sign runs. */
        REPEATED_OPERATOR
    }

    private final Reason reason;

    public ExpressionSyntaxException(Reason reason, String message, String token) {
        super(message, token, Phase.PARSE);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    public Reason reason() {
        return reason;
    }
}
