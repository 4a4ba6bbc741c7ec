package io.smartcalc.core.error;

/**
 * Root of the failures a single calculator line can produce.
 *
 * <p>Each concrete subtype is tied to one {@link Phase} and carries its own {@code Reason} enum:
 * {@link ExpressionSyntaxException} while converting to postfix, {@link ExpressionEvalException}
 * while running the postfix sequence, {@link AssignmentException} while splitting a
 * {@code name = value} line. None of them wraps a cause; every failure is detected by the
 * calculator itself and leaves the variable store as it was.
 */
public abstract class CalculatorException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Where in the line's processing the failure was detected. */
    public enum Phase {
        PARSE,
        EVALUATION,
        ASSIGNMENT
    }

    private final String token;
    private final Phase phase;

    protected CalculatorException(String message, String token, Phase phase) {
        super(message);
        this.token = token;
        this.phase = phase;
    }

    /** The token, operator or variable name that failed, or {@code null} for whole-line failures. */
    public String token() {
        return token;
    }

    /** Same text as {@link #getMessage()}. */
    public String detail() {
        return getMessage();
    }

    public Phase phase() {
        return phase;
    }
}
