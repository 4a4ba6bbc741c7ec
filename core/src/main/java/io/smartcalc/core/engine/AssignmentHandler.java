package io.smartcalc.core.engine;

import io.smartcalc.core.error.AssignmentException;
import io.smartcalc.core.error.AssignmentException.Reason;
import io.smartcalc.core.parse.Lexemes;
import io.smartcalc.core.spi.VariableStore;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies {@code name = value} lines to a variable store.
 *
 * <p>The right-hand side is an integer literal or an already bound name; expressions are not
 * accepted there. The store is written only once the right-hand side has resolved, so a failed
 * assignment leaves it untouched.
 */
public final class AssignmentHandler {

    private static final Logger LOG = LoggerFactory.getLogger(AssignmentHandler.class);

    private AssignmentHandler() {}

    /** Returns {@code true} if {@code line} should be treated as an assignment. */
    public static boolean isAssignment(String line) {
        return line != null && line.indexOf('=') >= 0;
    }

    /**
     * Parses and applies an assignment.
     *
     * @param line  the input line, e.g. {@code "a = 3"} or {@code "b=a"}
     * @param store the store to write to
     * @return the value now bound to the left-hand name
     * @throws AssignmentException if the line is not a well-formed assignment
     * @throws io.smartcalc.core.error.ExpressionEvalException if the right-hand name is unbound
     */
    public static int assign(String line, VariableStore store) {
        Objects.requireNonNull(line, "line must not be null");
        Objects.requireNonNull(store, "store must not be null");

        String[] parts = line.split("=", -1);
        if (parts.length != 2) {
            throw new AssignmentException(
                    Reason.MULTIPLE_EQUALS, "Assignment must contain exactly one '=': " + line.strip(), null);
        }
        String left = parts[0].strip();
        String right = parts[1].strip();

        if (!Lexemes.isIdentifier(left)) {
            throw new AssignmentException(Reason.INVALID_IDENTIFIER, "Invalid identifier: '" + left + "'", left);
        }

        int value;
        if (Lexemes.isNumber(right)) {
            value = Integer.parseInt(right);
        } else if (Lexemes.isIdentifier(right)) {
            value = ValueResolver.lookup(right, store);
        } else {
            throw new AssignmentException(
                    Reason.INVALID_RIGHT_HAND_SIDE, "Invalid assignment value: '" + right + "'", right);
        }

        store.put(left, value);
        LOG.debug("variable.assigned: name={}, value={}", left, value);
        return value;
    }
}
