package io.smartcalc.core.parse;

import io.smartcalc.core.model.Operator;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Splits an expression into raw string tokens. Every parenthesis and operator character becomes a
 * token of its own; everything else is split on whitespace. A sign is never glued to the digits
 * that follow it.
 *
 * <p>Thread-safe and stateless. All methods are static.
 */
public final class Tokenizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private Tokenizer() {}

    /**
     * Tokenizes an (already normalized) expression.
     *
     * @param expression the expression text
     * @return the raw tokens in source order, never containing empty strings
     */
    public static List<String> tokenize(String expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        StringBuilder spaced = new StringBuilder(expression.length() * 2);
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (c == '(' || c == ')' || Operator.isOperatorChar(c)) {
                spaced.append(' ').append(c).append(' ');
            } else {
                spaced.append(c);
            }
        }
        String trimmed = spaced.toString().strip();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        return List.of(WHITESPACE.split(trimmed));
    }
}
