package io.smartcalc.core.parse;

import java.util.Objects;

/**
 * Collapses runs of {@code +} and {@code -} into a single sign before tokenization.
 *
 * <p>A run with an odd number of minus signs becomes {@code -}, any other run becomes {@code +}:
 * {@code --5} is {@code +5}, {@code 3 - - -5} is {@code 3 -5}, {@code +-+4} is {@code -4}. Whitespace
 * between two signs is part of the run; whitespace elsewhere is left alone. Runs of {@code *},
 * {@code /} and {@code ^} are not touched; they are rejected by {@link PostfixConverter}.
 *
 * <p>The result is a fixed point: normalizing it again returns the same string.
 */
public final class OperatorNormalizer {

    private OperatorNormalizer() {}

    public static String normalize(String expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        StringBuilder out = new StringBuilder(expression.length());
        int i = 0;
        int length = expression.length();
        while (i < length) {
            char c = expression.charAt(i);
            if (!isSign(c)) {
                out.append(c);
                i++;
                continue;
            }
            int minusCount = 0;
            int runEnd = i;
            int j = i;
            while (j < length) {
                char d = expression.charAt(j);
                if (isSign(d)) {
                    if (d == '-') {
                        minusCount++;
                    }
                    runEnd = ++j;
                } else if (Character.isWhitespace(d)) {
                    j++;
                } else {
                    break;
                }
            }
            out.append(minusCount % 2 == 0 ? '+' : '-');
            // trailing whitespace after the last sign is copied by the next iterations
            i = runEnd;
        }
        return out.toString();
    }

    private static boolean isSign(char c) {
        return c == '+' || c == '-';
    }
}
