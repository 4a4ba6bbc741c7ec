package io.smartcalc.core.parse;

/**
 * Classifies raw tokens as variable names or integer literals.
 *
 * <p>Thread-safe and stateless. All methods are static.
 */
public final class Lexemes {

    private Lexemes() {}

    /**
     * Returns {@code true} if {@code token} is a valid variable name: non-empty and made only of
     * Latin letters {@code A-Z a-z}. Digits, underscores and non-Latin letters are rejected. Names
     * are case-sensitive.
     */
    public static boolean isIdentifier(String token) {
        if (token == null || token.isEmpty()) {
            return false;
        }
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (!((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z'))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns {@code true} if {@code token} parses as a base-10 {@code int} under {@link
     * Integer#parseInt(String)} rules: optional leading sign, no whitespace, within range.
     */
    public static boolean isNumber(String token) {
        if (token == null || token.isEmpty()) {
            return false;
        }
        try {
            Integer.parseInt(token);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
