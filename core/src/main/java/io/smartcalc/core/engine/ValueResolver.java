package io.smartcalc.core.engine;

import io.smartcalc.core.error.ExpressionEvalException;
import io.smartcalc.core.error.ExpressionSyntaxException;
import io.smartcalc.core.parse.Lexemes;
import io.smartcalc.core.spi.VariableStore;
import java.util.Objects;

/** Turns a literal or a variable name into its integer value. */
public final class ValueResolver {

    private ValueResolver() {}

    /**
     * Resolves a raw token.
     *
     * @param token an integer literal or a variable name
     * @param store the variables to look names up in
     * @return the literal value or the bound value
     * @throws ExpressionEvalException if {@code token} is a name with no binding
     * @throws ExpressionSyntaxException if {@code token} is neither a number nor a name
     */
    public static int resolveValue(String token, VariableStore store) {
        Objects.requireNonNull(store, "store must not be null");
        if (Lexemes.isNumber(token)) {
            return Integer.parseInt(token);
        }
        if (Lexemes.isIdentifier(token)) {
            return lookup(token, store);
        }
        throw new ExpressionSyntaxException(
                ExpressionSyntaxException.Reason.INVALID_TOKEN, "Invalid identifier: '" + token + "'", token);
    }

    /**
     * Reads a bound variable.
     *
     * @throws ExpressionEvalException with reason {@code UNKNOWN_VARIABLE} if {@code name} is unbound
     */
    public static int lookup(String name, VariableStore store) {
        return store.get(name).orElseThrow(() -> ExpressionEvalException.unknownVariable(name));
    }
}
