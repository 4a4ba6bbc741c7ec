package io.smartcalc.core.spi;

import io.smartcalc.core.model.Token;
import java.util.List;

/**
 * An immutable, parsed expression handle. Produced by {@link
 * io.smartcalc.core.engine.Calculator#compile(String)} and evaluated against a variable store, any
 * number of times.
 */
public interface CompiledExpression {

    /** The expression text as given to the compiler. */
    String source();

    /** The postfix token sequence. Unmodifiable. */
    List<Token> postfix();

    /**
     * Evaluates this expression.
     *
     * @param store the variables visible to the expression
     * @return the integer result
     * @throws io.smartcalc.core.error.ExpressionEvalException on unbound variables, division by zero
     *     or a malformed sequence
     */
    int evaluate(VariableStore store);
}
