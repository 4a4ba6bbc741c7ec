package io.smartcalc.core.engine;

import io.smartcalc.core.error.CalculatorException;
import io.smartcalc.core.model.Token;
import io.smartcalc.core.parse.OperatorNormalizer;
import io.smartcalc.core.parse.PostfixConverter;
import io.smartcalc.core.parse.Tokenizer;
import io.smartcalc.core.spi.CompiledExpression;
import io.smartcalc.core.spi.VariableStore;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point to the expression pipeline: normalize, tokenize, convert to postfix, evaluate.
 *
 * <p>Stateless. Variables live in the {@link VariableStore} the caller passes in, so independent
 * stores never see each other's bindings.
 */
public final class Calculator {

    private static final Logger LOG = LoggerFactory.getLogger(Calculator.class);

    /**
     * Parses {@code expression} into a reusable postfix form.
     *
     * @param expression the infix expression, e.g. {@code "3 + 2 * (x - 1)"}
     * @return the compiled expression
     * @throws io.smartcalc.core.error.ExpressionSyntaxException if the expression does not parse
     */
    public CompiledExpression compile(String expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        String normalized = OperatorNormalizer.normalize(expression);
        List<String> tokens = Tokenizer.tokenize(normalized);
        List<Token> postfix = PostfixConverter.toPostfix(tokens);
        LOG.trace("expression.compiled: input={}, normalized={}, postfix={}", expression, normalized, postfix);
        return new PostfixExpression(expression, postfix);
    }

    /**
     * Compiles and evaluates {@code expression} in one step.
     *
     * @param expression the infix expression
     * @param store      the variables visible to the expression
     * @return the integer result
     * @throws CalculatorException on any syntax or evaluation failure
     */
    public int evaluate(String expression, VariableStore store) {
        Objects.requireNonNull(store, "store must not be null");
        try {
            int result = compile(expression).evaluate(store);
            LOG.debug("expression.evaluated: input={}, result={}", expression, result);
            return result;
        } catch (CalculatorException e) {
            LOG.debug("expression.failed: input={}, phase={}, reason={}", expression, e.phase(), e.detail());
            throw e;
        }
    }

    /** Compiled form backed by an immutable postfix list. */
    record PostfixExpression(String source, List<Token> postfix) implements CompiledExpression {

        PostfixExpression {
            postfix = List.copyOf(postfix);
        }

        @Override
        public int evaluate(VariableStore store) {
            return PostfixEvaluator.evaluate(postfix, store);
        }
    }
}
