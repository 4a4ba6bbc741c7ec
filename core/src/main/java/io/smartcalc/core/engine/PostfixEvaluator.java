package io.smartcalc.core.engine;

import io.smartcalc.core.error.ExpressionEvalException;
import io.smartcalc.core.error.ExpressionEvalException.Reason;
import io.smartcalc.core.model.Operator;
import io.smartcalc.core.model.Token;
import io.smartcalc.core.spi.VariableStore;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates a postfix token sequence with an operand stack.
 *
 * <p>Arithmetic is Java {@code int} arithmetic: {@code + - *} wrap on overflow and {@code /}
 * truncates toward zero. {@code ^} is computed with {@link Math#pow(double, double)} and narrowed
 * to {@code int}, so results past 2<sup>53</sup> lose precision and results past the {@code int}
 * range saturate. Negative exponents truncate to {@code 0} except for bases {@code 1} and
 * {@code -1}.
 */
public final class PostfixEvaluator {

    private PostfixEvaluator() {}

    /**
     * Evaluates {@code postfix} against {@code store}.
     *
     * @return the single value left on the stack
     * @throws ExpressionEvalException on unbound variables, division by zero, operand underflow, or
     *     when anything other than exactly one value remains
     */
    public static int evaluate(List<Token> postfix, VariableStore store) {
        Objects.requireNonNull(postfix, "postfix must not be null");
        Objects.requireNonNull(store, "store must not be null");
        Deque<Integer> stack = new ArrayDeque<>();

        for (Token token : postfix) {
            if (token instanceof Token.Literal literal) {
                stack.push(literal.value());
            } else if (token instanceof Token.Identifier identifier) {
                stack.push(ValueResolver.lookup(identifier.name(), store));
            } else if (token instanceof Token.Op op) {
                stack.push(apply(op.operator(), stack));
            } else {
                throw malformed("Unexpected '" + token.text() + "' in postfix sequence", token.text());
            }
        }

        if (stack.size() != 1) {
            throw malformed("Expected exactly one result, found " + stack.size(), null);
        }
        return stack.pop();
    }

    private static int apply(Operator operator, Deque<Integer> stack) {
        if (stack.size() < operator.arity()) {
            throw malformed("Missing operand for '" + operator.symbol() + "'", operator.symbol());
        }
        int right = stack.pop();
        if (operator.isUnary()) {
            return applyPrefix(operator, right);
        }
        int left = stack.pop();
        return switch (operator) {
            case PLUS -> left + right;
            case MINUS -> left - right;
            case MULTIPLY -> left * right;
            case DIVIDE -> {
                if (right == 0) {
                    throw new ExpressionEvalException(Reason.DIVISION_BY_ZERO, "Division by zero", "/");
                }
                yield left / right;
            }
            case POWER -> (int) Math.pow(left, right);
            default -> throw new IllegalStateException("Not a binary operator: " + operator);
        };
    }

    private static int applyPrefix(Operator operator, int operand) {
        return switch (operator) {
            case NEGATE -> -operand;
            default -> throw new IllegalStateException("Not a prefix operator: " + operator);
        };
    }

    private static ExpressionEvalException malformed(String message, String token) {
        return new ExpressionEvalException(Reason.MALFORMED_EXPRESSION, message, token);
    }
}
