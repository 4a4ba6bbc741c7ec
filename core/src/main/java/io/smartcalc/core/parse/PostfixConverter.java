package io.smartcalc.core.parse;

import io.smartcalc.core.error.ExpressionSyntaxException;
import io.smartcalc.core.error.ExpressionSyntaxException.Reason;
import io.smartcalc.core.model.Operator;
import io.smartcalc.core.model.Token;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Converts infix raw tokens into a postfix (Reverse Polish) sequence using the shunting-yard
 * algorithm.
 *
 * <p>Rules:
 * <ul>
 * <li>Numbers and names go straight to the output, classified as {@link Token.Literal} and
 * {@link Token.Identifier}.
 * <li>An operator pops every stacked operator that binds tighter, or equally tight when the
 * incoming operator is left-associative, then is pushed. {@code ^} is right-associative, so
 * {@code 2^3^2} groups as {@code 2^(3^2)}.
 * <li>A {@code -} where an operand is expected (start of input, after {@code (} or after another
 * operator) is the prefix {@link Operator#NEGATE}; a {@code +} there is dropped.
 * <li>{@code *}, {@code /} or {@code ^} directly after another operator is a
 * {@link Reason#REPEATED_OPERATOR}. Sign runs never get here, {@link OperatorNormalizer} has
 * already collapsed them.
 * </ul>
 *
 * <p>Thread-safe and stateless. All methods are static.
 */
public final class PostfixConverter {

    private PostfixConverter() {}

    /**
     * Converts a raw token sequence to postfix order.
     *
     * @param tokens raw tokens as produced by {@link Tokenizer#tokenize(String)}
     * @return an immutable postfix sequence
     * @throws ExpressionSyntaxException on unbalanced parentheses, repeated operators or tokens that
     *     are neither numbers, names, operators nor parentheses
     */
    public static List<Token> toPostfix(List<String> tokens) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        List<Token> output = new ArrayList<>(tokens.size());
        Deque<Token> stack = new ArrayDeque<>();
        Token previous = null;

        for (String raw : tokens) {
            if (Lexemes.isNumber(raw)) {
                previous = new Token.Literal(Integer.parseInt(raw));
                output.add(previous);
            } else if (Lexemes.isIdentifier(raw)) {
                previous = new Token.Identifier(raw);
                output.add(previous);
            } else if ("(".equals(raw)) {
                previous = new Token.LeftParen();
                stack.push(previous);
            } else if (")".equals(raw)) {
                closeParenthesis(output, stack);
                previous = new Token.RightParen();
            } else if (isOperatorRun(raw)) {
                previous = pushOperator(raw, previous, output, stack);
            } else {
                throw new ExpressionSyntaxException(
                        Reason.INVALID_TOKEN, "Invalid identifier or number: '" + raw + "'", raw);
            }
        }

        while (!stack.isEmpty()) {
            Token top = stack.pop();
            if (top instanceof Token.LeftParen) {
                throw new ExpressionSyntaxException(Reason.UNBALANCED_PARENTHESES, "Unclosed '('", "(");
            }
            output.add(top);
        }
        return List.copyOf(output);
    }

    /** Pops operators to the output until the matching {@code (}, which is discarded. */
    private static void closeParenthesis(List<Token> output, Deque<Token> stack) {
        while (!stack.isEmpty()) {
            Token top = stack.pop();
            if (top instanceof Token.LeftParen) {
                return;
            }
            output.add(top);
        }
        throw new ExpressionSyntaxException(Reason.UNBALANCED_PARENTHESES, "Unmatched ')'", ")");
    }

    /**
     * Handles one operator token and returns the token that now counts as "previous", which is the
     * prior one unchanged when a prefix {@code +} is dropped.
     */
    private static Token pushOperator(String raw, Token previous, List<Token> output, Deque<Token> stack) {
        if (raw.length() > 1) {
            throw new ExpressionSyntaxException(Reason.REPEATED_OPERATOR, "Repeated operator '" + raw + "'", raw);
        }
        Operator operator = Operator.fromSymbol(raw)
                .orElseThrow(() ->
                        new ExpressionSyntaxException(Reason.INVALID_TOKEN, "Unknown operator '" + raw + "'", raw));

        boolean operandExpected =
                previous == null || previous instanceof Token.LeftParen || previous instanceof Token.Op;
        if (operandExpected) {
            switch (operator) {
                case PLUS:
                    return previous;
                case MINUS:
                    Token negate = new Token.Op(Operator.NEGATE);
                    stack.push(negate);
                    return negate;
                default:
                    if (previous instanceof Token.Op) {
                        throw new ExpressionSyntaxException(
                                Reason.REPEATED_OPERATOR,
                                "Repeated operator '" + previous.text() + raw + "'",
                                previous.text() + raw);
                    }
                    throw new ExpressionSyntaxException(
                            Reason.INVALID_TOKEN, "Operator '" + raw + "' has no left operand", raw);
            }
        }

        while (!stack.isEmpty() && stack.peek() instanceof Token.Op top && shouldPop(top.operator(), operator)) {
            output.add(stack.pop());
        }
        Token token = new Token.Op(operator);
        stack.push(token);
        return token;
    }

    private static boolean shouldPop(Operator stacked, Operator incoming) {
        return stacked.precedence() > incoming.precedence()
                || (stacked.precedence() == incoming.precedence() && !incoming.isRightAssociative());
    }

    private static boolean isOperatorRun(String raw) {
        if (raw.isEmpty()) {
            return false;
        }
        for (int i = 0; i < raw.length(); i++) {
            if (!Operator.isOperatorChar(raw.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
