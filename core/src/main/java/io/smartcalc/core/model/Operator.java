package io.smartcalc.core.model;

import java.util.Optional;

/**
 * Arithmetic operators with their precedence and associativity.
 *
 * <p>The five binary operators map one-to-one onto their symbols. {@link #NEGATE} is the prefix
 * minus the converter emits for a {@code -} standing where an operand is expected; it shares the
 * symbol of {@link #MINUS} and is never returned by {@link #fromSymbol(String)}.
 */
public enum Operator {
    PLUS("+", 1, false, 2),
    MINUS("-", 1, false, 2),
    MULTIPLY("*", 2, false, 2),
    DIVIDE("/", 2, false, 2),
    POWER("^", 3, true, 2),
    NEGATE("-", 3, true, 1);

    private final String symbol;
    private final int precedence;
    private final boolean rightAssociative;
    private final int arity;

    Operator(String symbol, int precedence, boolean rightAssociative, int arity) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.rightAssociative = rightAssociative;
        this.arity = arity;
    }

    public String symbol() {
        return symbol;
    }

    /** Binding strength; higher binds tighter ({@code ^} = 3, {@code * /} = 2, {@code + -} = 1). */
    public int precedence() {
        return precedence;
    }

    public boolean isRightAssociative() {
        return rightAssociative;
    }

    /** Number of operands popped during evaluation. */
    public int arity() {
        return arity;
    }

    public boolean isUnary() {
        return arity == 1;
    }

    /**
     * Looks up a binary operator by its single-character symbol.
     *
     * @param symbol the raw token text
     * @return the operator, or empty if {@code symbol} is not one of {@code + - * / ^}
     */
    public static Optional<Operator> fromSymbol(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        return switch (symbol) {
            case "+" -> Optional.of(PLUS);
            case "-" -> Optional.of(MINUS);
            case "*" -> Optional.of(MULTIPLY);
            case "/" -> Optional.of(DIVIDE);
            case "^" -> Optional.of(POWER);
            default -> Optional.empty();
        };
    }

    /** Returns {@code true} if {@code c} is one of the operator characters {@code + - * / ^}. */
    public static boolean isOperatorChar(char c) {
        return c == '+' || c == '-' || c == '*' || c == '/' || c == '^';
    }
}
