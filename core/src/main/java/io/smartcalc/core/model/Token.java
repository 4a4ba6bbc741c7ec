package io.smartcalc.core.model;

import java.util.Objects;

/**
 * A classified lexeme of an arithmetic expression. Raw tokens are classified exactly once, by the
 * postfix converter; downstream stages switch on the variant instead of re-parsing text.
 *
 * <p>All variants are immutable.
 */
public sealed interface Token {

    /** The source text this token stands for. */
    String text();

    /** Integer literal. */
    record Literal(int value) implements Token {
        @Override
        public String text() {
            return Integer.toString(value);
        }
    }

    /** Variable reference, resolved against a variable store at evaluation time. */
    record Identifier(String name) implements Token {
        public Identifier {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String text() {
            return name;
        }
    }

    /** Operator, binary or the prefix {@link Operator#NEGATE}. */
    record Op(Operator operator) implements Token {
        public Op {
            Objects.requireNonNull(operator, "operator must not be null");
        }

        @Override
        public String text() {
            return operator.symbol();
        }
    }

    /** Opening parenthesis. Only ever lives on the converter's operator stack. */
    record LeftParen() implements Token {
        @Override
        public String text() {
            return "(";
        }
    }

    /** Closing parenthesis. */
    record RightParen() implements Token {
        @Override
        public String text() {
            return ")";
        }
    }
}
