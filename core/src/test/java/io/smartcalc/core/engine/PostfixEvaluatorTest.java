package io.smartcalc.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.smartcalc.core.error.ExpressionEvalException;
import io.smartcalc.core.error.ExpressionEvalException.Reason;
import io.smartcalc.core.model.Operator;
import io.smartcalc.core.model.Token;
import io.smartcalc.core.store.InMemoryVariableStore;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PostfixEvaluator")
class PostfixEvaluatorTest {

    private InMemoryVariableStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryVariableStore();
    }

    private static Token lit(int value) {
        return new Token.Literal(value);
    }

    private static Token op(Operator operator) {
        return new Token.Op(operator);
    }

    @Test
    void appliesBinaryOperatorsLeftOperandFirst() {
        assertThat(PostfixEvaluator.evaluate(List.of(lit(10), lit(4), op(Operator.MINUS)), store))
                .isEqualTo(6);
        assertThat(PostfixEvaluator.evaluate(List.of(lit(20), lit(5), op(Operator.DIVIDE)), store))
                .isEqualTo(4);
        assertThat(PostfixEvaluator.evaluate(List.of(lit(2), lit(10), op(Operator.POWER)), store))
                .isEqualTo(1024);
    }

    @Test
    void divisionTruncatesTowardZero() {
        assertThat(PostfixEvaluator.evaluate(List.of(lit(7), lit(2), op(Operator.DIVIDE)), store))
                .isEqualTo(3);
        assertThat(PostfixEvaluator.evaluate(List.of(lit(-7), lit(2), op(Operator.DIVIDE)), store))
                .isEqualTo(-3);
    }

    @Test
    void negateFlipsSign() {
        assertThat(PostfixEvaluator.evaluate(List.of(lit(5), op(Operator.NEGATE)), store))
                .isEqualTo(-5);
        assertThat(PostfixEvaluator.evaluate(List.of(lit(3), lit(5), op(Operator.NEGATE), op(Operator.MULTIPLY)), store))
                .isEqualTo(-15);
    }

    @Test
    void resolvesIdentifiersFromStore() {
        store.put("x", 5);
        assertThat(PostfixEvaluator.evaluate(List.of(new Token.Identifier("x"), lit(1), op(Operator.PLUS)), store))
                .isEqualTo(6);
    }

    @Test
    void unknownVariableFails() {
        assertThatThrownBy(() -> PostfixEvaluator.evaluate(List.of(new Token.Identifier("y")), store))
                .isInstanceOfSatisfying(ExpressionEvalException.class, e -> {
                    assertThat(e.reason()).isEqualTo(Reason.UNKNOWN_VARIABLE);
                    assertThat(e.token()).isEqualTo("y");
                });
    }

    @Test
    void divisionByZeroFails() {
        assertThatThrownBy(() -> PostfixEvaluator.evaluate(List.of(lit(5), lit(0), op(Operator.DIVIDE)), store))
                .isInstanceOfSatisfying(ExpressionEvalException.class, e -> assertThat(e.reason())
                        .isEqualTo(Reason.DIVISION_BY_ZERO));
    }

    @Test
    void operandUnderflowIsMalformed() {
        assertThatThrownBy(() -> PostfixEvaluator.evaluate(List.of(lit(5), op(Operator.PLUS)), store))
                .isInstanceOfSatisfying(ExpressionEvalException.class, e -> assertThat(e.reason())
                        .isEqualTo(Reason.MALFORMED_EXPRESSION));
        assertThatThrownBy(() -> PostfixEvaluator.evaluate(List.of(op(Operator.NEGATE)), store))
                .isInstanceOfSatisfying(ExpressionEvalException.class, e -> assertThat(e.reason())
                        .isEqualTo(Reason.MALFORMED_EXPRESSION));
    }

    @Test
    void emptyOrLeftoverStackIsMalformed() {
        assertThatThrownBy(() -> PostfixEvaluator.evaluate(List.of(), store))
                .isInstanceOfSatisfying(ExpressionEvalException.class, e -> assertThat(e.reason())
                        .isEqualTo(Reason.MALFORMED_EXPRESSION));
        assertThatThrownBy(() -> PostfixEvaluator.evaluate(List.of(lit(1), lit(2)), store))
                .isInstanceOfSatisfying(ExpressionEvalException.class, e -> assertThat(e.reason())
                        .isEqualTo(Reason.MALFORMED_EXPRESSION));
    }

    @Test
    void parenthesisInPostfixIsMalformed() {
        assertThatThrownBy(() -> PostfixEvaluator.evaluate(List.of(new Token.LeftParen(), lit(1)), store))
                .isInstanceOfSatisfying(ExpressionEvalException.class, e -> assertThat(e.reason())
                        .isEqualTo(Reason.MALFORMED_EXPRESSION));
    }

    @Test
    void powerIsFloatingPointApproximation() {
        assertThat(PostfixEvaluator.evaluate(List.of(lit(2), lit(-1), op(Operator.POWER)), store))
                .isZero();
        assertThat(PostfixEvaluator.evaluate(List.of(lit(-2), lit(3), op(Operator.POWER)), store))
                .isEqualTo(-8);
        assertThat(PostfixEvaluator.evaluate(List.of(lit(10), lit(12), op(Operator.POWER)), store))
                .isEqualTo(Integer.MAX_VALUE);
    }
}
