package com.modelweave.expr.runtime.operators;

import com.modelweave.expr.api.model.Operator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class LooseValuesTest {

    private final OperatorEvaluator operators = new OperatorEvaluator();

    @ParameterizedTest
    @ValueSource(strings = {"5", "-2.5", ".5", "1e3", "  7 ", ""})
    @DisplayName("Should treat numeric-looking strings as numbers")
    void shouldRecognizeNumericStrings(String text) {
        assertThat(LooseValues.isNumeric(text)).isTrue();
        assertThat(LooseValues.coerceNumericString(text)).isInstanceOf(Number.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"abc", "5 apples", "0x10", "1.2.3"})
    @DisplayName("Should leave other strings alone")
    void shouldLeaveTextAlone(String text) {
        assertThat(LooseValues.coerceNumericString(text)).isEqualTo(text);
    }

    @Test
    @DisplayName("Should return integral results as Long and fractions as Double")
    void shouldNormalizeNumbers() {
        assertThat(LooseValues.normalize(4.0)).isEqualTo(4L);
        assertThat(LooseValues.normalize(0.5)).isEqualTo(0.5);
        assertThat(LooseValues.normalize(Double.NaN)).isEqualTo(Double.NaN);
    }

    @Test
    @DisplayName("Should follow loose truthiness")
    void shouldFollowTruthiness() {
        assertThat(LooseValues.truthy(null)).isFalse();
        assertThat(LooseValues.truthy(0)).isFalse();
        assertThat(LooseValues.truthy("")).isFalse();
        assertThat(LooseValues.truthy("false")).isTrue();
        assertThat(LooseValues.truthy(2.5)).isTrue();
    }

    @Test
    @DisplayName("Should compare across types loosely")
    void shouldCompareLoosely() {
        assertThat(LooseValues.looseEquals(1, "1")).isTrue();
        assertThat(LooseValues.looseEquals(true, 1L)).isTrue();
        assertThat(LooseValues.looseEquals(null, null)).isTrue();
        assertThat(LooseValues.looseEquals(null, 0)).isFalse();
        assertThat(LooseValues.looseEquals("a", "b")).isFalse();
    }

    @Test
    @DisplayName("Should apply arithmetic, comparison and logical operators")
    void shouldApplyOperators() {
        assertThat(operators.apply(Operator.ADD, 2, null)).isEqualTo(2L);
        assertThat(operators.apply(Operator.ADD, "n", 1L)).isEqualTo("n1");
        assertThat(operators.apply(Operator.SUBTRACT, 10, 3)).isEqualTo(7L);
        assertThat(operators.apply(Operator.DIVIDE, 1, 4)).isEqualTo(0.25);
        assertThat(operators.apply(Operator.INCREMENT, 1, null)).isEqualTo(2L);
        assertThat(operators.apply(Operator.DECREMENT, 1, null)).isEqualTo(0L);
        assertThat(operators.apply(Operator.LESS_THAN, "apple", "banana")).isEqualTo(true);
        assertThat(operators.apply(Operator.GREATER_EQUALS, 3, 3.0)).isEqualTo(true);
        assertThat(operators.apply(Operator.GREATER_THAN, "abc", 1)).isEqualTo(false);
        assertThat(operators.apply(Operator.AND, 0, "x")).isEqualTo(0);
        assertThat(operators.apply(Operator.OR, 0, "x")).isEqualTo("x");
        assertThat(operators.apply(Operator.NOT, "", null)).isEqualTo(true);
        assertThat(operators.apply(null, 1, 2)).isNull();
    }
}
