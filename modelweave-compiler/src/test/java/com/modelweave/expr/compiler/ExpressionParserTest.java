package com.modelweave.expr.compiler;

import com.modelweave.expr.api.model.Compound;
import com.modelweave.expr.api.model.ElementReference;
import com.modelweave.expr.api.model.Expression;
import com.modelweave.expr.api.model.Literal;
import com.modelweave.expr.api.model.Operation;
import com.modelweave.expr.api.model.Operator;
import com.modelweave.expr.api.model.ParseContext;
import com.modelweave.expr.api.model.PatternElement;
import com.modelweave.expr.api.model.Reference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ExpressionParserTest {

    private ExpressionParser parser;

    @BeforeEach
    void setUp() {
        parser = new ExpressionParser();
    }

    private static ElementReference ref(String element, String attribute) {
        return new ElementReference(element, attribute);
    }

    @Nested
    @DisplayName("References")
    class References {

        @Test
        @DisplayName("Should parse a bare dotted reference")
        void shouldParseDottedReference() {
            Expression expr = parser.parse("Place.tokens");

            assertThat(expr).isInstanceOf(Reference.class);
            assertThat(expr.references()).containsExactly(ref("Place", "tokens"));
        }

        @Test
        @DisplayName("Should parse a single braced reference")
        void shouldParseBracedReference() {
            Expression expr = parser.parse("{arc.weight}");

            assertThat(expr).isEqualTo(new Reference(List.of(ref("arc", "weight")), false));
        }

        @Test
        @DisplayName("Should merge a list of braced references into one node")
        void shouldMergeBracedReferenceList() {
            Expression expr = parser.parse("{a.b}, {c.d}");

            assertThat(expr).isInstanceOf(Reference.class);
            assertThat(expr.references()).containsExactly(ref("a", "b"), ref("c", "d"));
        }

        @Test
        @DisplayName("Should return null for a braced token without an attribute")
        void shouldRejectBracedTokenWithoutAttribute() {
            assertThat(parser.parse("{invalid}")).isNull();
        }

        @Test
        @DisplayName("Should tolerate element names missing from the available elements")
        void shouldTolerateUnknownElement() {
            ParseContext context = new ParseContext(List.of(
                    new PatternElement("pe-1", "Place", "mc-place", Map.of())));

            Expression expr = parser.parse("Ghost.value", context);

            assertThat(expr.references()).containsExactly(ref("Ghost", "value"));
        }

        @Test
        @DisplayName("Should keep numbers with a decimal point as literals")
        void shouldNotTreatDecimalAsReference() {
            assertThat(parser.parse("0.1")).isEqualTo(Expression.literal("0.1"));
        }
    }

    @Nested
    @DisplayName("Arithmetic")
    class Arithmetic {

        @Test
        @DisplayName("Should parse a dotted reference decremented by a braced reference")
        void shouldParseDecrementByBracedReference() {
            Expression expr = parser.parse("Place.tokens decrement {arc.weight}");

            assertThat(expr).isInstanceOf(Operation.class);
            Operation op = (Operation) expr;
            assertThat(op.operator()).isEqualTo(Operator.SUBTRACT);
            assertThat(op.leftOperand().references()).containsExactly(ref("Place", "tokens"));
            assertThat(op.rightOperand()).isInstanceOf(Reference.class);
            assertThat(op.references()).containsExactly(ref("Place", "tokens"), ref("arc", "weight"));
        }

        @ParameterizedTest(name = "{0}")
        @CsvSource({
                "Place.tokens increment 2, ADD",
                "Place.tokens add 2, ADD",
                "Place.tokens INCREMENT 2, ADD",
                "Place.tokens decrement 2, SUBTRACT",
                "Place.tokens subtract 2, SUBTRACT",
                "Place.tokens multiply 2, MULTIPLY",
                "Place.tokens divide 2, DIVIDE",
                "{Place.tokens} add 2, ADD",
                "{Place.tokens} divide 2, DIVIDE"
        })
        @DisplayName("Should map arithmetic keywords and synonyms to operators")
        void shouldMapArithmeticKeywords(String input, Operator expected) {
            Operation op = (Operation) parser.parse(input);

            assertThat(op.operator()).isEqualTo(expected);
            assertThat(op.leftOperand()).isEqualTo(Expression.reference("Place", "tokens"));
            assertThat(op.rightOperand()).isEqualTo(Expression.literal("2"));
        }

        @Test
        @DisplayName("Should split braced references around a keyword structurally")
        void shouldSplitBracedOperands() {
            Operation op = (Operation) parser.parse("{a.b} increment {c.d}");

            assertThat(op.operator()).isEqualTo(Operator.ADD);
            assertThat(op.leftOperand().references()).containsExactly(ref("a", "b"));
            assertThat(op.rightOperand().references()).containsExactly(ref("c", "d"));
        }

        @Test
        @DisplayName("Should infer an operation anchored on the first reference when no keyword form applies")
        void shouldInferOperationFromKeywordSubstring() {
            Operation op = (Operation) parser.parse("{a.b}{c.d} increment");

            assertThat(op.operator()).isEqualTo(Operator.ADD);
            assertThat(op.leftOperand()).isEqualTo(new Reference(List.of(ref("a", "b")), false));
            assertThat(op.rightOperand()).isEqualTo(Expression.literal(1));
            assertThat(op.references()).containsExactly(ref("a", "b"), ref("c", "d"));
        }
    }

    @Nested
    @DisplayName("Comparison and logic")
    class ComparisonAndLogic {

        @Test
        @DisplayName("Should parse a greater than comparison")
        void shouldParseGreaterThan() {
            Operation op = (Operation) parser.parse("Product.inStock greater than 5");

            assertThat(op.operator()).isEqualTo(Operator.GREATER_THAN);
            assertThat(op.leftOperand()).isEqualTo(Expression.reference("Product", "inStock"));
            assertThat(op.rightOperand()).isEqualTo(Expression.literal("5"));
        }

        @ParameterizedTest(name = "{0}")
        @CsvSource({
                "a.x equals 3, EQUALS",
                "a.x not equals 3, NOT_EQUALS",
                "a.x greater than 3, GREATER_THAN",
                "a.x less than 3, LESS_THAN",
                "a.x greater than or equals 3, GREATER_EQUALS",
                "a.x less than or equals 3, LESS_EQUALS"
        })
        @DisplayName("Should prefer the longest comparison spelling")
        void shouldParseComparisons(String input, Operator expected) {
            Operation op = (Operation) parser.parse(input);

            assertThat(op.operator()).isEqualTo(expected);
            assertThat(op.leftOperand()).isEqualTo(Expression.reference("a", "x"));
            assertThat(op.rightOperand()).isEqualTo(Expression.literal("3"));
        }

        @Test
        @DisplayName("Should combine parenthesized comparisons with AND")
        void shouldParseAndOfComparisons() {
            Expression expr = parser.parse("(a.x equals 1) AND (b.y equals 2)");

            assertThat(expr).isInstanceOf(Compound.class);
            Compound compound = (Compound) expr;
            assertThat(compound.operator()).isEqualTo(Operator.AND);
            assertThat(compound.leftOperand()).isInstanceOf(Operation.class);
            assertThat(compound.leftOperand().isNested()).isTrue();
            assertThat(((Operation) compound.rightOperand()).operator()).isEqualTo(Operator.EQUALS);
            assertThat(compound.references()).containsExactly(ref("a", "x"), ref("b", "y"));
        }

        @Test
        @DisplayName("Should accept logical keywords in any case")
        void shouldParseLowerCaseOr() {
            Compound compound = (Compound) parser.parse("true or false");

            assertThat(compound.operator()).isEqualTo(Operator.OR);
            assertThat(compound.leftOperand()).isEqualTo(Expression.literal(true));
            assertThat(compound.rightOperand()).isEqualTo(Expression.literal(false));
        }

        @Test
        @DisplayName("Should read true and false as booleans and other words as text")
        void shouldParseBooleanLiterals() {
            assertThat(parser.parse("false")).isEqualTo(Expression.literal(Boolean.FALSE));
            assertThat(parser.parse(" true ")).isEqualTo(Expression.literal(Boolean.TRUE));
            assertThat(parser.parse("False")).isEqualTo(Expression.literal("False"));
        }

        @Test
        @DisplayName("Should parse a leading NOT as a negation of the rest")
        void shouldParseNegation() {
            Compound negated = (Compound) parser.parse("NOT {a.flag}");

            assertThat(negated.operator()).isEqualTo(Operator.NOT);
            assertThat(negated.leftOperand()).isEqualTo(new Reference(List.of(ref("a", "flag")), false));
            assertThat(negated.rightOperand()).isNull();
        }

        @Test
        @DisplayName("Should split on AND before applying a leading NOT")
        void shouldBindNegationTighterThanAnd() {
            Compound compound = (Compound) parser.parse("NOT {a.flag} AND {b.flag}");

            assertThat(compound.operator()).isEqualTo(Operator.AND);
            assertThat(((Compound) compound.leftOperand()).operator()).isEqualTo(Operator.NOT);
            assertThat(compound.rightOperand()).isEqualTo(new Reference(List.of(ref("b", "flag")), false));
        }

        @Test
        @DisplayName("Should negate a parenthesized group as a whole")
        void shouldNegateGroup() {
            Compound negated = (Compound) parser.parse("NOT ({a.x} AND {b.y})");

            assertThat(negated.operator()).isEqualTo(Operator.NOT);
            assertThat(negated.leftOperand()).isInstanceOf(Compound.class);
            assertThat(negated.leftOperand().isNested()).isTrue();
        }
    }

    @Nested
    @DisplayName("Parentheses")
    class Parentheses {

        @Test
        @DisplayName("Should collapse a fully parenthesized input to the nested inner node")
        void shouldCollapseFullyParenthesizedInput() {
            Expression expr = parser.parse("(Place.tokens multiply 0.1)");

            assertThat(expr).isInstanceOf(Operation.class);
            assertThat(expr.isNested()).isTrue();
            Operation op = (Operation) expr;
            assertThat(op.operator()).isEqualTo(Operator.MULTIPLY);
            assertThat(op.rightOperand()).isEqualTo(Expression.literal("0.1"));
            assertThat(op.withNested(false)).isEqualTo(parser.parse("Place.tokens multiply 0.1"));
        }

        @Test
        @DisplayName("Should attach a leading nested expression as the left operand")
        void shouldAttachNestedLeftOperand() {
            Operation op = (Operation) parser.parse("(Place.tokens increment 1) multiply 2");

            assertThat(op.operator()).isEqualTo(Operator.MULTIPLY);
            assertThat(op.leftOperand()).isInstanceOf(Operation.class);
            assertThat(op.leftOperand().isNested()).isTrue();
            assertThat(((Operation) op.leftOperand()).operator()).isEqualTo(Operator.ADD);
            assertThat(op.rightOperand()).isEqualTo(Expression.literal("2"));
        }

        @Test
        @DisplayName("Should attach a trailing nested expression as the right operand")
        void shouldAttachNestedRightOperand() {
            Operation op = (Operation) parser.parse("{Place.tokens} decrement ({arc.weight} multiply 2)");

            assertThat(op.operator()).isEqualTo(Operator.SUBTRACT);
            assertThat(op.leftOperand()).isEqualTo(Expression.reference("Place", "tokens"));
            assertThat(op.rightOperand().isNested()).isTrue();
            assertThat(op.references()).containsExactly(ref("Place", "tokens"), ref("arc", "weight"));
        }

        @Test
        @DisplayName("Should keep parentheses inside plain text literals")
        void shouldRestoreParenthesesInLiterals() {
            assertThat(parser.parse("f(x)")).isEqualTo(Expression.literal("f(x)"));
        }
    }

    @Nested
    @DisplayName("Fallbacks")
    class Fallbacks {

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   "})
        @DisplayName("Should return null for missing input")
        void shouldReturnNullForBlankInput(String input) {
            assertThat(parser.parse(input)).isNull();
        }

        @Test
        @DisplayName("Should wrap plain text as a string literal")
        void shouldWrapPlainText() {
            Expression expr = parser.parse("  hello world ");

            assertThat(expr).isInstanceOf(Literal.class);
            assertThat(((Literal) expr).value()).isEqualTo("hello world");
        }
    }
}
