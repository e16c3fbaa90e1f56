package com.modelweave.expr.script.validation;

import com.modelweave.expr.api.model.ConstraintOutcome;
import com.modelweave.expr.api.model.MetaClass;
import com.modelweave.expr.api.model.Metamodel;
import com.modelweave.expr.api.model.Model;
import com.modelweave.expr.api.model.ModelElement;
import com.modelweave.expr.api.model.ScriptConstraint;
import com.modelweave.expr.api.model.ScriptValidationResult;
import com.modelweave.expr.api.model.Severity;
import com.modelweave.expr.script.config.SandboxConfig;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ScriptConstraintValidatorTest {

    private static ScriptConstraintValidator validator;

    private static final Metamodel METAMODEL = new Metamodel("mm1", "PetriNets", List.of(
            new MetaClass("Place", "Place", List.of()),
            new MetaClass("Transition", "Transition", List.of())));

    private static final ModelElement P1 = new ModelElement("p1", "Place", Map.of("name", "P1", "tokens", 3));
    private static final ModelElement P2 = new ModelElement("p2", "Place", Map.of("name", "P2", "tokens", 0));
    private static final ModelElement T1 = new ModelElement("t1", "Transition", Map.of("name", "T1"),
            Map.of("inputs", List.of("p1", "p2")));
    private static final Model MODEL = new Model("m1", "Net", "mm1", List.of(P1, P2, T1));

    @BeforeAll
    static void setUp() {
        validator = new ScriptConstraintValidator(SandboxConfig.builder()
                .enabled(true)
                .timeoutMillis(5_000)
                .maxStatements(100_000)
                .build());
    }

    @AfterAll
    static void tearDown() {
        validator.close();
    }

    private static ModelElement widget(Map<String, Object> style) {
        return new ModelElement("w1", "Widget", style);
    }

    @Nested
    @DisplayName("Syntax check")
    class SyntaxCheck {

        @ParameterizedTest
        @ValueSource(strings = {
                "self.name.length > 0",
                "self.tokens >= 0;",
                "if (self.tokens < 0) { return false; } return true;",
                "for (const x of [1, 2]) { if (x > 5) return false; }",
                ""
        })
        @DisplayName("Should accept expressions and statement blocks")
        void shouldAcceptValidCode(String code) {
            assertThat(validator.validateSyntax(code).valid()).isTrue();
        }

        @Test
        @DisplayName("Should reject an unfinished expression with a bracket hint")
        void shouldRejectUnfinishedExpression() {
            ScriptValidationResult result = validator.validateSyntax("self.name.length >");

            assertThat(result.valid()).isFalse();
            assertThat(result.issues()).hasSize(1);
            assertThat(result.issues().get(0).constraintId()).isEqualTo("syntax-check");
            assertThat(result.issues().get(0).severity()).isEqualTo(Severity.ERROR);
            assertThat(result.firstMessage())
                    .startsWith("Syntax error")
                    .contains("closing brackets");
        }

        @Test
        @DisplayName("Should reject other malformed code with a syntax error message")
        void shouldRejectMalformedCode() {
            ScriptValidationResult result = validator.validateSyntax("self.name ==== 'x' )");

            assertThat(result.valid()).isFalse();
            assertThat(result.firstMessage()).startsWith("Syntax error");
        }

        @Test
        @DisplayName("Should never run the code")
        void shouldNeverRunCode() {
            assertThat(validator.validateSyntax("while (true) {}").valid()).isTrue();
        }
    }

    @Nested
    @DisplayName("Evaluation")
    class Evaluation {

        @Test
        @DisplayName("Simple expression passes for a named element and fails for an empty name")
        void simpleExpression() {
            ConstraintOutcome named = validator.evaluate("self.name.length > 0",
                    widget(Map.of("name", "Widget")), MODEL, METAMODEL);
            ConstraintOutcome empty = validator.evaluate("self.name.length > 0",
                    widget(Map.of("name", "")), MODEL, METAMODEL);

            assertThat(named.valid()).isTrue();
            assertThat(empty).isEqualTo(ConstraintOutcome.fail("Constraint failed"));
        }

        @Test
        @DisplayName("Statement block returns a result object with its own message")
        void statementBlock() {
            String code = "if (self.beverages === 0) { return { valid: false, message: \"Must have at least one beverage\" }; } return true;";

            ConstraintOutcome none = validator.evaluate(code, widget(Map.of("beverages", 0)), MODEL, METAMODEL);
            ConstraintOutcome some = validator.evaluate(code, widget(Map.of("beverages", 2)), MODEL, METAMODEL);

            assertThat(none).isEqualTo(ConstraintOutcome.fail("Must have at least one beverage"));
            assertThat(some.valid()).isTrue();
        }

        @Test
        @DisplayName("Statement block without a return passes")
        void statementBlockWithoutReturn() {
            assertThat(validator.evaluate("for (const k of Object.keys(self)) { k.length; }",
                    P1, MODEL, METAMODEL).valid()).isTrue();
        }

        @Test
        @DisplayName("References should be expanded on self")
        void referencesExpanded() {
            assertThat(validator.evaluate(
                    "self.inputs.length === 2 && self.inputs[0].tokens === 3", T1, MODEL, METAMODEL).valid())
                    .isTrue();
        }

        @Test
        @DisplayName("Helpers, named elements and the metaclass alias should be in scope")
        void bindingsInScope() {
            assertThat(validator.evaluate("findElementById('p2').style.tokens === 0", P1, MODEL, METAMODEL).valid())
                    .isTrue();
            assertThat(validator.evaluate("findElementsByType('Place').length === 2", P1, MODEL, METAMODEL).valid())
                    .isTrue();
            assertThat(validator.evaluate("P2.style.tokens < self.tokens", P1, MODEL, METAMODEL).valid())
                    .isTrue();
            assertThat(validator.evaluate("place.id === self.id && model.name === 'Net'", P1, MODEL, METAMODEL).valid())
                    .isTrue();
            assertThat(validator.evaluate("Math.max(self.tokens, 1) === 3 && metamodel.name === 'PetriNets'",
                    P1, MODEL, METAMODEL).valid()).isTrue();
        }

        @Test
        @DisplayName("Runtime errors become failures")
        void runtimeErrors() {
            ConstraintOutcome outcome = validator.evaluate("self.missing.length > 0", P1, MODEL, METAMODEL);

            assertThat(outcome.valid()).isFalse();
            assertThat(outcome.message()).startsWith("Runtime error:");
        }

        @Test
        @DisplayName("Host classes are not reachable")
        void hostClassesUnreachable() {
            ConstraintOutcome outcome = validator.evaluate(
                    "Java.type('java.lang.System') !== null", P1, MODEL, METAMODEL);

            assertThat(outcome.valid()).isFalse();
        }

        @Test
        @DisplayName("Unexpected results name the value")
        void unexpectedResult() {
            assertThat(validator.evaluate("42", P1, MODEL, METAMODEL).message())
                    .isEqualTo("Constraint returned an invalid result: 42");
            assertThat(validator.evaluate("null", P1, MODEL, METAMODEL).message())
                    .isEqualTo("Constraint returned an invalid result: null");
        }

        @Test
        @DisplayName("Runaway scripts are stopped")
        void runawayScripts() {
            ConstraintOutcome outcome = validator.evaluate("while (true) {}", P1, MODEL, METAMODEL);

            assertThat(outcome.valid()).isFalse();
        }
    }

    @Nested
    @DisplayName("Stored constraints")
    class StoredConstraints {

        private ScriptConstraint constraint(String expression, boolean valid, String error) {
            return new ScriptConstraint("c1", "tokens", "Place", "Place", expression, "",
                    Severity.WARNING, valid, error);
        }

        @Test
        @DisplayName("A failing constraint reports an issue for the element")
        void failingConstraint() {
            ScriptValidationResult result = validator.evaluateConstraint(
                    constraint("self.tokens > 0", true, null), P2, MODEL, METAMODEL);

            assertThat(result.valid()).isFalse();
            assertThat(result.issues()).singleElement().satisfies(issue -> {
                assertThat(issue.severity()).isEqualTo(Severity.WARNING);
                assertThat(issue.message()).isEqualTo("Constraint failed");
                assertThat(issue.elementId()).isEqualTo("p2");
                assertThat(issue.constraintId()).isEqualTo("c1");
                assertThat(issue.expression()).isEqualTo("self.tokens > 0");
            });
        }

        @Test
        @DisplayName("A passing constraint reports nothing")
        void passingConstraint() {
            assertThat(validator.evaluateConstraint(
                    constraint("self.tokens > 0", true, null), P1, MODEL, METAMODEL)).isEqualTo(ScriptValidationResult.ok());
        }

        @Test
        @DisplayName("An invalid constraint is reported without running")
        void invalidConstraint() {
            ScriptValidationResult stored = validator.evaluateConstraint(
                    constraint("while (true) {", false, "Syntax error: bad"), P1, MODEL, METAMODEL);
            ScriptValidationResult unnamed = validator.evaluateConstraint(
                    constraint("x", false, null), P1, MODEL, METAMODEL);

            assertThat(stored.firstMessage()).isEqualTo("Syntax error: bad");
            assertThat(unnamed.firstMessage()).isEqualTo("Invalid constraint syntax");
        }
    }

    @Nested
    @DisplayName("Limits and configuration")
    class Limits {

        @Test
        @DisplayName("Scripts running past the timeout fail")
        void timeout() {
            try (ScriptConstraintValidator slow = new ScriptConstraintValidator(SandboxConfig.builder()
                    .enabled(true)
                    .timeoutMillis(200)
                    .maxStatements(Long.MAX_VALUE)
                    .build())) {
                ConstraintOutcome outcome = slow.evaluate("while (true) {}", P1, MODEL, METAMODEL);

                assertThat(outcome.valid()).isFalse();
                assertThat(outcome.message()).contains("timed out");
            }
        }

        @Test
        @DisplayName("The first evaluation with the default configuration finishes within its timeout")
        void firstEvaluationWithDefaults() {
            SandboxConfig defaults = SandboxConfig.loadDefault();
            try (ScriptConstraintValidator fresh = new ScriptConstraintValidator(defaults)) {
                ConstraintOutcome outcome = fresh.evaluate("self.name.length > 0",
                        widget(Map.of("name", "Widget")), MODEL, METAMODEL);

                assertThat(defaults.getTimeoutMillis()).isEqualTo(2_000);
                assertThat(outcome.message()).isNull();
                assertThat(outcome.valid()).isTrue();
            }
        }

        @Test
        @DisplayName("Disabled scripting fails every evaluation")
        void disabled() {
            try (ScriptConstraintValidator off = new ScriptConstraintValidator(
                    SandboxConfig.builder().enabled(false).build())) {
                assertThat(off.evaluate("true", P1, MODEL, METAMODEL))
                        .isEqualTo(ConstraintOutcome.fail("Script constraints are disabled"));
                assertThat(off.validateSyntax("self.name.length >").valid()).isTrue();
            }
        }
    }

    @Test
    @DisplayName("Code containing return, if or for is a statement block")
    void classification() {
        assertThat(ScriptConstraintValidator.isStatementBlock("if (a) return b;")).isTrue();
        assertThat(ScriptConstraintValidator.isStatementBlock("self.identifier.length > 0")).isFalse();
        assertThat(ScriptConstraintValidator.isStatementBlock("self.format === 'x'")).isFalse();
    }
}
