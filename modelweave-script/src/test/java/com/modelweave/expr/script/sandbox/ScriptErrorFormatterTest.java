package com.modelweave.expr.script.sandbox;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class ScriptErrorFormatterTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "Unexpected end of input",
            "SyntaxError: Unexpected end of input",
            "<function>:3:19 Expected an operand but found eof\nself.name.length >\n                   ^",
            "Unterminated string literal",
            "Missing close quote"
    })
    @DisplayName("Premature endings should become the unbalanced-brackets hint")
    void prematureEndsShouldBecomeHint(String raw) {
        assertThat(ScriptErrorFormatter.format(raw)).isEqualTo(ScriptErrorFormatter.UNBALANCED_HINT);
    }

    @Test
    @DisplayName("Other errors should keep their first line without location")
    void shouldKeepFirstLine() {
        String formatted = ScriptErrorFormatter.format(
                "<function>:2:7 Expected ; but found name\nreturn (a b);\n          ^");

        assertThat(formatted).isEqualTo("Syntax error: Expected ; but found name");
    }

    @Test
    @DisplayName("Should strip the error type prefix")
    void shouldStripErrorType() {
        assertThat(ScriptErrorFormatter.format("SyntaxError: Unexpected token ')'"))
                .isEqualTo("Syntax error: Unexpected token ')'");
    }

    @Test
    @DisplayName("Blank messages should still produce a syntax error")
    void blankMessages() {
        assertThat(ScriptErrorFormatter.format(null)).startsWith("Syntax error");
        assertThat(ScriptErrorFormatter.format("  ")).startsWith("Syntax error");
    }
}
