/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.script.validation;

import com.modelweave.expr.api.IConstraintValidator;
import com.modelweave.expr.api.model.ConstraintOutcome;
import com.modelweave.expr.api.model.Metamodel;
import com.modelweave.expr.api.model.Model;
import com.modelweave.expr.api.model.ModelElement;
import com.modelweave.expr.api.model.ScriptConstraint;
import com.modelweave.expr.api.model.ScriptValidationResult;
import com.modelweave.expr.api.model.Severity;
import com.modelweave.expr.api.model.ValidationIssue;
import com.modelweave.expr.script.config.SandboxConfig;
import com.modelweave.expr.script.sandbox.SandboxBindings;
import com.modelweave.expr.script.sandbox.ScriptContextBuilder;
import com.modelweave.expr.script.sandbox.ScriptErrorFormatter;
import com.modelweave.expr.script.sandbox.ScriptSandbox;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Checks and runs script constraints written in JavaScript.
 *
 * <p>Code is either a single expression ({@code self.name.length > 0}) or a
 * function body that returns its result; code mentioning {@code return},
 * {@code if} or {@code for} is treated as a body and gets an implicit
 * {@code return true} at the end.
 *
 * <p>No method throws; failures become {@link ConstraintOutcome.Fail} or a
 * {@link ScriptValidationResult} carrying an issue.
 */
public class ScriptConstraintValidator implements IConstraintValidator, AutoCloseable {
    private static final Logger logger = Logger.getLogger(ScriptConstraintValidator.class.getName());

    public static final String SYNTAX_CHECK_ID = "syntax-check";
    public static final String DISABLED_MESSAGE = "Script constraints are disabled";
    public static final String INVALID_SYNTAX_MESSAGE = "Invalid constraint syntax";

    private static final Pattern STATEMENT_KEYWORDS = Pattern.compile("\\b(return|if|for)\\b");
    private static final Pattern TRAILING_SEMICOLONS = Pattern.compile("[;\\s]+$");
    private static final List<String> PROBE_PARAMETERS = List.of(ScriptContextBuilder.SELF);

    private final SandboxConfig config;
    private final ScriptSandbox sandbox;
    private final ScriptContextBuilder contextBuilder;

    public ScriptConstraintValidator() {
        this(SandboxConfig.loadDefault());
    }

    public ScriptConstraintValidator(SandboxConfig config) {
        this(config, config.isEnabled() ? new ScriptSandbox(config) : null);
    }

    ScriptConstraintValidator(SandboxConfig config, ScriptSandbox sandbox) {
        this.config = config;
        this.sandbox = sandbox;
        this.contextBuilder = new ScriptContextBuilder();
        if (!config.isEnabled()) {
            logger.warning(DISABLED_MESSAGE + "; every constraint evaluation will fail");
        }
    }

    /**
     * Compiles the code without running it, first as a function body and
     * then as a single expression. With scripting disabled nothing can be
     * checked and the code is accepted.
     */
    @Override
    public ScriptValidationResult validateSyntax(String code) {
        if (sandbox == null) {
            return ScriptValidationResult.ok();
        }
        String source = code == null ? "" : code;
        try {
            if (sandbox.compileError(PROBE_PARAMETERS, statementBody(source)) == null) {
                return ScriptValidationResult.ok();
            }
            String expressionError = sandbox.compileError(PROBE_PARAMETERS, expressionBody(source));
            if (expressionError == null) {
                return ScriptValidationResult.ok();
            }
            // The bare code reports premature endings without our wrapper in the way.
            String bareError = sandbox.compileError(PROBE_PARAMETERS, source);
            String message = ScriptErrorFormatter.format(bareError != null ? bareError : expressionError);
            logger.fine(() -> "Rejected constraint code: " + message);
            return syntaxFailure(message, source);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Syntax check failed unexpectedly", e);
            return syntaxFailure(ScriptErrorFormatter.format(e.getMessage()), source);
        }
    }

    @Override
    public ConstraintOutcome evaluate(String code, ModelElement element, Model model, Metamodel metamodel) {
        if (sandbox == null) {
            return ConstraintOutcome.fail(DISABLED_MESSAGE);
        }
        if (element == null) {
            return ConstraintOutcome.fail("Runtime error: no element to validate");
        }
        try {
            SandboxBindings bindings = SandboxBindings.build(
                    contextBuilder.build(element, model, metamodel), element, model, metamodel);
            String source = code == null ? "" : code;
            String body = source.isBlank() || isStatementBlock(source) ? statementBody(source) : expressionBody(source);
            ConstraintOutcome outcome = sandbox.execute(body, bindings);
            if (!outcome.valid()) {
                logger.fine(() -> "Constraint failed on " + element.id() + ": " + outcome.message());
            }
            return outcome;
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Error evaluating constraint on element " + element.id(), e);
            return ConstraintOutcome.fail("Runtime error: " + e.getMessage());
        }
    }

    @Override
    public ScriptValidationResult evaluateConstraint(ScriptConstraint constraint, ModelElement element,
                                                     Model model, Metamodel metamodel) {
        String elementId = element == null ? null : element.id();
        if (!constraint.isValid()) {
            String message = constraint.errorMessage() == null || constraint.errorMessage().isBlank()
                    ? INVALID_SYNTAX_MESSAGE
                    : constraint.errorMessage();
            return ScriptValidationResult.failed(new ValidationIssue(
                    constraint.severity(), message, elementId, constraint.id(), constraint.expression()));
        }

        ConstraintOutcome outcome = evaluate(constraint.expression(), element, model, metamodel);
        if (outcome.valid()) {
            return ScriptValidationResult.ok();
        }
        return ScriptValidationResult.failed(new ValidationIssue(
                constraint.severity(), outcome.message(), elementId, constraint.id(), constraint.expression()));
    }

    public SandboxConfig getConfig() {
        return config;
    }

    static boolean isStatementBlock(String code) {
        return STATEMENT_KEYWORDS.matcher(code).find();
    }

    static String statementBody(String code) {
        return "\"use strict\";\n" + code + "\nreturn true;";
    }

    static String expressionBody(String code) {
        String expression = TRAILING_SEMICOLONS.matcher(code.strip()).replaceFirst("");
        return "\"use strict\";\nreturn (\n" + expression + "\n);";
    }

    private static ScriptValidationResult syntaxFailure(String message, String code) {
        return ScriptValidationResult.failed(
                new ValidationIssue(Severity.ERROR, message, null, SYNTAX_CHECK_ID, code));
    }

    @Override
    public void close() {
        if (sandbox != null) {
            sandbox.close();
        }
    }
}
