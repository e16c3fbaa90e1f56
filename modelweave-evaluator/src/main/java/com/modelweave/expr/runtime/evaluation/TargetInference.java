/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.runtime.evaluation;

import com.modelweave.expr.api.model.ElementReference;
import com.modelweave.expr.api.model.Expression;
import com.modelweave.expr.api.model.Literal;
import com.modelweave.expr.api.model.Operation;
import com.modelweave.expr.api.model.Reference;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the attribute a global rule expression writes to.
 *
 * <p>For {@code Place.tokens decrement {arc.weight}} the target is
 * {@code Place.tokens}: the left operand of an arithmetic operation.
 */
final class TargetInference {

    private static final String IDENTIFIER = "[A-Za-z_][A-Za-z0-9_]*";
    private static final Pattern DOTTED = Pattern.compile("^(" + IDENTIFIER + ")\\.(" + IDENTIFIER + ")$");
    private static final Pattern UPDATE_TEXT = Pattern.compile(
            "(" + IDENTIFIER + ")\\.(" + IDENTIFIER + ")\\s+(?:decrement|increment|subtract|add)\\s+",
            Pattern.CASE_INSENSITIVE);

    Optional<ElementReference> infer(Expression expression) {
        if (!(expression instanceof Operation operation)
                || operation.operator() == null
                || !operation.operator().isArithmetic()) {
            return Optional.empty();
        }
        Expression left = operation.leftOperand();
        if (left instanceof Reference reference) {
            return Optional.ofNullable(reference.primary());
        }
        if (left instanceof Literal literal && literal.value() instanceof String text) {
            return dottedReference(text.trim());
        }
        return Optional.empty();
    }

    Optional<ElementReference> infer(String expressionText) {
        if (expressionText == null) {
            return Optional.empty();
        }
        Matcher matcher = UPDATE_TEXT.matcher(expressionText);
        if (matcher.find()) {
            return Optional.of(new ElementReference(matcher.group(1), matcher.group(2)));
        }
        return Optional.empty();
    }

    /**
     * Reads text of the exact form {@code element.attribute} as a reference.
     */
    static Optional<ElementReference> dottedReference(String text) {
        Matcher matcher = DOTTED.matcher(text);
        return matcher.matches()
                ? Optional.of(new ElementReference(matcher.group(1), matcher.group(2)))
                : Optional.empty();
    }
}
