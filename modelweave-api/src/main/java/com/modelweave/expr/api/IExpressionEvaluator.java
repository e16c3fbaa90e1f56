/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.api;

import com.modelweave.expr.api.model.ElementReference;
import com.modelweave.expr.api.model.EvaluationContext;
import com.modelweave.expr.api.model.Expression;

import java.util.List;
import java.util.Optional;

/**
 * Contract for evaluating expressions inside transformation rules.
 *
 * <p>Implementations never throw: unresolved references evaluate to null and
 * unsupported operators are logged and evaluate to null, so a partially
 * specified rule never aborts a transformation pass. Implementations are
 * stateless with respect to the context and safe for concurrent use.
 */
public interface IExpressionEvaluator {

    /**
     * Evaluates a tree against a context snapshot.
     *
     * @return a {@link String}, {@link Number}, {@link Boolean} or null
     */
    Object evaluate(Expression expression, EvaluationContext context);

    /**
     * Parses and evaluates expression text. Text no grammar rule accepts is
     * evaluated as a literal.
     */
    Object evaluate(String expressionText, EvaluationContext context);

    /**
     * Evaluates a pattern guard: the guard fails only when the expression
     * evaluates to {@code false}.
     */
    boolean evaluateGuard(Expression expression, EvaluationContext context);

    /**
     * Infers the attribute a global rule expression updates, e.g. {@code Place.tokens}
     * for {@code Place.tokens decrement 1}.
     */
    Optional<ElementReference> inferTarget(Expression expression);

    /**
     * Distinct references of the whole tree, in source order.
     */
    List<ElementReference> referencedElements(Expression expression);
}
