/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.runtime.evaluation;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.modelweave.expr.api.IExpressionEvaluator;
import com.modelweave.expr.api.IExpressionParser;
import com.modelweave.expr.api.model.Compound;
import com.modelweave.expr.api.model.ElementReference;
import com.modelweave.expr.api.model.EvaluationContext;
import com.modelweave.expr.api.model.Expression;
import com.modelweave.expr.api.model.Literal;
import com.modelweave.expr.api.model.Operation;
import com.modelweave.expr.api.model.Operator;
import com.modelweave.expr.api.model.ParseContext;
import com.modelweave.expr.api.model.Reference;
import com.modelweave.expr.compiler.ExpressionParser;
import com.modelweave.expr.runtime.operators.LooseValues;
import com.modelweave.expr.runtime.operators.OperatorEvaluator;
import com.modelweave.expr.runtime.resolution.ReferenceResolver;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tree-walking evaluator for transformation rule expressions.
 *
 * <p>Evaluation never throws and never mutates the tree or the context, so the
 * same instance may evaluate many matches concurrently. Unresolvable
 * references and unsupported operators evaluate to null.
 *
 * <h2>Operation semantics</h2>
 * <ul>
 *   <li>a literal operand spelled {@code element.attribute} is read as a reference</li>
 *   <li>numeric strings are converted to numbers before the operator applies</li>
 *   <li>{@code equals} / {@code not equals} use loose equality</li>
 *   <li>only the first entry of a multi-reference node is resolved</li>
 * </ul>
 *
 * <p>Compound nodes short-circuit: the right operand of {@code AND} is not
 * evaluated when the left is falsy, nor the right operand of {@code OR} when
 * the left is truthy.
 */
public class ExpressionEvaluator implements IExpressionEvaluator {
    private static final Logger logger = Logger.getLogger(ExpressionEvaluator.class.getName());

    public static final int DEFAULT_PARSE_CACHE_SIZE = 1_000;

    private final IExpressionParser parser;
    private final ReferenceResolver resolver;
    private final OperatorEvaluator operators;
    private final TargetInference targetInference;
    private final Cache<String, Expression> parseCache;

    public ExpressionEvaluator() {
        this(new ExpressionParser(), new ReferenceResolver(), DEFAULT_PARSE_CACHE_SIZE);
    }

    public ExpressionEvaluator(IExpressionParser parser, ReferenceResolver resolver, int parseCacheSize) {
        if (parseCacheSize < 0) {
            throw new IllegalArgumentException("Parse cache size must be non-negative, got: " + parseCacheSize);
        }
        this.parser = parser;
        this.resolver = resolver;
        this.operators = new OperatorEvaluator();
        this.targetInference = new TargetInference();
        this.parseCache = Caffeine.newBuilder()
                .maximumSize(parseCacheSize)
                .recordStats()
                .build();
    }

    @Override
    public Object evaluate(Expression expression, EvaluationContext context) {
        if (expression == null) {
            return null;
        }
        try {
            return evaluateNode(expression, orEmpty(context));
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to evaluate expression " + expression.type(), e);
            return null;
        }
    }

    /**
     * Parses the text against the context's pattern elements and evaluates it.
     * Text that no grammar rule accepts evaluates to itself.
     */
    @Override
    public Object evaluate(String expressionText, EvaluationContext context) {
        if (expressionText == null) {
            return null;
        }
        EvaluationContext ctx = orEmpty(context);
        Expression expression = parseCache.get(expressionText, text -> parseOrLiteral(text, ctx));
        return evaluate(expression, ctx);
    }

    /**
     * Only an explicit {@code false} rejects the match; null and non-boolean
     * values keep it. A failure while evaluating rejects the match.
     */
    @Override
    public boolean evaluateGuard(Expression expression, EvaluationContext context) {
        if (expression == null) {
            return true;
        }
        try {
            Object result = evaluateNode(expression, orEmpty(context));
            logger.fine(() -> "Guard evaluated to " + result);
            return !Boolean.FALSE.equals(result);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Error evaluating guard expression, rejecting match", e);
            return false;
        }
    }

    @Override
    public Optional<ElementReference> inferTarget(Expression expression) {
        return targetInference.infer(expression);
    }

    public Optional<ElementReference> inferTarget(String expressionText) {
        return targetInference.infer(expressionText);
    }

    @Override
    public List<ElementReference> referencedElements(Expression expression) {
        Set<ElementReference> collected = new LinkedHashSet<>();
        collectReferences(expression, collected);
        return new ArrayList<>(collected);
    }

    /**
     * Hit rate of the parse cache, for diagnostics.
     */
    public double parseCacheHitRate() {
        return parseCache.stats().hitRate();
    }

    private Expression parseOrLiteral(String text, EvaluationContext context) {
        Expression parsed = parser.parse(text, new ParseContext(context.allPatternElements()));
        return parsed != null ? parsed : Expression.literal(text);
    }

    private Object evaluateNode(Expression expression, EvaluationContext context) {
        if (expression instanceof Literal literal) {
            return literal.value();
        }
        if (expression instanceof Reference reference) {
            return evaluateReference(reference, context);
        }
        if (expression instanceof Operation operation) {
            return evaluateOperation(operation, context);
        }
        return evaluateCompound((Compound) expression, context);
    }

    private Object evaluateReference(Reference reference, EvaluationContext context) {
        ElementReference primary = reference.primary();
        return primary == null ? null : resolver.resolve(primary, context);
    }

    private Object evaluateOperation(Operation operation, EvaluationContext context) {
        if (operation.operator() == null) {
            logger.warning("Operation expression missing operator");
            return null;
        }
        Object left = LooseValues.coerceNumericString(evaluateOperand(operation.leftOperand(), context));
        Object right = LooseValues.coerceNumericString(evaluateOperand(operation.rightOperand(), context));
        logger.fine(() -> "Evaluating operation: " + left + " " + operation.operator() + " " + right);
        return operators.apply(operation.operator(), left, right);
    }

    private Object evaluateOperand(Expression operand, EvaluationContext context) {
        if (operand == null) {
            return null;
        }
        if (operand instanceof Literal literal && literal.value() instanceof String text) {
            Optional<ElementReference> implicit = TargetInference.dottedReference(text);
            if (implicit.isPresent()) {
                return resolver.resolve(implicit.get(), context);
            }
        }
        return evaluateNode(operand, context);
    }

    private Object evaluateCompound(Compound compound, EvaluationContext context) {
        Operator operator = compound.operator();
        if (operator == null || !operator.isLogical()) {
            logger.warning("Unsupported compound operator: " + operator);
            return null;
        }

        Expression leftOperand = compound.leftOperand();
        Expression rightOperand = compound.rightOperand();
        if (leftOperand == null) {
            // Degenerate node: the right operand stands alone.
            if (rightOperand == null) return null;
            Object value = evaluateNode(rightOperand, context);
            return operator == Operator.NOT ? !LooseValues.truthy(value) : value;
        }

        Object left = evaluateNode(leftOperand, context);
        switch (operator) {
            case AND:
                if (!LooseValues.truthy(left)) return false;
                return rightOperand == null ? left : evaluateNode(rightOperand, context);
            case OR:
                if (LooseValues.truthy(left)) return true;
                return rightOperand == null ? left : evaluateNode(rightOperand, context);
            default:
                return !LooseValues.truthy(left);
        }
    }

    private static void collectReferences(Expression expression, Set<ElementReference> collected) {
        if (expression == null) {
            return;
        }
        if (expression instanceof Operation operation) {
            collected.addAll(operation.references());
            collectReferences(operation.leftOperand(), collected);
            collectReferences(operation.rightOperand(), collected);
        } else if (expression instanceof Compound compound) {
            collectReferences(compound.leftOperand(), collected);
            collectReferences(compound.rightOperand(), collected);
        } else {
            collected.addAll(expression.references());
        }
    }

    private static EvaluationContext orEmpty(EvaluationContext context) {
        return context == null ? EvaluationContext.empty() : context;
    }
}
