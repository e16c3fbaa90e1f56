/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.api.model;

import java.util.List;

/**
 * Binary arithmetic or comparison node. Operands are optional only while a tree
 * is being assembled from partial input.
 */
public record Operation(
        Operator operator,
        Expression leftOperand,
        Expression rightOperand,
        List<ElementReference> references,
        boolean isNested
) implements Expression {

    public Operation {
        references = references == null ? List.of() : List.copyOf(references);
    }

    /**
     * Builds an operation whose reference list is the union of its operands'.
     */
    public static Operation of(Operator operator, Expression left, Expression right) {
        return new Operation(operator, left, right, Expression.mergeReferences(left, right), false);
    }

    @Override
    public ExpressionType type() {
        return ExpressionType.OPERATION;
    }

    @Override
    public Operation withNested(boolean nested) {
        return new Operation(operator, leftOperand, rightOperand, references, nested);
    }

    public Operation withLeftOperand(Expression left) {
        return new Operation(operator, left, rightOperand, Expression.mergeReferences(left, rightOperand), isNested);
    }

    public Operation withRightOperand(Expression right) {
        return new Operation(operator, leftOperand, right, Expression.mergeReferences(leftOperand, right), isNested);
    }
}
