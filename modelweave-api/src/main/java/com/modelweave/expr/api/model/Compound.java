/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.api.model;

import java.util.List;

/**
 * Logical node ({@link Operator#AND}, {@link Operator#OR}, {@link Operator#NOT}).
 * A missing operand degenerates to the value of the other one at evaluation time.
 */
public record Compound(
        Operator operator,
        Expression leftOperand,
        Expression rightOperand,
        boolean isNested
) implements Expression {

    @Override
    public ExpressionType type() {
        return ExpressionType.COMPOUND;
    }

    /**
     * Derived from the operands; compound nodes do not persist a reference list.
     */
    @Override
    public List<ElementReference> references() {
        return Expression.mergeReferences(leftOperand, rightOperand);
    }

    @Override
    public Compound withNested(boolean nested) {
        return new Compound(operator, leftOperand, rightOperand, nested);
    }
}
