/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.compiler;

import com.modelweave.expr.api.model.Compound;
import com.modelweave.expr.api.model.Expression;
import com.modelweave.expr.api.model.Literal;
import com.modelweave.expr.api.model.Operation;
import com.modelweave.expr.api.model.Operator;
import com.modelweave.expr.api.model.Reference;

import java.util.StringJoiner;
import java.util.stream.Collectors;

/**
 * Renders expressions in their canonical text form.
 *
 * <p>Output is always accepted by {@link ExpressionParser}, but is not the text
 * the user typed: references are emitted in braced form and synonyms such as
 * {@code add} are emitted as their canonical keyword. Operands that are
 * themselves operations are parenthesized so that re-parsing rebuilds the same
 * structure.
 */
public class ExpressionSerializer {

    static final String INVALID_REFERENCE = "Invalid Reference";

    public String toText(Expression expression) {
        if (expression == null) return "";
        String text = renderNode(expression);
        return expression.isNested() ? "(" + text + ")" : text;
    }

    private String renderNode(Expression expression) {
        if (expression instanceof Literal literal) {
            return String.valueOf(literal.value());
        }
        if (expression instanceof Reference reference) {
            if (reference.references().isEmpty()) return INVALID_REFERENCE;
            return reference.references().stream()
                    .map(ref -> "{" + ref.dotted() + "}")
                    .collect(Collectors.joining(", "));
        }
        if (expression instanceof Operation operation) {
            return renderOperation(operation);
        }
        return renderCompound((Compound) expression);
    }

    private String renderOperation(Operation operation) {
        Operator operator = operation.operator();
        if (operator == Operator.INCREMENT) {
            return join(Operator.ADD, operation.leftOperand(), Expression.literal(1));
        }
        if (operator == Operator.DECREMENT) {
            return join(Operator.SUBTRACT, operation.leftOperand(), Expression.literal(1));
        }
        return join(operator, operation.leftOperand(), operation.rightOperand());
    }

    /**
     * Compounds missing an operand are written in the shape that evaluates the
     * same: a lone operand stands for itself, {@code x AND x} and
     * {@code x OR x} reproduce the short-circuit result of a missing right side.
     */
    private String renderCompound(Compound compound) {
        Operator operator = compound.operator();
        Expression left = compound.leftOperand();
        Expression right = compound.rightOperand();
        if (operator == Operator.NOT) {
            return join(Operator.NOT, null, left != null ? left : right);
        }
        if (operator == Operator.AND || operator == Operator.OR) {
            if (left == null) {
                return operand(right);
            }
            if (right == null) {
                return join(operator, left, left);
            }
        }
        return join(operator, left, right);
    }

    private String join(Operator operator, Expression left, Expression right) {
        StringJoiner joiner = new StringJoiner(" ");
        String leftText = operand(left);
        String rightText = operand(right);
        if (!leftText.isEmpty()) joiner.add(leftText);
        if (operator != null) joiner.add(operator.keyword());
        if (!rightText.isEmpty()) joiner.add(rightText);
        return joiner.toString();
    }

    private String operand(Expression operand) {
        if (operand == null) return "";
        String text = toText(operand);
        boolean composite = operand instanceof Operation || operand instanceof Compound;
        return composite && !operand.isNested() ? "(" + text + ")" : text;
    }
}
