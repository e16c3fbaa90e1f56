/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.api.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Node of the expression AST.
 *
 * <p>Expressions are immutable once built: edits replace the whole tree. Each
 * node exclusively owns its operand subtrees. The {@link #isNested()} flag only
 * records that the node was written inside parentheses and never changes how the
 * node evaluates.
 *
 * <h2>Shapes</h2>
 * <ul>
 *   <li>{@link Literal} - a raw string, number or boolean</li>
 *   <li>{@link Reference} - one or more {@code element.attribute} pointers</li>
 *   <li>{@link Operation} - arithmetic or comparison over two operands</li>
 *   <li>{@link Compound} - AND / OR / NOT over boolean operands</li>
 * </ul>
 */
public sealed interface Expression permits Literal, Reference, Operation, Compound {

    ExpressionType type();

    /**
     * References carried by this node. For operations this is the union of the
     * operands' lists, left first.
     */
    List<ElementReference> references();

    boolean isNested();

    /**
     * Returns a copy of this node with the nested marker set.
     */
    Expression withNested(boolean nested);

    static Literal literal(Object value) {
        return new Literal(value, false);
    }

    static Reference reference(String elementName, String attributeName) {
        return new Reference(List.of(new ElementReference(elementName, attributeName)), false);
    }

    static Operation operation(Operator operator, Expression left, Expression right) {
        return Operation.of(operator, left, right);
    }

    static Compound compound(Operator operator, Expression left, Expression right) {
        return new Compound(operator, left, right, false);
    }

    /**
     * Concatenates the reference lists of two optional operands.
     */
    static List<ElementReference> mergeReferences(Expression left, Expression right) {
        List<ElementReference> merged = new ArrayList<>();
        if (left != null) merged.addAll(left.references());
        if (right != null) merged.addAll(right.references());
        return List.copyOf(merged);
    }
}
