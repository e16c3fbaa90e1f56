/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.api.model;

import java.util.List;

/**
 * A raw value: {@link String}, {@link Number} or {@link Boolean}. Text parsed
 * from authored input always produces string literals; numeric coercion happens
 * at evaluation time.
 */
public record Literal(Object value, boolean isNested) implements Expression {

    @Override
    public ExpressionType type() {
        return ExpressionType.LITERAL;
    }

    @Override
    public List<ElementReference> references() {
        return List.of();
    }

    @Override
    public Literal withNested(boolean nested) {
        return new Literal(value, nested);
    }
}
