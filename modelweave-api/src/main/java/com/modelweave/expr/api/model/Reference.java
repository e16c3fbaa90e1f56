/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.api.model;

import java.util.List;
import java.util.Objects;

/**
 * Attribute reference node. The list keeps every reference written in the source
 * text; evaluation resolves the first entry only.
 */
public record Reference(List<ElementReference> references, boolean isNested) implements Expression {

    public Reference {
        Objects.requireNonNull(references, "references cannot be null");
        references = List.copyOf(references);
    }

    @Override
    public ExpressionType type() {
        return ExpressionType.REFERENCE;
    }

    /**
     * The reference used for evaluation, or null when the list is empty.
     */
    public ElementReference primary() {
        return references.isEmpty() ? null : references.get(0);
    }

    @Override
    public Reference withNested(boolean nested) {
        return new Reference(references, nested);
    }
}
