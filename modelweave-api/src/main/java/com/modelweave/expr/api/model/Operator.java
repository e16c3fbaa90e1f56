/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Operators of the expression language.
 *
 * <p>Each operator carries the canonical keyword the serializer emits. Parsing
 * accepts more spellings than are emitted ({@code add}/{@code subtract} for
 * {@link #ADD}/{@link #SUBTRACT}), so the canonical keyword is the single
 * normalized form.
 */
public enum Operator {
    // arithmetic
    ADD("increment", Category.ARITHMETIC),
    SUBTRACT("decrement", Category.ARITHMETIC),
    MULTIPLY("multiply", Category.ARITHMETIC),
    DIVIDE("divide", Category.ARITHMETIC),
    INCREMENT("++", Category.ARITHMETIC),
    DECREMENT("--", Category.ARITHMETIC),

    // comparison
    EQUALS("equals", Category.COMPARISON),
    NOT_EQUALS("not equals", Category.COMPARISON),
    GREATER_THAN("greater than", Category.COMPARISON),
    LESS_THAN("less than", Category.COMPARISON),
    GREATER_EQUALS("greater than or equals", Category.COMPARISON),
    LESS_EQUALS("less than or equals", Category.COMPARISON),

    // logical
    AND("AND", Category.LOGICAL),
    OR("OR", Category.LOGICAL),
    NOT("NOT", Category.LOGICAL);

    public enum Category { ARITHMETIC, COMPARISON, LOGICAL }

    private final String keyword;
    private final Category category;

    Operator(String keyword, Category category) {
        this.keyword = keyword;
        this.category = category;
    }

    /**
     * Canonical keyword used when rendering an expression as text.
     */
    public String keyword() {
        return keyword;
    }

    public Category category() {
        return category;
    }

    public boolean isArithmetic() {
        return category == Category.ARITHMETIC;
    }

    public boolean isComparison() {
        return category == Category.COMPARISON;
    }

    public boolean isLogical() {
        return category == Category.LOGICAL;
    }

    /**
     * Looks an operator up by its enum name in any case, as stored in the
     * {@code operator} field of the expression JSON. Keywords such as
     * {@code "greater than"} are not names and do not match.
     *
     * @return the operator, or null for null or unknown names
     */
    public static Operator fromString(String text) {
        if (text == null) return null;
        try {
            return Operator.valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    @JsonValue
    public String getValue() {
        return name();
    }
}
