/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Discriminator of the {@link Expression} tagged union, as persisted in the
 * {@code type} field of the expression JSON.
 */
public enum ExpressionType {
    LITERAL,
    REFERENCE,
    OPERATION,
    COMPOUND;

    /**
     * Reads the {@code type} discriminator, ignoring case.
     *
     * @return the node type, or null when the field is missing or unknown
     */
    public static ExpressionType fromString(String text) {
        if (text == null) return null;
        try {
            return ExpressionType.valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    @JsonValue
    public String getValue() {
        return name();
    }
}
