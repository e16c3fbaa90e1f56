/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.api.model;

import java.util.List;

/**
 * Optional information available while parsing. Known element names are only
 * used to warn about unknown references; they never reject input.
 */
public record ParseContext(List<PatternElement> availableElements) {

    private static final ParseContext EMPTY = new ParseContext(List.of());

    public ParseContext {
        availableElements = availableElements == null ? List.of() : List.copyOf(availableElements);
    }

    public static ParseContext empty() {
        return EMPTY;
    }
}
