/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.script.registry;

import com.modelweave.expr.api.model.Severity;

/**
 * User-editable fields of a script constraint. On update, null fields keep
 * their current value.
 */
public record ConstraintDefinition(String name, String expression, String description, Severity severity) {

    public static ConstraintDefinition of(String name, String expression) {
        return new ConstraintDefinition(name, expression, null, null);
    }

    public static ConstraintDefinition expression(String expression) {
        return new ConstraintDefinition(null, expression, null, null);
    }
}
