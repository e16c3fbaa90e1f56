/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * User-authored boolean script attached to a metaclass (or to the whole
 * metamodel when {@code contextClassId} is null).
 *
 * <p>{@code isValid} reflects the last syntax probe. Invalid constraints are
 * reported with {@code errorMessage} and are not executed until edited.
 */
public record ScriptConstraint(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("contextClassId") String contextClassId,
        @JsonProperty("contextClassName") String contextClassName,
        @JsonProperty("expression") String expression,
        @JsonProperty("description") String description,
        @JsonProperty("severity") Severity severity,
        @JsonProperty("isValid") boolean isValid,
        @JsonProperty("errorMessage") String errorMessage
) {

    public ScriptConstraint {
        if (severity == null) severity = Severity.ERROR;
        if (description == null) description = "";
    }

    public boolean isGlobal() {
        return contextClassId == null;
    }

    public ScriptConstraint withSyntaxStatus(boolean valid, String message) {
        return new ScriptConstraint(id, name, contextClassId, contextClassName, expression,
                description, severity, valid, valid ? null : message);
    }

    public ScriptConstraint withExpression(String newExpression) {
        return new ScriptConstraint(id, name, contextClassId, contextClassName, newExpression,
                description, severity, isValid, errorMessage);
    }
}
