/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of a syntax probe or of checking one constraint against one element.
 */
public record ScriptValidationResult(
        @JsonProperty("valid") boolean valid,
        @JsonProperty("issues") List<ValidationIssue> issues
) {

    public ScriptValidationResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public static ScriptValidationResult ok() {
        return new ScriptValidationResult(true, List.of());
    }

    public static ScriptValidationResult failed(ValidationIssue issue) {
        return new ScriptValidationResult(false, List.of(issue));
    }

    /**
     * Message of the first issue, or null when valid.
     */
    public String firstMessage() {
        return issues.isEmpty() ? null : issues.get(0).message();
    }
}
