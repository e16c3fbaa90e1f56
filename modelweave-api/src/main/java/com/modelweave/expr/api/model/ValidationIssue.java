/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single finding of a constraint check, consumed by the report renderer.
 */
public record ValidationIssue(
        @JsonProperty("severity") Severity severity,
        @JsonProperty("message") String message,
        @JsonProperty("elementId") String elementId,
        @JsonProperty("constraintId") String constraintId,
        @JsonProperty("expression") String expression
) {}
