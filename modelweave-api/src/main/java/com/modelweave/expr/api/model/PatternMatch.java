/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Binding produced by the (external) pattern matcher.
 *
 * @param patternId id of the matched pattern
 * @param matches   pattern element id to model element id
 * @param valid     whether the match survived its guards
 */
public record PatternMatch(
        @JsonProperty("patternId") String patternId,
        @JsonProperty("matches") Map<String, String> matches,
        @JsonProperty("valid") boolean valid
) {

    public PatternMatch {
        matches = matches == null ? Map.of() : matches;
    }

    public PatternMatch(String patternId, Map<String, String> matches) {
        this(patternId, matches, true);
    }

    public PatternMatch withValid(boolean valid) {
        return new PatternMatch(patternId, matches, valid);
    }
}
