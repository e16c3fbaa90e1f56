/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Typed placeholder node of a transformation rule pattern (LHS, RHS or NAC).
 * Owned by the rule editor; read-only here.
 *
 * @param id         unique id of the pattern element
 * @param name       human name used by {@code element.attribute} references
 * @param type       id of the metaclass the element is an instance of
 * @param attributes attribute values, either plain values or {@link Expression}s
 * @param references references to other pattern elements
 * @param position   position in the pattern diagram (may be null)
 */
public record PatternElement(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("attributes") Map<String, Object> attributes,
        @JsonProperty("references") Map<String, Object> references,
        @JsonProperty("position") Position position
) {

    public PatternElement {
        attributes = attributes == null ? Map.of() : attributes;
        references = references == null ? Map.of() : references;
    }

    public PatternElement(String id, String name, String type, Map<String, Object> attributes) {
        this(id, name, type, attributes, Map.of(), null);
    }

    public record Position(@JsonProperty("x") double x, @JsonProperty("y") double y) {}
}
