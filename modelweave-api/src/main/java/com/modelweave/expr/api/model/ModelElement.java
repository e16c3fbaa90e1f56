/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Concrete instance node of a user model.
 *
 * @param id             unique id of the element
 * @param name           optional direct name
 * @param modelElementId id of the metaclass this element instantiates
 * @param style          attribute values
 * @param references     outgoing references: reference name to a target id, a list of ids, or null
 * @param attributes     optional secondary attribute map written by older tooling
 */
public record ModelElement(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("modelElementId") String modelElementId,
        @JsonProperty("style") Map<String, Object> style,
        @JsonProperty("references") Map<String, Object> references,
        @JsonProperty("attributes") Map<String, Object> attributes
) {

    public ModelElement {
        style = style == null ? Map.of() : style;
        references = references == null ? Map.of() : references;
        attributes = attributes == null ? Map.of() : attributes;
    }

    public ModelElement(String id, String modelElementId, Map<String, Object> style) {
        this(id, null, modelElementId, style, Map.of(), Map.of());
    }

    public ModelElement(String id, String modelElementId, Map<String, Object> style, Map<String, Object> references) {
        this(id, null, modelElementId, style, references, Map.of());
    }

    /**
     * Name as shown to users: {@code style.name}, then {@code attributes.name},
     * then the direct name.
     */
    public String displayName() {
        if (style.get("name") instanceof String s) return s;
        if (attributes.get("name") instanceof String s) return s;
        return name;
    }

    /**
     * Top-level property lookup for the properties every element carries.
     */
    public Object directProperty(String property) {
        return switch (property) {
            case "id" -> id;
            case "name" -> name;
            case "modelElementId", "type" -> modelElementId;
            default -> null;
        };
    }
}
