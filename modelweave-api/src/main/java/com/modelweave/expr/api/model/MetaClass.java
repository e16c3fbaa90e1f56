/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Metaclass of a metamodel, together with the script constraints scoped to it.
 */
public record MetaClass(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("attributes") List<MetaAttribute> attributes,
        @JsonProperty("references") List<MetaReference> references,
        @JsonProperty("constraints") List<ScriptConstraint> constraints
) {

    public MetaClass {
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
        references = references == null ? List.of() : List.copyOf(references);
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
    }

    public MetaClass(String id, String name, List<MetaAttribute> attributes) {
        this(id, name, attributes, List.of(), List.of());
    }

    public Optional<MetaAttribute> findAttributeByName(String attributeName) {
        return attributes.stream().filter(a -> a.name().equals(attributeName)).findFirst();
    }

    public MetaClass withConstraints(List<ScriptConstraint> newConstraints) {
        return new MetaClass(id, name, attributes, references, newConstraints);
    }
}
