/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * A user model: a flat list of elements conforming to a metamodel.
 */
public record Model(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("metamodelId") String metamodelId,
        @JsonProperty("elements") List<ModelElement> elements
) {

    public Model {
        elements = elements == null ? List.of() : List.copyOf(elements);
    }

    public Optional<ModelElement> findElement(String elementId) {
        return elements.stream().filter(e -> e.id().equals(elementId)).findFirst();
    }
}
