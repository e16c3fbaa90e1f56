/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Textual pointer to an attribute of a named element, e.g. {@code arc.weight}.
 * It is resolved only at evaluation time.
 */
public record ElementReference(
        @JsonProperty("elementName") String elementName,
        @JsonProperty("attributeName") String attributeName
) {

    public ElementReference {
        Objects.requireNonNull(elementName, "elementName cannot be null");
        Objects.requireNonNull(attributeName, "attributeName cannot be null");
    }

    /**
     * Returns the {@code element.attribute} form.
     */
    public String dotted() {
        return elementName + "." + attributeName;
    }
}
