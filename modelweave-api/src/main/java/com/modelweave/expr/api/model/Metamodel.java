/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * A metamodel: metaclasses plus metamodel-wide (global) script constraints.
 */
public record Metamodel(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("classes") List<MetaClass> classes,
        @JsonProperty("constraints") List<ScriptConstraint> constraints
) {

    public Metamodel {
        classes = classes == null ? List.of() : List.copyOf(classes);
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
    }

    public Metamodel(String id, String name, List<MetaClass> classes) {
        this(id, name, classes, List.of());
    }

    public Optional<MetaClass> findClass(String classId) {
        return classes.stream().filter(c -> c.id().equals(classId)).findFirst();
    }

    public Metamodel withClasses(List<MetaClass> newClasses) {
        return new Metamodel(id, name, newClasses, constraints);
    }

    public Metamodel withConstraints(List<ScriptConstraint> newConstraints) {
        return new Metamodel(id, name, classes, newConstraints);
    }
}
