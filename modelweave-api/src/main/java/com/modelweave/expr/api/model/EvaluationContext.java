/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.api.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of everything a reference may resolve against during one evaluation.
 *
 * <p>Every part is optional; the resolver tries the parts in a fixed order and
 * stops at the first hit. The context is never mutated by evaluation.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * EvaluationContext context = EvaluationContext.builder()
 *     .patternMatch(match)
 *     .patternElements(lhs.elements())
 *     .modelElement("pe-place", placeElement)
 *     .allModelElements(model.elements())
 *     .build();
 * }</pre>
 *
 * @param patternMatch       binding of pattern element ids to model element ids
 * @param patternElements    pattern elements by id
 * @param modelElements      matched model elements, keyed by pattern element id
 * @param allPatternElements every pattern element of the rule (last-resort scan)
 * @param allModelElements   every element of the model (last-resort scan)
 * @param metaClasses        metaclasses by id, used to canonicalize attribute keys
 */
public record EvaluationContext(
        PatternMatch patternMatch,
        Map<String, PatternElement> patternElements,
        Map<String, ModelElement> modelElements,
        List<PatternElement> allPatternElements,
        List<ModelElement> allModelElements,
        Map<String, MetaClass> metaClasses
) {

    private static final EvaluationContext EMPTY = builder().build();

    public EvaluationContext {
        patternElements = patternElements == null ? Map.of() : Map.copyOf(patternElements);
        modelElements = modelElements == null ? Map.of() : Map.copyOf(modelElements);
        allPatternElements = allPatternElements == null ? List.of() : List.copyOf(allPatternElements);
        allModelElements = allModelElements == null ? List.of() : List.copyOf(allModelElements);
        metaClasses = metaClasses == null ? Map.of() : Map.copyOf(metaClasses);
    }

    public static EvaluationContext empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<PatternMatch> match() {
        return Optional.ofNullable(patternMatch);
    }

    public Optional<MetaClass> metaClass(String metaClassId) {
        return metaClassId == null ? Optional.empty() : Optional.ofNullable(metaClasses.get(metaClassId));
    }

    public static final class Builder {
        private PatternMatch patternMatch;
        private final Map<String, PatternElement> patternElements = new LinkedHashMap<>();
        private final Map<String, ModelElement> modelElements = new LinkedHashMap<>();
        private final List<PatternElement> allPatternElements = new ArrayList<>();
        private final List<ModelElement> allModelElements = new ArrayList<>();
        private final Map<String, MetaClass> metaClasses = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder patternMatch(PatternMatch match) {
            this.patternMatch = match;
            return this;
        }

        /**
         * Indexes the given pattern elements by id.
         */
        public Builder patternElements(List<PatternElement> elements) {
            elements.forEach(e -> patternElements.put(e.id(), e));
            return this;
        }

        public Builder patternElement(PatternElement element) {
            patternElements.put(element.id(), element);
            return this;
        }

        /**
         * Registers a matched model element under the id of the pattern element it is bound to.
         */
        public Builder modelElement(String patternElementId, ModelElement element) {
            modelElements.put(patternElementId, element);
            return this;
        }

        public Builder modelElements(Map<String, ModelElement> elements) {
            modelElements.putAll(elements);
            return this;
        }

        public Builder allPatternElements(List<PatternElement> elements) {
            allPatternElements.addAll(elements);
            return this;
        }

        public Builder allModelElements(List<ModelElement> elements) {
            allModelElements.addAll(elements);
            return this;
        }

        public Builder metaClasses(List<MetaClass> classes) {
            classes.forEach(c -> metaClasses.put(c.id(), c));
            return this;
        }

        public EvaluationContext build() {
            return new EvaluationContext(patternMatch, patternElements, modelElements,
                    allPatternElements, allModelElements, metaClasses);
        }
    }
}
