/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.runtime.resolution;

import com.modelweave.expr.api.model.ElementReference;
import com.modelweave.expr.api.model.EvaluationContext;
import com.modelweave.expr.api.model.MetaClass;
import com.modelweave.expr.api.model.ModelElement;
import com.modelweave.expr.api.model.PatternElement;
import com.modelweave.expr.api.model.PatternMatch;

import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves {@code element.attribute} references against an {@link EvaluationContext}.
 *
 * <p>Strategies are tried in order and the first hit wins:
 * <ol>
 *   <li>pattern element with that name: its own attribute value</li>
 *   <li>the model element matched to that pattern element: style value, then
 *       direct property</li>
 *   <li>matched model element whose display name is the element name</li>
 *   <li>element name used as a pattern element id of the match</li>
 *   <li>name scan over all pattern elements, then all model elements</li>
 * </ol>
 * A miss is not an error: it is logged and resolves to null.
 *
 * <p>Stateless and thread-safe.
 */
public class ReferenceResolver {
    private static final Logger logger = Logger.getLogger(ReferenceResolver.class.getName());

    /**
     * @return the attribute value, or null when nothing matches or the context
     * holds data that cannot be read
     */
    public Object resolve(ElementReference reference, EvaluationContext context) {
        try {
            return resolveInOrder(reference, context);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to resolve reference to " + reference.dotted(), e);
            return null;
        }
    }

    private Object resolveInOrder(ElementReference reference, EvaluationContext context) {
        String elementName = reference.elementName();
        String attributeName = reference.attributeName();

        String patternElementId = findPatternElementId(elementName, context.patternElements());
        if (patternElementId != null) {
            PatternElement patternElement = context.patternElements().get(patternElementId);
            Object value = patternTable(patternElement, context).lookup(attributeName);
            if (value != null) {
                logger.fine(() -> "Resolved " + reference.dotted() + " on pattern element " + patternElementId);
                return value;
            }
        }

        PatternMatch match = context.patternMatch();
        Map<String, ModelElement> modelElements = context.modelElements();

        if (match != null && patternElementId != null && !modelElements.isEmpty()) {
            Object value = readMatched(patternElementId, match, attributeName, context);
            if (value != null) {
                logger.fine(() -> "Resolved " + reference.dotted() + " through match of " + patternElementId);
                return value;
            }
        }

        for (ModelElement element : modelElements.values()) {
            Object value = readNamedElement(element, elementName, attributeName, context);
            if (value != null) {
                logger.fine(() -> "Resolved " + reference.dotted() + " on matched element " + element.id());
                return value;
            }
        }

        if (match != null && match.matches().containsKey(elementName)) {
            Object value = readMatched(elementName, match, attributeName, context);
            if (value != null) {
                logger.fine(() -> "Resolved " + reference.dotted() + " using the name as pattern element id");
                return value;
            }
        }

        for (PatternElement patternElement : context.allPatternElements()) {
            if (elementName.equals(patternElement.name())) {
                Object value = patternTable(patternElement, context).lookup(attributeName);
                if (value != null) {
                    logger.fine(() -> "Resolved " + reference.dotted() + " by scanning pattern elements");
                    return value;
                }
                break;
            }
        }

        for (ModelElement element : context.allModelElements()) {
            if (elementName.equals(element.name()) || elementName.equals(element.displayName())) {
                Object value = readModelElement(element, attributeName, context);
                if (value != null) {
                    logger.fine(() -> "Resolved " + reference.dotted() + " by scanning model elements");
                    return value;
                }
                break;
            }
        }

        logger.warning("Could not resolve reference to " + reference.dotted());
        return null;
    }

    private static String findPatternElementId(String elementName, Map<String, PatternElement> patternElements) {
        for (Map.Entry<String, PatternElement> entry : patternElements.entrySet()) {
            if (elementName.equals(entry.getValue().name())) {
                return entry.getKey();
            }
        }
        return null;
    }

    private Object readMatched(String patternElementId, PatternMatch match, String attributeName,
                               EvaluationContext context) {
        String modelElementId = match.matches().get(patternElementId);
        if (modelElementId == null) {
            return null;
        }
        ModelElement element = context.modelElements().get(patternElementId);
        if (element == null) {
            element = context.modelElements().get(modelElementId);
        }
        return element == null ? null : readModelElement(element, attributeName, context);
    }

    private Object readNamedElement(ModelElement element, String elementName, String attributeName,
                                    EvaluationContext context) {
        MetaClass metaClass = context.metaClass(element.modelElementId()).orElse(null);
        if (elementName.equals(element.style().get("name"))) {
            Object value = AttributeTable.of(element.style(), metaClass).lookup(attributeName);
            if (value != null) return value;
        }
        if (elementName.equals(element.attributes().get("name"))) {
            return AttributeTable.of(element.attributes(), metaClass).lookup(attributeName);
        }
        return null;
    }

    private Object readModelElement(ModelElement element, String attributeName, EvaluationContext context) {
        MetaClass metaClass = context.metaClass(element.modelElementId()).orElse(null);
        Object value = AttributeTable.of(element.style(), metaClass).lookup(attributeName);
        if (value == null) {
            value = AttributeTable.of(element.attributes(), metaClass).lookup(attributeName);
        }
        return value != null ? value : element.directProperty(attributeName);
    }

    private static AttributeTable patternTable(PatternElement element, EvaluationContext context) {
        return AttributeTable.of(element.attributes(), context.metaClass(element.type()).orElse(null));
    }
}
