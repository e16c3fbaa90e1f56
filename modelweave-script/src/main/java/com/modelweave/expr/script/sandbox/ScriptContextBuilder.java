/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.script.sandbox;

import com.modelweave.expr.api.model.Metamodel;
import com.modelweave.expr.api.model.Model;
import com.modelweave.expr.api.model.ModelElement;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the plain data a constraint script sees as {@code self},
 * {@code model} and {@code metamodel}.
 *
 * <p>{@code self} is the element's style map with {@code id} and {@code type}
 * set on top; each outgoing reference is replaced by the referenced
 * element's map (or a list of them for multi-valued references). Ids that
 * do not resolve in the model are dropped. Only one level is expanded.
 */
public class ScriptContextBuilder {

    public static final String SELF = "self";
    public static final String MODEL = "model";
    public static final String METAMODEL = "metamodel";

    public Map<String, Object> build(ModelElement element, Model model, Metamodel metamodel) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put(SELF, selfView(element, model));
        context.put(MODEL, modelView(model));
        context.put(METAMODEL, metamodelView(metamodel));
        return context;
    }

    Map<String, Object> selfView(ModelElement element, Model model) {
        Map<String, Object> self = elementView(element);
        for (Map.Entry<String, Object> reference : element.references().entrySet()) {
            Object target = reference.getValue();
            if (target instanceof List<?> ids) {
                List<Map<String, Object>> resolved = new ArrayList<>();
                for (Object id : ids) {
                    find(model, id).ifPresent(found -> resolved.add(elementView(found)));
                }
                self.put(reference.getKey(), resolved);
            } else if (target instanceof String id) {
                find(model, id).ifPresent(found -> self.put(reference.getKey(), elementView(found)));
            }
        }
        return self;
    }

    Map<String, Object> modelView(Model model) {
        Map<String, Object> view = new LinkedHashMap<>();
        if (model == null) {
            view.put("elements", List.of());
            return view;
        }
        view.put("id", model.id());
        view.put("name", model.name());
        List<Map<String, Object>> elements = new ArrayList<>();
        for (ModelElement element : model.elements()) {
            // style entries win over id and type here
            Map<String, Object> flattened = new LinkedHashMap<>();
            flattened.put("id", element.id());
            flattened.put("type", element.modelElementId());
            flattened.putAll(element.style());
            elements.add(flattened);
        }
        view.put("elements", elements);
        return view;
    }

    Map<String, Object> metamodelView(Metamodel metamodel) {
        Map<String, Object> view = new LinkedHashMap<>();
        if (metamodel != null) {
            view.put("id", metamodel.id());
            view.put("name", metamodel.name());
        }
        return view;
    }

    private static Map<String, Object> elementView(ModelElement element) {
        Map<String, Object> view = new LinkedHashMap<>(element.style());
        view.put("id", element.id());
        view.put("type", element.modelElementId());
        return view;
    }

    private static Optional<ModelElement> find(Model model, Object id) {
        if (model == null || !(id instanceof String elementId)) {
            return Optional.empty();
        }
        return model.findElement(elementId);
    }
}
