/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.script.sandbox;

import com.modelweave.expr.api.model.MetaClass;
import com.modelweave.expr.api.model.Metamodel;
import com.modelweave.expr.api.model.Model;
import com.modelweave.expr.api.model.ModelElement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * The ordered set of free variables a constraint script can use.
 *
 * <p>Every name becomes one parameter of the compiled constraint function.
 * A name is bound to exactly one of:
 * <ul>
 *   <li>a data value ({@code self}, {@code model}, {@code metamodel} and one
 *       entry per uniquely named model element)</li>
 *   <li>an alias of another data value (the lowercased metaclass name of
 *       the element, aliasing {@code self})</li>
 *   <li>a whitelisted JavaScript global</li>
 *   <li>a model-access helper</li>
 * </ul>
 * Earlier bindings are never replaced by later ones.
 */
public final class SandboxBindings {
    private static final Logger logger = Logger.getLogger(SandboxBindings.class.getName());

    public static final List<String> SAFE_GLOBALS = List.of(
            "Math", "Date", "JSON", "String", "Number", "Array", "Object", "Boolean", "RegExp", "Error",
            "parseInt", "parseFloat", "isNaN", "isFinite",
            "decodeURI", "decodeURIComponent", "encodeURI", "encodeURIComponent");

    public static final List<String> HELPERS = List.of("findElementById", "findElementsByType");

    private static final Pattern IDENTIFIER = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");
    private static final Pattern INVALID_IDENTIFIER_CHARS = Pattern.compile("[^a-zA-Z0-9_]");

    // Names a strict-mode function cannot take as parameters.
    private static final Set<String> RESERVED = Set.of(
            "arguments", "eval", "break", "case", "catch", "class", "const", "continue", "debugger",
            "default", "delete", "do", "else", "enum", "export", "extends", "false", "finally", "for",
            "function", "if", "implements", "import", "in", "instanceof", "interface", "let", "new",
            "null", "package", "private", "protected", "public", "return", "static", "super", "switch",
            "this", "throw", "true", "try", "typeof", "var", "void", "while", "with", "yield", "await");

    private final List<String> names;
    private final Map<String, Object> values;
    private final Map<String, String> aliases;
    private final List<ModelElement> elements;

    private SandboxBindings(List<String> names, Map<String, Object> values,
                            Map<String, String> aliases, List<ModelElement> elements) {
        this.names = Collections.unmodifiableList(names);
        this.values = Collections.unmodifiableMap(values);
        this.aliases = Collections.unmodifiableMap(aliases);
        this.elements = List.copyOf(elements);
    }

    public static SandboxBindings build(Map<String, Object> context, ModelElement element,
                                        Model model, Metamodel metamodel) {
        List<String> names = new ArrayList<>();
        Map<String, Object> values = new LinkedHashMap<>();
        Map<String, String> aliases = new LinkedHashMap<>();

        for (Map.Entry<String, Object> entry : context.entrySet()) {
            names.add(entry.getKey());
            values.put(entry.getKey(), entry.getValue());
        }
        for (String global : SAFE_GLOBALS) {
            addName(names, global);
        }
        for (String helper : HELPERS) {
            addName(names, helper);
        }

        if (metamodel != null && element != null && context.containsKey(ScriptContextBuilder.SELF)) {
            metamodel.findClass(element.modelElementId())
                    .map(MetaClass::name)
                    .map(String::toLowerCase)
                    .filter(SandboxBindings::isUsableName)
                    .filter(alias -> !names.contains(alias))
                    .ifPresent(alias -> {
                        names.add(alias);
                        aliases.put(alias, ScriptContextBuilder.SELF);
                    });
        }

        List<ModelElement> elements = model == null ? List.of() : model.elements();
        for (ModelElement candidate : elements) {
            if (!(candidate.style().get("name") instanceof String rawName) || rawName.isBlank()) {
                continue;
            }
            String name = sanitize(rawName);
            if (isUsableName(name) && !names.contains(name)) {
                names.add(name);
                values.put(name, candidate);
            }
        }

        logger.fine(() -> "Sandbox bindings: " + names);
        return new SandboxBindings(names, values, aliases, elements);
    }

    /**
     * Trims the name and replaces every character outside {@code [a-zA-Z0-9_]}
     * with an underscore.
     */
    public static String sanitize(String rawName) {
        return INVALID_IDENTIFIER_CHARS.matcher(rawName.trim()).replaceAll("_");
    }

    static boolean isUsableName(String name) {
        return IDENTIFIER.matcher(name).matches() && !RESERVED.contains(name);
    }

    private static void addName(List<String> names, String name) {
        if (!names.contains(name)) {
            names.add(name);
        }
    }

    /**
     * Parameter names of the compiled constraint function, in order.
     */
    public List<String> names() {
        return names;
    }

    public Map<String, Object> values() {
        return values;
    }

    public Map<String, String> aliases() {
        return aliases;
    }

    /**
     * Raw model elements the helpers search.
     */
    public List<ModelElement> elements() {
        return elements;
    }

    public boolean contains(String name) {
        return names.contains(name);
    }
}
