/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.runtime.resolution;

import com.modelweave.expr.api.model.MetaAttribute;
import com.modelweave.expr.api.model.MetaClass;

import java.util.HashMap;
import java.util.Map;

/**
 * Canonical view of one element's attribute values.
 *
 * <p>Editors have stored the same attribute under its metaclass attribute id,
 * under its plain name and under the legacy {@code attr-<name>} key. The table
 * folds all of them into one map keyed by attribute id, resolving names to ids
 * once against the owning metaclass. Without a metaclass the plain name is the
 * key. A plain key wins over its legacy variant.
 */
public final class AttributeTable {

    static final String LEGACY_PREFIX = "attr-";

    private static final AttributeTable EMPTY = new AttributeTable(Map.of(), Map.of());

    private final Map<String, Object> valuesById;
    private final Map<String, String> idsByName;

    private AttributeTable(Map<String, Object> valuesById, Map<String, String> idsByName) {
        this.valuesById = valuesById;
        this.idsByName = idsByName;
    }

    public static AttributeTable empty() {
        return EMPTY;
    }

    /**
     * @param raw       attribute map as stored on the element (may be null)
     * @param metaClass owning metaclass, or null when unknown
     */
    public static AttributeTable of(Map<String, Object> raw, MetaClass metaClass) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        Map<String, String> idsByName = new HashMap<>();
        Map<String, String> knownIds = new HashMap<>();
        if (metaClass != null) {
            for (MetaAttribute attribute : metaClass.attributes()) {
                idsByName.put(attribute.name(), attribute.id());
                knownIds.put(attribute.id(), attribute.id());
            }
        }

        Map<String, Object> values = new HashMap<>();
        // Plain and id keys first so they take precedence over legacy keys.
        raw.forEach((key, value) -> {
            if (value != null && !isLegacy(key, knownIds)) {
                values.put(canonicalKey(key, idsByName, knownIds), value);
            }
        });
        raw.forEach((key, value) -> {
            if (value != null && isLegacy(key, knownIds)) {
                String name = key.substring(LEGACY_PREFIX.length());
                values.putIfAbsent(canonicalKey(name, idsByName, knownIds), value);
            }
        });
        return new AttributeTable(values, idsByName);
    }

    /**
     * Looks an attribute up by name or by id.
     *
     * @return the stored value, or null when absent
     */
    public Object lookup(String attributeName) {
        String id = idsByName.getOrDefault(attributeName, attributeName);
        Object value = valuesById.get(id);
        return value != null ? value : valuesById.get(attributeName);
    }

    public boolean contains(String attributeName) {
        return lookup(attributeName) != null;
    }

    public int size() {
        return valuesById.size();
    }

    private static boolean isLegacy(String key, Map<String, String> knownIds) {
        return key.startsWith(LEGACY_PREFIX) && !knownIds.containsKey(key);
    }

    private static String canonicalKey(String key, Map<String, String> idsByName, Map<String, String> knownIds) {
        if (knownIds.containsKey(key)) return key;
        return idsByName.getOrDefault(key, key);
    }
}
