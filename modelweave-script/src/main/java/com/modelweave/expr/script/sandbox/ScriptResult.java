/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.script.sandbox;

/**
 * What a constraint function returned, described by the sandbox itself.
 *
 * @param type     {@code typeof} the value, or {@code "null"}
 * @param text     {@code String(value)}
 * @param hasValid whether the value is an object carrying a {@code valid} property
 * @param valid    whether that property is exactly {@code true}
 * @param message  the object's {@code message} property as text, if present
 */
public record ScriptResult(String type, String text, boolean hasValid, boolean valid, String message) {

    public static ScriptResult ofBoolean(boolean value) {
        return new ScriptResult("boolean", String.valueOf(value), false, false, null);
    }

    public static ScriptResult undefined() {
        return new ScriptResult("undefined", "undefined", false, false, null);
    }

    public static ScriptResult ofObject(boolean valid, String message) {
        return new ScriptResult("object", "[object Object]", true, valid, message);
    }
}
