/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.script.sandbox;

import com.modelweave.expr.api.model.ConstraintOutcome;

/**
 * Maps a constraint function's return value to an outcome:
 * {@code true} and {@code undefined} pass, {@code false} fails with the
 * default message, an object with a {@code valid} property passes only when
 * it is {@code true} and otherwise fails with the object's {@code message}.
 * Anything else fails with a message naming the value.
 */
public final class ScriptResultInterpreter {

    public static final String INVALID_RESULT_PREFIX = "Constraint returned an invalid result: ";

    private ScriptResultInterpreter() {
    }

    public static ConstraintOutcome interpret(ScriptResult result) {
        if (result == null || "undefined".equals(result.type())) {
            return ConstraintOutcome.pass();
        }
        if ("boolean".equals(result.type())) {
            return "true".equals(result.text())
                    ? ConstraintOutcome.pass()
                    : ConstraintOutcome.fail(ConstraintOutcome.DEFAULT_FAILURE_MESSAGE);
        }
        if (result.hasValid()) {
            return result.valid() ? ConstraintOutcome.pass() : ConstraintOutcome.fail(result.message());
        }
        return ConstraintOutcome.fail(INVALID_RESULT_PREFIX + result.text());
    }
}
