/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.api.model;

/**
 * Outcome of executing a constraint script: {@link Pass} or {@link Fail}.
 */
public sealed interface ConstraintOutcome permits ConstraintOutcome.Pass, ConstraintOutcome.Fail {

    String DEFAULT_FAILURE_MESSAGE = "Constraint failed";

    boolean valid();

    /**
     * Failure message, or null for {@link Pass}.
     */
    String message();

    static ConstraintOutcome pass() {
        return Pass.INSTANCE;
    }

    static ConstraintOutcome fail(String message) {
        return new Fail(message == null || message.isEmpty() ? DEFAULT_FAILURE_MESSAGE : message);
    }

    record Pass() implements ConstraintOutcome {
        static final Pass INSTANCE = new Pass();

        @Override
        public boolean valid() {
            return true;
        }

        @Override
        public String message() {
            return null;
        }
    }

    record Fail(String message) implements ConstraintOutcome {
        @Override
        public boolean valid() {
            return false;
        }
    }
}
