/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.api.exceptions;

/**
 * Thrown by constraint management operations for an unknown metamodel,
 * metaclass or constraint id.
 */
public class ConstraintNotFoundException extends RuntimeException {

    public ConstraintNotFoundException(String message) {
        super(message);
    }
}
