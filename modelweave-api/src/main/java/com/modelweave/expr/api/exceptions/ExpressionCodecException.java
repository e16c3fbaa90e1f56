/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.api.exceptions;

/**
 * Thrown when persisted expression JSON cannot be read or written.
 *
 * This is a RuntimeException so codec callers are not forced into checked
 * exception handling; evaluation entry points never raise it.
 */
public class ExpressionCodecException extends RuntimeException {

    public ExpressionCodecException(String message) {
        super(message);
    }

    public ExpressionCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
