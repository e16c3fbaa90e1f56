/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.api;

import com.modelweave.expr.api.model.ConstraintOutcome;
import com.modelweave.expr.api.model.Metamodel;
import com.modelweave.expr.api.model.Model;
import com.modelweave.expr.api.model.ModelElement;
import com.modelweave.expr.api.model.ScriptConstraint;
import com.modelweave.expr.api.model.ScriptValidationResult;

/**
 * Contract for checking model elements against user-authored constraint scripts.
 *
 * <p>Scripts see a fixed set of free variables: {@code self}, {@code model},
 * {@code metamodel}, a whitelist of safe globals, the {@code findElementById} and
 * {@code findElementsByType} helpers, the lower-cased metaclass name bound to
 * {@code self}, and one variable per uniquely named model element.
 *
 * <p>No method throws past this interface: compile errors, runtime errors and
 * timeouts all become failing results.
 */
public interface IConstraintValidator {

    /**
     * Compiles the code without executing it.
     */
    ScriptValidationResult validateSyntax(String code);

    /**
     * Executes the code against one element.
     */
    ConstraintOutcome evaluate(String code, ModelElement element, Model model, Metamodel metamodel);

    /**
     * Checks one stored constraint against one element, producing report issues.
     */
    ScriptValidationResult evaluateConstraint(ScriptConstraint constraint, ModelElement element,
                                              Model model, Metamodel metamodel);
}
