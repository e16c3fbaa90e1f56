/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.script.validation;

import com.modelweave.expr.api.IConstraintValidator;
import com.modelweave.expr.api.model.MetaClass;
import com.modelweave.expr.api.model.Metamodel;
import com.modelweave.expr.api.model.Model;
import com.modelweave.expr.api.model.ModelElement;
import com.modelweave.expr.api.model.ScriptConstraint;
import com.modelweave.expr.api.model.ScriptValidationResult;
import com.modelweave.expr.api.model.Severity;
import com.modelweave.expr.api.model.ValidationIssue;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Checks every element of a model against the script constraints that
 * apply to it: those of its metaclass followed by the metamodel's global
 * constraints.
 *
 * <p>A failure on one element or constraint is reported as an issue and
 * the pass continues with the next one.
 */
public class ModelValidator {
    private static final Logger logger = Logger.getLogger(ModelValidator.class.getName());

    private final IConstraintValidator validator;
    private final Tracer tracer;

    public ModelValidator(IConstraintValidator validator, Tracer tracer) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
    }

    public ModelValidator(IConstraintValidator validator) {
        this(validator, OpenTelemetry.noop().getTracer("modelweave-script"));
    }

    public List<ValidationIssue> validate(Model model, Metamodel metamodel) {
        Span span = tracer.spanBuilder("validate-model").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("modelId", String.valueOf(model.id()));
            span.setAttribute("elementCount", model.elements().size());

            List<ValidationIssue> issues = new ArrayList<>();
            int checked = 0;
            for (ModelElement element : model.elements()) {
                List<ScriptConstraint> constraints;
                try {
                    constraints = applicableConstraints(element, metamodel);
                } catch (RuntimeException e) {
                    logger.log(Level.WARNING, "Could not collect constraints for element " + element.id(), e);
                    issues.add(new ValidationIssue(Severity.ERROR,
                            "Error collecting constraints for element " + element.id() + ": " + e.getMessage(),
                            element.id(), null, null));
                    continue;
                }
                for (ScriptConstraint constraint : constraints) {
                    checked++;
                    issues.addAll(check(constraint, element, model, metamodel));
                }
            }

            span.setAttribute("constraintCount", checked);
            span.setAttribute("issueCount", issues.size());
            logger.info("Validated model " + model.id() + ": " + checked + " constraint checks, "
                    + issues.size() + " issues");
            return issues;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    static List<ScriptConstraint> applicableConstraints(ModelElement element, Metamodel metamodel) {
        List<ScriptConstraint> applicable = new ArrayList<>();
        if (metamodel == null) {
            return applicable;
        }
        metamodel.findClass(element.modelElementId())
                .map(MetaClass::constraints)
                .ifPresent(applicable::addAll);
        applicable.addAll(metamodel.constraints());
        return applicable;
    }

    private List<ValidationIssue> check(ScriptConstraint constraint, ModelElement element,
                                        Model model, Metamodel metamodel) {
        try {
            ScriptValidationResult result = validator.evaluateConstraint(constraint, element, model, metamodel);
            return result.issues();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Constraint " + constraint.id() + " failed on element " + element.id(), e);
            return List.of(new ValidationIssue(
                    constraint.severity() == null ? Severity.ERROR : constraint.severity(),
                    "Error evaluating constraint \"" + constraint.name() + "\": " + e.getMessage(),
                    element.id(),
                    constraint.id(),
                    constraint.expression()));
        }
    }
}
