/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.script.registry;

import com.modelweave.expr.api.IConstraintValidator;
import com.modelweave.expr.api.exceptions.ConstraintNotFoundException;
import com.modelweave.expr.api.model.MetaClass;
import com.modelweave.expr.api.model.Metamodel;
import com.modelweave.expr.api.model.ScriptConstraint;
import com.modelweave.expr.api.model.ScriptValidationResult;
import com.modelweave.expr.api.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Owns the script constraints of one metamodel.
 *
 * <p>The metamodel is immutable; every change publishes a new snapshot, so
 * readers always see a consistent set of constraints. Writers are
 * serialized.
 *
 * <p>Class constraints live on their {@link MetaClass}; global constraints
 * (no context class) live on the metamodel itself. Creating and updating
 * run the syntax probe and record the result on the constraint, so a
 * constraint that does not compile is stored but never executed.
 */
public class ConstraintRegistry {
    private static final Logger logger = Logger.getLogger(ConstraintRegistry.class.getName());

    public static final String DEFAULT_SYNTAX_MESSAGE = "Invalid JavaScript expression";

    private final IConstraintValidator validator;
    private final Supplier<String> idGenerator;
    private final AtomicReference<Metamodel> current;

    public ConstraintRegistry(Metamodel metamodel, IConstraintValidator validator) {
        this(metamodel, validator, () -> UUID.randomUUID().toString());
    }

    public ConstraintRegistry(Metamodel metamodel, IConstraintValidator validator, Supplier<String> idGenerator) {
        this.current = new AtomicReference<>(Objects.requireNonNull(metamodel, "metamodel must not be null"));
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator must not be null");
    }

    public Metamodel metamodel() {
        return current.get();
    }

    /**
     * Adds a constraint to a class, or to the metamodel when
     * {@code contextClassId} is null. A constraint with the same name in the
     * same scope is replaced.
     *
     * @throws IllegalArgumentException if the class does not exist or the
     *                                  definition has no name
     */
    public synchronized ScriptConstraint create(String contextClassId, ConstraintDefinition definition) {
        if (definition.name() == null || definition.name().isBlank()) {
            throw new IllegalArgumentException("Constraint name must not be blank");
        }
        Metamodel metamodel = current.get();
        String contextClassName = null;
        if (contextClassId != null) {
            contextClassName = metamodel.findClass(contextClassId)
                    .map(MetaClass::name)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown metaclass: " + contextClassId));
        }

        String expression = definition.expression() == null ? "" : definition.expression();
        ScriptConstraint constraint = probe(new ScriptConstraint(
                idGenerator.get(),
                definition.name(),
                contextClassId,
                contextClassName,
                expression,
                definition.description(),
                definition.severity() == null ? Severity.ERROR : definition.severity(),
                true,
                null));

        List<ScriptConstraint> scoped = new ArrayList<>(scope(metamodel, contextClassId));
        int existing = indexOfName(scoped, constraint.name());
        if (existing >= 0) {
            logger.info("Replacing constraint '" + constraint.name() + "' on " + describeScope(contextClassName));
            scoped.set(existing, constraint);
        } else {
            scoped.add(constraint);
        }
        current.set(withScope(metamodel, contextClassId, scoped));
        logger.fine(() -> "Created constraint " + constraint.id() + " valid=" + constraint.isValid());
        return constraint;
    }

    /**
     * Applies the non-null fields of the definition. The syntax probe runs
     * again only when the expression changes.
     *
     * @throws ConstraintNotFoundException if no constraint has that id
     */
    public synchronized ScriptConstraint update(String constraintId, ConstraintDefinition changes) {
        Metamodel metamodel = current.get();
        ScriptConstraint existing = find(constraintId)
                .orElseThrow(() -> new ConstraintNotFoundException("Constraint not found: " + constraintId));

        ScriptConstraint updated = new ScriptConstraint(
                existing.id(),
                changes.name() != null ? changes.name() : existing.name(),
                existing.contextClassId(),
                existing.contextClassName(),
                changes.expression() != null ? changes.expression() : existing.expression(),
                changes.description() != null ? changes.description() : existing.description(),
                changes.severity() != null ? changes.severity() : existing.severity(),
                existing.isValid(),
                existing.errorMessage());
        if (changes.expression() != null) {
            updated = probe(updated);
        }

        List<ScriptConstraint> scoped = new ArrayList<>(scope(metamodel, existing.contextClassId()));
        scoped.set(indexOfId(scoped, constraintId), updated);
        current.set(withScope(metamodel, existing.contextClassId(), scoped));
        return updated;
    }

    /**
     * @throws ConstraintNotFoundException if no constraint has that id
     */
    public synchronized void delete(String constraintId) {
        Metamodel metamodel = current.get();
        ScriptConstraint existing = find(constraintId)
                .orElseThrow(() -> new ConstraintNotFoundException("Constraint not found: " + constraintId));
        List<ScriptConstraint> scoped = new ArrayList<>(scope(metamodel, existing.contextClassId()));
        scoped.remove(indexOfId(scoped, constraintId));
        current.set(withScope(metamodel, existing.contextClassId(), scoped));
        logger.info("Deleted constraint " + constraintId);
    }

    /**
     * @throws IllegalArgumentException if the class does not exist
     */
    public List<ScriptConstraint> listForMetaClass(String classId) {
        return current.get().findClass(classId)
                .map(MetaClass::constraints)
                .orElseThrow(() -> new IllegalArgumentException("Unknown metaclass: " + classId));
    }

    public List<ScriptConstraint> listGlobal() {
        return current.get().constraints();
    }

    /**
     * Class constraints in class order, then global constraints.
     */
    public List<ScriptConstraint> listAll() {
        Metamodel metamodel = current.get();
        List<ScriptConstraint> all = new ArrayList<>();
        for (MetaClass metaClass : metamodel.classes()) {
            all.addAll(metaClass.constraints());
        }
        all.addAll(metamodel.constraints());
        return all;
    }

    public Optional<ScriptConstraint> find(String constraintId) {
        return listAll().stream().filter(c -> c.id().equals(constraintId)).findFirst();
    }

    private ScriptConstraint probe(ScriptConstraint constraint) {
        ScriptValidationResult result = validator.validateSyntax(constraint.expression());
        if (result.valid()) {
            return constraint.withSyntaxStatus(true, null);
        }
        String message = result.firstMessage();
        return constraint.withSyntaxStatus(false, message == null ? DEFAULT_SYNTAX_MESSAGE : message);
    }

    private static List<ScriptConstraint> scope(Metamodel metamodel, String contextClassId) {
        if (contextClassId == null) {
            return metamodel.constraints();
        }
        return metamodel.findClass(contextClassId)
                .map(MetaClass::constraints)
                .orElseThrow(() -> new IllegalArgumentException("Unknown metaclass: " + contextClassId));
    }

    private static Metamodel withScope(Metamodel metamodel, String contextClassId, List<ScriptConstraint> constraints) {
        if (contextClassId == null) {
            return metamodel.withConstraints(constraints);
        }
        List<MetaClass> classes = new ArrayList<>();
        for (MetaClass metaClass : metamodel.classes()) {
            classes.add(metaClass.id().equals(contextClassId) ? metaClass.withConstraints(constraints) : metaClass);
        }
        return metamodel.withClasses(classes);
    }

    private static int indexOfName(List<ScriptConstraint> constraints, String name) {
        for (int i = 0; i < constraints.size(); i++) {
            if (constraints.get(i).name().equals(name)) return i;
        }
        return -1;
    }

    private static int indexOfId(List<ScriptConstraint> constraints, String id) {
        for (int i = 0; i < constraints.size(); i++) {
            if (constraints.get(i).id().equals(id)) return i;
        }
        throw new ConstraintNotFoundException("Constraint not found: " + id);
    }

    private static String describeScope(String contextClassName) {
        return contextClassName == null ? "metamodel" : "class " + contextClassName;
    }
}
