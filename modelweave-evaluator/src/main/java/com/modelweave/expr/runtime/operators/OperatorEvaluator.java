/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.runtime.operators;

import com.modelweave.expr.api.model.Operator;

import java.util.logging.Logger;

import static com.modelweave.expr.runtime.operators.LooseValues.add;
import static com.modelweave.expr.runtime.operators.LooseValues.compare;
import static com.modelweave.expr.runtime.operators.LooseValues.looseEquals;
import static com.modelweave.expr.runtime.operators.LooseValues.normalize;
import static com.modelweave.expr.runtime.operators.LooseValues.toNumber;
import static com.modelweave.expr.runtime.operators.LooseValues.truthy;

/**
 * Applies one operator to two already evaluated operand values.
 *
 * <p>Logical operators follow value semantics here: {@code AND} yields the left
 * value when it is falsy and the right value otherwise, {@code OR} the reverse.
 * Short-circuiting belongs to compound nodes and is handled by the caller.
 */
public final class OperatorEvaluator {
    private static final Logger logger = Logger.getLogger(OperatorEvaluator.class.getName());

    /**
     * @return the result, or null for a missing operator
     */
    public Object apply(Operator operator, Object left, Object right) {
        if (operator == null) {
            logger.warning("Unsupported operator: null");
            return null;
        }
        switch (operator) {
            case ADD:
                return add(left, right);
            case SUBTRACT:
                return normalize(toNumber(left) - toNumber(right));
            case MULTIPLY:
                return normalize(toNumber(left) * toNumber(right));
            case DIVIDE:
                return normalize(toNumber(left) / toNumber(right));
            case INCREMENT:
                return add(left, 1L);
            case DECREMENT:
                return normalize(toNumber(left) - 1);
            case EQUALS:
                return looseEquals(left, right);
            case NOT_EQUALS:
                return !looseEquals(left, right);
            case GREATER_THAN: {
                Integer c = compare(left, right);
                return c != null && c > 0;
            }
            case LESS_THAN: {
                Integer c = compare(left, right);
                return c != null && c < 0;
            }
            case GREATER_EQUALS: {
                Integer c = compare(left, right);
                return c != null && c >= 0;
            }
            case LESS_EQUALS: {
                Integer c = compare(left, right);
                return c != null && c <= 0;
            }
            case AND:
                return truthy(left) ? right : left;
            case OR:
                return truthy(left) ? left : right;
            case NOT:
                return !truthy(left);
            default:
                logger.warning("Unsupported operator: " + operator);
                return null;
        }
    }
}
