/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.api;

import com.modelweave.expr.api.model.Expression;
import com.modelweave.expr.api.model.ParseContext;

/**
 * Contract for turning authored expression text into an {@link Expression} tree
 * and back.
 *
 * <h2>Accepted forms</h2>
 * <ul>
 *   <li>{@code Place.tokens} and {@code {arc.weight}} references</li>
 *   <li>{@code <left> increment|decrement|multiply|divide <right>}
 *       ({@code add}/{@code subtract} accepted as synonyms)</li>
 *   <li>{@code equals}, {@code not equals}, {@code greater than}, {@code less than},
 *       {@code greater than or equals}, {@code less than or equals}</li>
 *   <li>{@code <left> AND <right>}, {@code <left> OR <right>}</li>
 *   <li>parenthesized sub-expressions</li>
 * </ul>
 *
 * <p>The text form emitted by {@link #toText(Expression)} is a subset of the
 * accepted forms, so round trips preserve meaning rather than spelling.
 */
public interface IExpressionParser {

    /**
     * Parses expression text. Never throws.
     *
     * @param input   authored text (may be null)
     * @param context optional parse information
     * @return the parsed tree, or null when no rule structurally applies; callers
     *         then treat the raw text as a literal
     */
    Expression parse(String input, ParseContext context);

    default Expression parse(String input) {
        return parse(input, ParseContext.empty());
    }

    /**
     * Renders an expression in canonical text form.
     */
    String toText(Expression expression);
}
