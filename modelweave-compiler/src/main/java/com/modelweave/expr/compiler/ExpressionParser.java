/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.compiler;

import com.modelweave.expr.api.IExpressionParser;
import com.modelweave.expr.api.model.ElementReference;
import com.modelweave.expr.api.model.Expression;
import com.modelweave.expr.api.model.Operation;
import com.modelweave.expr.api.model.Operator;
import com.modelweave.expr.api.model.ParseContext;
import com.modelweave.expr.api.model.PatternElement;
import com.modelweave.expr.api.model.Reference;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses authored expression text into an {@link Expression} tree.
 *
 * <p>Recognition runs in a fixed priority order and the first rule that applies
 * wins:
 * <ol>
 *   <li>direct dotted reference, optionally followed by an arithmetic keyword and
 *       a right-hand operand ({@code Place.tokens decrement 1})</li>
 *   <li>braced references ({@code {arc.weight}}); a list of braced references
 *       becomes one multi-reference node</li>
 *   <li>parenthesized sub-expressions, innermost first</li>
 *   <li>arithmetic keywords: {@code increment|add}, {@code decrement|subtract},
 *       {@code multiply}, {@code divide}</li>
 *   <li>comparison keywords, longest spelling first</li>
 *   <li>{@code AND} / {@code OR}, case-insensitive, splitting on the last
 *       occurrence</li>
 *   <li>a leading {@code NOT}, upper case only</li>
 *   <li>{@code true} and {@code false} are boolean literals, anything else is
 *       a string literal</li>
 * </ol>
 *
 * <p>Braced references embedded in a keyword form ({@code {a.b} increment 2})
 * are split structurally by rules 3-6 so that serializer output re-parses to
 * the same tree. Only when no keyword form applies does the legacy inference of
 * rule 2 run, which anchors an operation on the first reference.
 *
 * <p>Parsing never throws. Unknown element names are logged when the context
 * lists the available elements; resolving them is left to evaluation.
 *
 * <p>Thread-safe: all per-call state lives in a {@link ParseState}.
 */
public class ExpressionParser implements IExpressionParser {
    private static final Logger logger = Logger.getLogger(ExpressionParser.class.getName());

    private static final String IDENTIFIER = "[A-Za-z_][A-Za-z0-9_]*";
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.DOTALL;

    private static final Pattern DIRECT_REFERENCE =
            Pattern.compile("^(" + IDENTIFIER + ")\\.(" + IDENTIFIER + ")(?:\\s+|$)");
    private static final Pattern DIRECT_OPERATION = Pattern.compile(
            "^(" + IDENTIFIER + ")\\.(" + IDENTIFIER + ")\\s+(increment|decrement|multiply|divide|add|subtract)\\s+(.+)$",
            FLAGS);
    private static final Pattern BRACED = Pattern.compile("\\{([^{}]+)\\}");
    private static final Pattern BRACED_LIST = Pattern.compile("^\\{[^{}]+\\}(?:\\s*,?\\s*\\{[^{}]+\\})*$");
    private static final Pattern INNERMOST_PARENS = Pattern.compile("\\(([^()]*)\\)");
    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\s*(-?\\d+(?:\\.\\d+)?)");
    private static final Pattern NEGATION = Pattern.compile("^NOT\\s+(.+)$", Pattern.DOTALL);

    private static final List<KeywordRule> ARITHMETIC_RULES = List.of(
            KeywordRule.of(Operator.ADD, "increment|add"),
            KeywordRule.of(Operator.SUBTRACT, "decrement|subtract"),
            KeywordRule.of(Operator.MULTIPLY, "multiply"),
            KeywordRule.of(Operator.DIVIDE, "divide"));

    // Longer spellings first, "not equals" would otherwise split as "equals".
    private static final List<KeywordRule> COMPARISON_RULES = List.of(
            KeywordRule.of(Operator.NOT_EQUALS, "not\\s+equals"),
            KeywordRule.of(Operator.GREATER_EQUALS, "greater\\s+than\\s+or\\s+equals"),
            KeywordRule.of(Operator.LESS_EQUALS, "less\\s+than\\s+or\\s+equals"),
            KeywordRule.of(Operator.EQUALS, "equals"),
            KeywordRule.of(Operator.GREATER_THAN, "greater\\s+than"),
            KeywordRule.of(Operator.LESS_THAN, "less\\s+than"));

    private static final List<KeywordRule> LOGICAL_RULES = List.of(
            KeywordRule.of(Operator.AND, "AND"),
            KeywordRule.of(Operator.OR, "OR"));

    private final ExpressionSerializer serializer;

    public ExpressionParser() {
        this(new ExpressionSerializer());
    }

    public ExpressionParser(ExpressionSerializer serializer) {
        this.serializer = serializer;
    }

    @Override
    public Expression parse(String input, ParseContext context) {
        if (input == null || input.isBlank()) {
            return null;
        }
        ParseState state = new ParseState(context == null ? ParseContext.empty() : context);
        try {
            return parseText(input, state);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to parse expression '" + input + "'", e);
            return null;
        }
    }

    @Override
    public String toText(Expression expression) {
        return serializer.toText(expression);
    }

    private Expression parseText(String text, ParseState state) {
        String input = text.trim();
        if (input.isEmpty()) {
            return null;
        }

        Expression bound = state.take(input);
        if (bound != null) {
            return bound;
        }

        Expression direct = parseDirectReference(input, state);
        if (direct != null) {
            return direct;
        }

        if (BRACED.matcher(input).find()) {
            return parseBraced(input, state);
        }

        Expression structural = parseStructural(input, state);
        if (structural != null) {
            return structural;
        }

        return literal(state.restore(input));
    }

    private static Expression literal(String text) {
        if ("true".equals(text) || "false".equals(text)) {
            return Expression.literal(Boolean.valueOf(text));
        }
        return Expression.literal(text);
    }

    private Expression parseDirectReference(String input, ParseState state) {
        Matcher direct = DIRECT_REFERENCE.matcher(input);
        if (!direct.find()) {
            return null;
        }
        String elementName = direct.group(1);
        String attributeName = direct.group(2);

        if (input.equals(elementName + "." + attributeName)) {
            warnIfUnknown(elementName, state);
            return Expression.reference(elementName, attributeName);
        }

        Matcher operation = DIRECT_OPERATION.matcher(input);
        if (!operation.matches()) {
            return null;
        }
        warnIfUnknown(elementName, state);
        Operator operator = arithmeticOperator(operation.group(3));
        Expression right = parseText(operation.group(4), state);
        logger.fine(() -> "Parsed direct reference operation " + elementName + "." + attributeName + " " + operator);
        return Operation.of(operator, Expression.reference(elementName, attributeName), right);
    }

    private Expression parseBraced(String input, ParseState state) {
        boolean referenceList = BRACED_LIST.matcher(input).matches();
        if (!referenceList) {
            Expression structural = parseStructural(input, state);
            if (structural != null) {
                return structural;
            }
        }

        List<String> tokens = new ArrayList<>();
        Matcher matcher = BRACED.matcher(input);
        while (matcher.find()) {
            tokens.add(matcher.group(1));
        }

        if (tokens.size() == 1) {
            ElementReference reference = toReference(tokens.get(0));
            if (reference == null) {
                logger.warning("Invalid reference format '{" + tokens.get(0)
                        + "}'. Must be {elementName.attributeName}");
                return null;
            }
            warnIfUnknown(reference.elementName(), state);
            return new Reference(List.of(reference), false);
        }

        List<ElementReference> references = new ArrayList<>();
        for (String token : tokens) {
            ElementReference reference = toReference(token);
            if (reference != null) {
                warnIfUnknown(reference.elementName(), state);
                references.add(reference);
            }
        }
        if (references.isEmpty()) {
            return null;
        }
        if (referenceList) {
            return new Reference(references, false);
        }
        return inferOperation(BRACED.matcher(input).replaceAll(" "), references);
    }

    /**
     * Builds an operation anchored on the first reference from keywords found
     * in the text around several braced references.
     */
    private Expression inferOperation(String remainder, List<ElementReference> references) {
        Reference anchor = new Reference(List.of(references.get(0)), false);
        if (remainder.contains("increment")) {
            return new Operation(Operator.ADD, anchor, Expression.literal(1), references, false);
        }
        if (remainder.contains("decrement")) {
            return new Operation(Operator.SUBTRACT, anchor, Expression.literal(1), references, false);
        }
        int multiply = remainder.indexOf("multiply");
        if (multiply >= 0) {
            Matcher factor = LEADING_NUMBER.matcher(remainder.substring(multiply + "multiply".length()));
            Object value = factor.find() ? Double.valueOf(factor.group(1)) : Integer.valueOf(1);
            return new Operation(Operator.MULTIPLY, anchor, Expression.literal(value), references, false);
        }
        return new Reference(references, false);
    }

    private Expression parseStructural(String input, ParseState state) {
        if (input.indexOf('(') >= 0 && input.indexOf(')') >= 0) {
            Expression nested = parseParenthesized(input, state);
            if (nested != null) {
                return nested;
            }
        }
        Expression arithmetic = splitOnKeyword(input, ARITHMETIC_RULES, state);
        if (arithmetic != null) {
            return arithmetic;
        }
        Expression comparison = splitOnKeyword(input, COMPARISON_RULES, state);
        if (comparison != null) {
            return comparison;
        }
        Expression logical = splitOnKeyword(input, LOGICAL_RULES, state);
        if (logical != null) {
            return logical;
        }
        Matcher negation = NEGATION.matcher(input);
        if (negation.matches()) {
            return Expression.compound(Operator.NOT, parseText(negation.group(1), state), null);
        }
        return null;
    }

    private Expression parseParenthesized(String input, ParseState state) {
        Matcher matcher = INNERMOST_PARENS.matcher(input);
        if (!matcher.find()) {
            return null;
        }
        Expression parsedInner = parseText(matcher.group(1), state);
        if (parsedInner == null) {
            return null;
        }
        Expression inner = parsedInner.withNested(true);

        if (matcher.start() == 0 && matcher.end() == input.length()) {
            return inner;
        }

        String placeholder = state.bind(inner, matcher.group());
        String remainder = input.substring(0, matcher.start()) + placeholder + input.substring(matcher.end());
        Expression outer = parseText(remainder, state);
        if (outer == null) {
            return inner;
        }

        // The placeholder was swallowed by a rule that does not recurse into it.
        if (!state.consumed(placeholder) && outer instanceof Operation operation) {
            if (operation.leftOperand() == null && remainder.startsWith(placeholder)) {
                return operation.withLeftOperand(inner);
            }
            if (operation.rightOperand() == null) {
                return operation.withRightOperand(inner);
            }
        }
        return outer;
    }

    private Expression splitOnKeyword(String input, List<KeywordRule> rules, ParseState state) {
        for (KeywordRule rule : rules) {
            Matcher matcher = rule.pattern().matcher(input);
            if (!matcher.matches()) {
                continue;
            }
            Expression left = parseText(matcher.group(1), state);
            Expression right = parseText(matcher.group(2), state);
            logger.fine(() -> "Split '" + input + "' on " + rule.operator());
            return rule.operator().isLogical()
                    ? Expression.compound(rule.operator(), left, right)
                    : Operation.of(rule.operator(), left, right);
        }
        return null;
    }

    private static Operator arithmeticOperator(String keyword) {
        switch (keyword.toLowerCase(Locale.ROOT)) {
            case "decrement":
            case "subtract":
                return Operator.SUBTRACT;
            case "multiply":
                return Operator.MULTIPLY;
            case "divide":
                return Operator.DIVIDE;
            default:
                return Operator.ADD;
        }
    }

    private static ElementReference toReference(String token) {
        String[] parts = token.split("\\.");
        if (parts.length < 2 || parts[0].isBlank() || parts[1].isBlank()) {
            return null;
        }
        return new ElementReference(parts[0].trim(), parts[1].trim());
    }

    private static void warnIfUnknown(String elementName, ParseState state) {
        List<PatternElement> available = state.context().availableElements();
        if (!available.isEmpty() && available.stream().noneMatch(e -> elementName.equals(e.name()))) {
            logger.warning("Referenced element \"" + elementName + "\" not found in available elements");
        }
    }

    private record KeywordRule(Operator operator, Pattern pattern) {
        static KeywordRule of(Operator operator, String keyword) {
            return new KeywordRule(operator, Pattern.compile("^(.+)\\s+(?:" + keyword + ")\\s+(.+)$", FLAGS));
        }
    }

    /**
     * Per-call state: parenthesized sub-expressions already parsed, bound to the
     * placeholder tokens that replaced them in the remaining text.
     */
    private static final class ParseState {
        private static final Pattern PLACEHOLDER = Pattern.compile("__NESTED_\\d+__");

        private final ParseContext context;
        private final Map<String, Expression> nested = new HashMap<>();
        private final Map<String, String> sourceText = new HashMap<>();
        private final Set<String> consumed = new HashSet<>();

        ParseState(ParseContext context) {
            this.context = context;
        }

        ParseContext context() {
            return context;
        }

        String bind(Expression expression, String source) {
            String placeholder = "__NESTED_" + nested.size() + "__";
            nested.put(placeholder, expression);
            sourceText.put(placeholder, source);
            return placeholder;
        }

        Expression take(String text) {
            Expression expression = nested.get(text);
            if (expression != null) {
                consumed.add(text);
            }
            return expression;
        }

        boolean consumed(String placeholder) {
            return consumed.contains(placeholder);
        }

        /**
         * Puts the original parenthesized text back in place of any placeholder.
         */
        String restore(String text) {
            String restored = text;
            Matcher matcher = PLACEHOLDER.matcher(restored);
            while (matcher.find()) {
                String source = sourceText.get(matcher.group());
                if (source == null) break;
                consumed.add(matcher.group());
                restored = restored.substring(0, matcher.start()) + source + restored.substring(matcher.end());
                matcher = PLACEHOLDER.matcher(restored);
            }
            return restored;
        }
    }
}
