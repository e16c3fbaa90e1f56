/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.script.sandbox;

import java.util.regex.Pattern;

/**
 * Turns engine compile errors into messages for people editing constraints.
 */
public final class ScriptErrorFormatter {

    public static final String PREFIX = "Syntax error: ";
    public static final String UNBALANCED_HINT = PREFIX
            + "Unexpected end of expression. Check for missing closing brackets, parentheses, or quotes.";

    private static final Pattern PREMATURE_END = Pattern.compile(
            "(?i)(unexpected end of (input|script|file)|end of (input|script|file)|found eof|\\beof\\b"
                    + "|unterminated|missing close quote)");
    private static final Pattern ERROR_TYPE = Pattern.compile("^(SyntaxError|Error):\\s*");
    private static final Pattern LOCATION = Pattern.compile("^\\S*:\\d+(:\\d+)?\\s+");

    private ScriptErrorFormatter() {
    }

    public static String format(String rawMessage) {
        if (rawMessage == null || rawMessage.isBlank()) {
            return PREFIX + "Invalid script";
        }
        String message = firstLine(rawMessage);
        message = ERROR_TYPE.matcher(message).replaceFirst("");
        message = LOCATION.matcher(message).replaceFirst("").trim();
        if (PREMATURE_END.matcher(message).find()) {
            return UNBALANCED_HINT;
        }
        return PREFIX + (message.isEmpty() ? "Invalid script" : message);
    }

    private static String firstLine(String text) {
        String trimmed = text.strip();
        int newline = trimmed.indexOf('\n');
        return newline < 0 ? trimmed : trimmed.substring(0, newline).trim();
    }
}
