/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.runtime.operators;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Weakly typed value rules used by expression evaluation.
 *
 * <p>Attribute values reach the evaluator as whatever the editors stored:
 * numbers, numeric strings, booleans, free text or nothing at all. These rules
 * give every combination a defined result instead of a type error:
 * <ul>
 *   <li>numeric strings count as numbers, a blank string counts as zero</li>
 *   <li>null counts as zero in arithmetic</li>
 *   <li>adding anything to non-numeric text concatenates</li>
 *   <li>equality converts across types before comparing</li>
 * </ul>
 *
 * <p>Integral results are returned as {@link Long}, everything else as
 * {@link Double}.
 */
public final class LooseValues {

    private static final Pattern NUMERIC =
            Pattern.compile("[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?|[+-]?Infinity");
    private static final double MAX_EXACT_LONG = 9_007_199_254_740_992d; // 2^53

    private LooseValues() {
    }

    public static boolean isNumeric(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() || NUMERIC.matcher(trimmed).matches();
    }

    /**
     * Converts a numeric-looking string to a number. Other values are returned
     * unchanged.
     */
    public static Object coerceNumericString(Object value) {
        if (value instanceof String s && isNumeric(s)) {
            return normalize(toNumber(s));
        }
        return value;
    }

    public static double toNumber(Object value) {
        if (value == null) return 0;
        if (value instanceof Number n) return n.doubleValue();
        if (value instanceof Boolean b) return b ? 1 : 0;
        if (value instanceof String s) {
            if (!isNumeric(s)) return Double.NaN;
            String trimmed = s.trim();
            return trimmed.isEmpty() ? 0 : Double.parseDouble(trimmed);
        }
        return Double.NaN;
    }

    public static Object normalize(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) return value;
        if (value == Math.rint(value) && Math.abs(value) <= MAX_EXACT_LONG) {
            return (long) value;
        }
        return value;
    }

    public static boolean truthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (value instanceof String s) return !s.isEmpty();
        return true;
    }

    public static String stringify(Object value) {
        if (value instanceof Double || value instanceof Float) {
            Object normalized = normalize(((Number) value).doubleValue());
            return String.valueOf(normalized);
        }
        return String.valueOf(value);
    }

    public static Object add(Object left, Object right) {
        if (left instanceof String || right instanceof String) {
            return stringify(left) + stringify(right);
        }
        return normalize(toNumber(left) + toNumber(right));
    }

    public static boolean looseEquals(Object left, Object right) {
        if (left == null || right == null) return left == right;
        if (left instanceof Boolean b) return looseEquals(b ? 1L : 0L, right);
        if (right instanceof Boolean b) return looseEquals(left, b ? 1L : 0L);
        if (left instanceof Number || right instanceof Number) {
            if ((left instanceof Number || left instanceof String) && (right instanceof Number || right instanceof String)) {
                return toNumber(left) == toNumber(right);
            }
            return false;
        }
        if (left instanceof String || right instanceof String) {
            return String.valueOf(left).equals(String.valueOf(right));
        }
        return Objects.equals(left, right);
    }

    /**
     * Relational comparison. Two strings compare lexicographically, anything
     * else numerically; NaN compares false.
     *
     * @return negative, zero or positive, or null when the values are unordered
     */
    public static Integer compare(Object left, Object right) {
        if (left instanceof String l && right instanceof String r) {
            return l.compareTo(r);
        }
        double l = toNumber(left);
        double r = toNumber(right);
        if (Double.isNaN(l) || Double.isNaN(r)) return null;
        return Double.compare(l, r);
    }
}
