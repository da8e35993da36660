package com.formulagrid.app.evaluation;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Coercion rules shared by operators and functions.
 * Values are Double, Boolean, String, or null/"" for empty.
 */
public final class Values {

    private Values() {
    }

    /**
     * Interprets non-formula cell text: number when it parses as one,
     * TRUE/FALSE as booleans, "" when empty, otherwise the text itself.
     */
    public static Object parseLiteral(String raw) {
        if (raw == null) {
            return "";
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return "";
        }
        if (trimmed.equalsIgnoreCase("TRUE")) {
            return Boolean.TRUE;
        }
        if (trimmed.equalsIgnoreCase("FALSE")) {
            return Boolean.FALSE;
        }
        Double number = tryParseNumber(trimmed);
        return number != null ? (Object) number : raw;
    }

    public static boolean isEmpty(Object value) {
        return value == null || (value instanceof String && ((String) value).isEmpty());
    }

    /**
     * Strict numeric coercion for operators: empty is 0, booleans are 1/0,
     * numeric text is parsed. Anything else is a #VALUE! error.
     */
    public static double toNumber(Object value) {
        if (value instanceof Double) {
            return (Double) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (isEmpty(value)) {
            return 0;
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? 1 : 0;
        }
        if (value instanceof String) {
            Double parsed = tryParseNumber(((String) value).trim());
            if (parsed != null) {
                return parsed;
            }
        }
        throw new FormulaErrorException(FormulaError.VALUE, "Not a number: " + value);
    }

    /**
     * Lenient coercion used by aggregates: returns null for anything that is not numeric,
     * including booleans and empty cells.
     */
    public static Double asNumberOrNull(Object value) {
        if (value instanceof Double) {
            return (Double) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String && !isEmpty(value)) {
            return tryParseNumber(((String) value).trim());
        }
        return null;
    }

    public static String toText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double) {
            return formatNumber((Double) value);
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? "TRUE" : "FALSE";
        }
        return value.toString();
    }

    /**
     * Truthiness for conditions: booleans, non-zero numbers, "TRUE"/"FALSE" text.
     * Empty is false; other text is a #VALUE! error.
     */
    public static boolean toBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0;
        }
        if (isEmpty(value)) {
            return false;
        }
        String text = value.toString().trim();
        if (text.equalsIgnoreCase("TRUE")) {
            return true;
        }
        if (text.equalsIgnoreCase("FALSE")) {
            return false;
        }
        Double number = tryParseNumber(text);
        if (number != null) {
            return number != 0;
        }
        throw new FormulaErrorException(FormulaError.VALUE, "Not a condition: " + value);
    }

    /**
     * Orders two scalar values: text (case-insensitive) when either side is non-empty text,
     * numbers otherwise.
     */
    public static int compare(Object left, Object right) {
        boolean leftText = left instanceof String && !isEmpty(left);
        boolean rightText = right instanceof String && !isEmpty(right);
        if (leftText || rightText) {
            return toText(left).toUpperCase(Locale.ROOT).compareTo(toText(right).toUpperCase(Locale.ROOT));
        }
        return Double.compare(toNumber(left), toNumber(right));
    }

    /**
     * Wraps a computed double, turning NaN and infinities into #NUM!.
     */
    public static Object number(double result) {
        if (Double.isNaN(result) || Double.isInfinite(result)) {
            return FormulaError.NUM.sentinel();
        }
        // avoid "-0" in displays
        return result == 0 ? 0.0 : result;
    }

    /**
     * Flattens arguments, expanding ranges in row-major order.
     */
    public static List<Object> flatten(List<Object> args) {
        List<Object> flat = new ArrayList<>();
        for (Object arg : args) {
            if (arg instanceof RangeValue) {
                flat.addAll(((RangeValue) arg).getValues());
            } else {
                flat.add(arg);
            }
        }
        return flat;
    }

    public static String formatNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static Double tryParseNumber(String text) {
        if (text.isEmpty()) {
            return null;
        }
        char first = text.charAt(0);
        // Double.parseDouble also accepts "NaN", "Infinity" and hex; cells should not
        if (!(Character.isDigit(first) || first == '.' || first == '-' || first == '+')) {
            return null;
        }
        char last = text.charAt(text.length() - 1);
        if (!(Character.isDigit(last) || last == '.') || text.indexOf('x') >= 0 || text.indexOf('X') >= 0) {
            return null;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
