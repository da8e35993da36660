package com.formulagrid.app.functions;

import com.formulagrid.app.evaluation.FormulaError;
import com.formulagrid.app.evaluation.FormulaErrorException;
import com.formulagrid.app.evaluation.RangeValue;
import com.formulagrid.app.evaluation.Values;

import java.util.List;

/**
 * Argument access helpers for the built-in function sets.
 */
final class FunctionSupport {

    private FunctionSupport() {
    }

    /** The argument at {@code index}, or null when omitted or absent. */
    static Object arg(List<Object> args, int index) {
        return index < args.size() ? args.get(index) : null;
    }

    static double number(List<Object> args, int index) {
        return Values.toNumber(scalar(arg(args, index)));
    }

    static double number(List<Object> args, int index, double defaultValue) {
        Object value = arg(args, index);
        return value == null ? defaultValue : Values.toNumber(scalar(value));
    }

    /** Integer argument, truncated toward zero like the spreadsheet conventions. */
    static int integer(List<Object> args, int index, int defaultValue) {
        double value = number(args, index, defaultValue);
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw new FormulaErrorException(FormulaError.NUM, "Integer argument out of range: " + value);
        }
        return (int) value;
    }

    static String text(List<Object> args, int index) {
        return Values.toText(scalar(arg(args, index)));
    }

    static Object scalar(Object value) {
        if (value instanceof RangeValue) {
            throw new FormulaErrorException(FormulaError.VALUE, "Range where a single value is expected");
        }
        return value;
    }

    static FormulaErrorException valueError(String message) {
        return new FormulaErrorException(FormulaError.VALUE, message);
    }
}
