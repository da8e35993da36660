package com.formulagrid.app.functions;

import com.formulagrid.app.evaluation.Evaluator;

import java.util.List;

/**
 * Implementation of a formula function.
 * Arguments arrive evaluated: Double, Boolean, String, RangeValue, or null when omitted.
 * Implementations reach other cells or subsystems only through the evaluator.
 */
@FunctionalInterface
public interface FormulaFunction {

    Object apply(Evaluator evaluator, List<Object> args);
}
