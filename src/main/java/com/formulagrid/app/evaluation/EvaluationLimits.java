package com.formulagrid.app.evaluation;

/**
 * Ceilings for the evaluation guards. Values are tuning constants, not semantics.
 */
public final class EvaluationLimits {

    public static final int DEFAULT_MAX_DEPTH = 100;
    public static final int DEFAULT_MAX_EVALUATIONS = 100_000;
    public static final int DEFAULT_MAX_RANGE_CELLS = 10_000;

    private final int maxDepth;
    private final int maxEvaluations;
    private final int maxRangeCells;

    public EvaluationLimits(int maxDepth, int maxEvaluations, int maxRangeCells) {
        if (maxDepth < 1 || maxEvaluations < 1 || maxRangeCells < 1) {
            throw new IllegalArgumentException("Evaluation limits must be positive");
        }
        this.maxDepth = maxDepth;
        this.maxEvaluations = maxEvaluations;
        this.maxRangeCells = maxRangeCells;
    }

    public static EvaluationLimits defaults() {
        return new EvaluationLimits(DEFAULT_MAX_DEPTH, DEFAULT_MAX_EVALUATIONS, DEFAULT_MAX_RANGE_CELLS);
    }

    /** Deepest nested cell descent allowed. */
    public int getMaxDepth() {
        return maxDepth;
    }

    /** Cell descents allowed within one top-level call. */
    public int getMaxEvaluations() {
        return maxEvaluations;
    }

    /** Largest range, in cells, that may be expanded. */
    public int getMaxRangeCells() {
        return maxRangeCells;
    }

    @Override
    public String toString() {
        return "EvaluationLimits{depth=" + maxDepth + ", evaluations=" + maxEvaluations
                + ", rangeCells=" + maxRangeCells + "}";
    }
}
