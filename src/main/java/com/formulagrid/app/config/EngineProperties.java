package com.formulagrid.app.config;

import com.formulagrid.app.commands.CommandHistory;
import com.formulagrid.app.evaluation.EvaluationLimits;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Engine tuning, bound from {@code formula.engine.*} in application.properties.
 */
@ConfigurationProperties(prefix = "formula.engine")
public class EngineProperties {

    private int maxDepth = EvaluationLimits.DEFAULT_MAX_DEPTH;
    private int maxEvaluations = EvaluationLimits.DEFAULT_MAX_EVALUATIONS;
    private int maxRangeCells = EvaluationLimits.DEFAULT_MAX_RANGE_CELLS;
    private int defaultRows = 100;
    private int defaultColumns = 26;
    private int undoLimit = CommandHistory.DEFAULT_UNDO_LIMIT;

    public EvaluationLimits toLimits() {
        return new EvaluationLimits(maxDepth, maxEvaluations, maxRangeCells);
    }

    public int getMaxDepth() {
        return maxDepth;
    }
    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }
    public int getMaxEvaluations() {
        return maxEvaluations;
    }
    public void setMaxEvaluations(int maxEvaluations) {
        this.maxEvaluations = maxEvaluations;
    }
    public int getMaxRangeCells() {
        return maxRangeCells;
    }
    public void setMaxRangeCells(int maxRangeCells) {
        this.maxRangeCells = maxRangeCells;
    }
    public int getDefaultRows() {
        return defaultRows;
    }
    public void setDefaultRows(int defaultRows) {
        this.defaultRows = defaultRows;
    }
    public int getDefaultColumns() {
        return defaultColumns;
    }
    public void setDefaultColumns(int defaultColumns) {
        this.defaultColumns = defaultColumns;
    }
    public int getUndoLimit() {
        return undoLimit;
    }
    public void setUndoLimit(int undoLimit) {
        this.undoLimit = undoLimit;
    }
}
