package com.formulagrid.app.evaluation;

/**
 * Mutable guard state of one top-level evaluation.
 * The outermost call claims the context with {@link #begin()} and clears it with
 * {@link #reset()} when it returns; nested calls only move the counters.
 */
public class EvaluationContext {

    private boolean active;
    private int depth;
    private int evaluations;

    /**
     * Marks the start of a call. Returns true only for the outermost one.
     */
    boolean begin() {
        if (active) {
            return false;
        }
        active = true;
        return true;
    }

    void enter() {
        depth++;
        evaluations++;
    }

    void exit() {
        depth--;
    }

    void reset() {
        active = false;
        depth = 0;
        evaluations = 0;
    }

    public boolean isActive() {
        return active;
    }

    public int getDepth() {
        return depth;
    }

    public int getEvaluations() {
        return evaluations;
    }
}
