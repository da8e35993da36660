package com.formulagrid.app.evaluation;

import com.formulagrid.app.references.CellAddress;

import java.util.Set;

/**
 * What the evaluator needs from the grid it runs against.
 */
public interface GridContext {

    /**
     * Evaluates the cell at (row, col). {@code visited} holds the addresses currently
     * being evaluated on this call path; re-entering one must answer #CYCLE! instead of
     * recursing. Addresses outside the grid answer #REF!.
     */
    Object evaluateCell(int row, int col, Set<CellAddress> visited);

    /**
     * Raw text of the cell, or "" when it is empty or outside the grid.
     */
    String getCellRaw(int row, int col);
}
