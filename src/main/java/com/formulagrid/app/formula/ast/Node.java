package com.formulagrid.app.formula.ast;

/**
 * A node of a parsed formula. Nodes are immutable; the evaluator walks them.
 */
public interface Node {
}
