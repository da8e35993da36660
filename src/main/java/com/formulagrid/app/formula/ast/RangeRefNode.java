package com.formulagrid.app.formula.ast;

import com.formulagrid.app.references.RangeAddress;

/**
 * Rectangular range between two cell references, e.g. A1:C3.
 */
public final class RangeRefNode implements Node {

    private final CellRefNode start;
    private final CellRefNode end;

    public RangeRefNode(CellRefNode start, CellRefNode end) {
        this.start = start;
        this.end = end;
    }

    public CellRefNode getStart() {
        return start;
    }

    public CellRefNode getEnd() {
        return end;
    }

    public RangeAddress toRange() {
        return new RangeAddress(start.getAddress(), end.getAddress());
    }

    @Override
    public String toString() {
        return start + ":" + end;
    }
}
