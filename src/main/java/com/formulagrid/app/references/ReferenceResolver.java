package com.formulagrid.app.references;

import com.formulagrid.app.evaluation.FormulaError;
import com.formulagrid.app.evaluation.FormulaErrorException;
import com.formulagrid.app.formula.ast.CellRefNode;
import com.formulagrid.app.formula.ast.RangeRefNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns reference nodes into grid addresses.
 * Range expansion checks the cell count against a ceiling before allocating anything.
 */
public class ReferenceResolver {

    private final int maxRangeCells;

    public ReferenceResolver(int maxRangeCells) {
        this.maxRangeCells = maxRangeCells;
    }

    public CellAddress resolve(CellRefNode ref) {
        return ref.getAddress();
    }

    /**
     * Returns the addresses of the range in row-major order.
     *
     * @throws FormulaErrorException with REF when the range holds more than the ceiling
     */
    public List<CellAddress> expand(RangeRefNode ref) {
        RangeAddress range = ref.toRange();
        long cellCount = range.getCellCount();
        if (cellCount > maxRangeCells) {
            throw new FormulaErrorException(FormulaError.REF,
                    "Range " + range + " has " + cellCount + " cells, limit is " + maxRangeCells);
        }

        List<CellAddress> addresses = new ArrayList<>((int) cellCount);
        CellAddress topLeft = range.getTopLeft();
        CellAddress bottomRight = range.getBottomRight();
        for (int row = topLeft.getRow(); row <= bottomRight.getRow(); row++) {
            for (int col = topLeft.getCol(); col <= bottomRight.getCol(); col++) {
                addresses.add(new CellAddress(row, col));
            }
        }
        return addresses;
    }

    public int getMaxRangeCells() {
        return maxRangeCells;
    }
}
