package com.formulagrid.app.evaluation;

import java.util.Collections;
import java.util.List;

/**
 * Evaluated range argument: cell values in row-major order.
 * Only functions accept it; in scalar position it is a #VALUE! error.
 */
public final class RangeValue {

    private final int rows;
    private final int columns;
    private final List<Object> values;

    public RangeValue(int rows, int columns, List<Object> values) {
        this.rows = rows;
        this.columns = columns;
        this.values = Collections.unmodifiableList(values);
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    public List<Object> getValues() {
        return values;
    }

    /** First error inside the range, or null. */
    public Object firstError() {
        for (Object value : values) {
            if (FormulaError.isError(value)) {
                return value;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "Range" + rows + "x" + columns + values;
    }
}
