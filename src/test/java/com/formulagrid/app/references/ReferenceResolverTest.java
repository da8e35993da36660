package com.formulagrid.app.references;

import com.formulagrid.app.dispatch.CrossModuleDispatcher;
import com.formulagrid.app.evaluation.EvaluationLimits;
import com.formulagrid.app.evaluation.Evaluator;
import com.formulagrid.app.evaluation.FormulaError;
import com.formulagrid.app.evaluation.FormulaErrorException;
import com.formulagrid.app.evaluation.GridContext;
import com.formulagrid.app.formula.Parser;
import com.formulagrid.app.formula.ast.RangeRefNode;
import com.formulagrid.app.functions.FunctionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for range expansion and its size ceiling.
 */
class ReferenceResolverTest {

    private ReferenceResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new ReferenceResolver(100);
    }

    @Test
    void testExpandIsRowMajor() {
        RangeRefNode range = (RangeRefNode) Parser.parse("B2:A1");
        List<CellAddress> addresses = resolver.expand(range);
        assertEquals(Arrays.asList(
                CellAddress.parse("A1"), CellAddress.parse("B1"),
                CellAddress.parse("A2"), CellAddress.parse("B2")), addresses);
    }

    @Test
    void testOversizedRangeIsRefError() {
        RangeRefNode range = (RangeRefNode) Parser.parse("A1:Z1000");
        FormulaErrorException ex = assertThrows(FormulaErrorException.class, () -> resolver.expand(range));
        assertEquals(FormulaError.REF, ex.getError());
    }

    /**
     * A huge range must be rejected before a single cell is touched.
     */
    @Test
    void testOversizedRangeNeverReachesGrid() {
        CountingGrid grid = new CountingGrid();
        Evaluator evaluator = new Evaluator(grid, FunctionRegistry.standard(), new CrossModuleDispatcher(),
                new EvaluationLimits(100, 100_000, 100));

        assertEquals("#REF!", evaluator.evaluate("=SUM(A1:ZZZ1000000)"));
        assertEquals(0, grid.calls);

        assertEquals(0.0, evaluator.evaluate("=SUM(A1:J10)"));
        assertEquals(100, grid.calls);
    }

    private static class CountingGrid implements GridContext {
        int calls;

        @Override
        public Object evaluateCell(int row, int col, Set<CellAddress> visited) {
            calls++;
            return "";
        }

        @Override
        public String getCellRaw(int row, int col) {
            return "";
        }
    }
}
