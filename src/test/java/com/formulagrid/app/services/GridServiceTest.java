package com.formulagrid.app.services;

import com.formulagrid.app.config.EngineProperties;
import com.formulagrid.app.dispatch.CrossModuleDispatcher;
import com.formulagrid.app.exceptions.GridNotFoundException;
import com.formulagrid.app.exceptions.HistoryExhaustedException;
import com.formulagrid.app.exceptions.InvalidAddressException;
import com.formulagrid.app.exceptions.InvalidStructuralEditException;
import com.formulagrid.app.functions.FunctionRegistry;
import com.formulagrid.app.gematria.GematriaOperationHandler;
import com.formulagrid.app.gematria.GematriaService;
import com.formulagrid.app.models.CellStyle;
import com.formulagrid.app.models.GridDimensions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GridService logic, using an in-memory approach
 * (no HTTP or external server).
 */
class GridServiceTest {

    private GridService gridService;
    private long gridId;

    @BeforeEach
    void setUp() {
        EngineProperties properties = new EngineProperties();
        properties.setDefaultRows(20);
        properties.setDefaultColumns(5);
        CrossModuleDispatcher dispatcher = new CrossModuleDispatcher();
        dispatcher.register(new GematriaOperationHandler(new GematriaService()));
        gridService = new GridService(properties, FunctionRegistry.standard(), dispatcher);
        gridId = gridService.createGrid(null, null);
    }

    @Test
    void testDefaultDimensions() {
        GridDimensions dimensions = gridService.getDimensions(gridId);
        assertEquals(20, dimensions.getRows());
        assertEquals(5, dimensions.getColumns());
    }

    /**
     * Confirm fully evaluated data, keyed by A1 address in row-major order.
     */
    @Test
    void testEvaluateGridData() {
        gridService.setCellValue(gridId, "A1", "1");
        gridService.setCellValue(gridId, "A2", "2");
        gridService.setCellValue(gridId, "A3", "3");
        gridService.setCellValue(gridId, "B1", "=SUM(A1:A3)");

        Map<String, Object> data = gridService.getGridData(gridId);
        assertEquals(6.0, data.get("B1"));
        assertEquals(1.0, data.get("A1"));
        assertEquals("[A1, B1, A2, A3]", data.keySet().toString());
    }

    /**
     * A cycle is stored, not rejected; both cells read as #CYCLE!.
     */
    @Test
    void testCycleIsAValue() {
        gridService.setCellValue(gridId, "A1", "=B1");
        gridService.setCellValue(gridId, "B1", "=A1");

        Map<String, Object> data = gridService.getGridData(gridId);
        assertEquals("#CYCLE!", data.get("A1"));
        assertEquals("#CYCLE!", data.get("B1"));
    }

    @Test
    void testGetCell() {
        gridService.setCellValue(gridId, "C2", "=GEMATRIA(\"light\")");
        Map<String, Object> cell = gridService.getCell(gridId, "c2");
        assertEquals("C2", cell.get("address"));
        assertEquals("=GEMATRIA(\"light\")", cell.get("raw"));
        assertEquals(24.0, cell.get("value"));
    }

    @Test
    void testInvalidAddresses() {
        assertThrows(InvalidAddressException.class, () -> gridService.setCellValue(gridId, "1A", "x"));
        assertThrows(InvalidAddressException.class, () -> gridService.setCellValue(gridId, "F1", "x"));
        assertThrows(InvalidAddressException.class, () -> gridService.getCell(gridId, "A21"));
        assertThrows(GridNotFoundException.class, () -> gridService.getGridData(-1));
    }

    @Test
    void testCopyShiftsReferences() {
        gridService.setCellValue(gridId, "A1", "10");
        gridService.setCellValue(gridId, "A2", "20");
        gridService.setCellValue(gridId, "B1", "=A1*2");
        gridService.copyCell(gridId, "B1", "B2");

        Map<String, Object> cell = gridService.getCell(gridId, "B2");
        assertEquals("=A2*2", cell.get("raw"));
        assertEquals(40.0, cell.get("value"));
    }

    @Test
    void testStructuralEditUndoRedo() {
        gridService.setCellValue(gridId, "A1", "top");
        gridService.setStyle(gridId, "A1", CellStyle.background("#ff0000"));

        gridService.insertRows(gridId, 0, 2);
        assertEquals("top", gridService.getCell(gridId, "A3").get("raw"));
        assertNotNull(gridService.getStyles(gridId).get("A3"));
        assertEquals(22, gridService.getDimensions(gridId).getRows());

        gridService.undo(gridId);
        assertEquals("top", gridService.getCell(gridId, "A1").get("raw"));
        assertEquals(CellStyle.background("#ff0000"), gridService.getStyles(gridId).get("A1"));

        gridService.redo(gridId);
        assertEquals("top", gridService.getCell(gridId, "A3").get("raw"));
    }

    @Test
    void testHistoryExhausted() {
        assertThrows(HistoryExhaustedException.class, () -> gridService.undo(gridId));
        assertThrows(HistoryExhaustedException.class, () -> gridService.redo(gridId));
        assertThrows(InvalidStructuralEditException.class, () -> gridService.removeColumns(gridId, 4, 2));
    }

    @Test
    void testEvaluateWithoutStoring() {
        gridService.setCellValue(gridId, "A1", "4");
        assertEquals(16.0, gridService.evaluate(gridId, "=A1^2"));
        assertEquals(1, gridService.getGridData(gridId).size());
    }

    @Test
    void testFunctionsAreListed() {
        assertFalse(gridService.getFunctions().isEmpty());
        assertEquals("ABS", gridService.getFunctions().get(0).getName());
    }
}
