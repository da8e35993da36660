package com.formulagrid.app.commands;

import com.formulagrid.app.exceptions.InvalidStructuralEditException;
import com.formulagrid.app.models.AddressMap;
import com.formulagrid.app.models.Cell;
import com.formulagrid.app.models.CellStyle;
import com.formulagrid.app.models.Grid;
import com.formulagrid.app.references.CellAddress;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Insert/remove rows and columns: every address-keyed store moves together,
 * and redo followed by undo restores the grid exactly.
 */
class StructuralCommandsTest {

    private Grid grid;
    private AddressMap<String> notes;

    @BeforeEach
    void setUp() {
        grid = new Grid(10, 6);
        notes = new AddressMap<>("notes");
        grid.registerStore(notes);

        grid.setCellRaw(at(0, 0), "1");
        grid.setCellRaw(at(1, 1), "=A1*2");
        grid.setCellRaw(at(4, 2), "hello");
        grid.setCellRaw(at(9, 5), "corner");
        grid.setStyle(at(1, 1), CellStyle.background("#ff0000"));
        grid.setStyle(at(4, 2), CellStyle.background("#00ff00"));
        notes.put(at(4, 2), "check this");
    }

    private static CellAddress at(int row, int col) {
        return new CellAddress(row, col);
    }

    @Test
    void testInsertRowsMovesStyleAndUndoRestoresIt() {
        InsertRowsCommand command = new InsertRowsCommand(grid, 1, 2);
        command.redo();

        assertEquals(12, grid.getRowCount());
        assertNull(grid.getStyle(at(1, 1)));
        assertEquals(CellStyle.background("#ff0000"), grid.getStyle(at(3, 1)));
        assertEquals("=A1*2", grid.getCellRaw(at(3, 1)));
        assertEquals("1", grid.getCellRaw(at(0, 0)));
        assertEquals("check this", notes.get(at(6, 2)));

        command.undo();

        assertEquals(10, grid.getRowCount());
        assertEquals(CellStyle.background("#ff0000"), grid.getStyle(at(1, 1)));
        assertNull(grid.getStyle(at(3, 1)));
        assertEquals("check this", notes.get(at(4, 2)));
    }

    @Test
    void testRemoveRowsCapturesAndRestores() {
        Map<CellAddress, Cell> cellsBefore = grid.getCells().snapshot();
        Map<CellAddress, CellStyle> stylesBefore = grid.getStyles().snapshot();
        Map<CellAddress, String> notesBefore = notes.snapshot();

        RemoveRowsCommand command = new RemoveRowsCommand(grid, 1, 4);
        command.redo();

        assertEquals(6, grid.getRowCount());
        assertEquals("", grid.getCellRaw(at(1, 1)));
        assertEquals("corner", grid.getCellRaw(at(5, 5)));
        // only A1 above the band and the shifted corner survive
        assertEquals(2, grid.getCells().size());
        assertEquals(0, notes.size());
        assertEquals(0, grid.getStyles().size());

        command.undo();

        assertEquals(10, grid.getRowCount());
        assertEquals(cellsBefore, grid.getCells().snapshot());
        assertEquals(stylesBefore, grid.getStyles().snapshot());
        assertEquals(notesBefore, notes.snapshot());
    }

    @Test
    void testInsertAndRemoveColumns() {
        InsertColumnsCommand insert = new InsertColumnsCommand(grid, 0, 1);
        insert.redo();
        assertEquals(7, grid.getColumnCount());
        assertEquals("1", grid.getCellRaw(at(0, 1)));
        assertEquals("corner", grid.getCellRaw(at(9, 6)));

        RemoveColumnsCommand remove = new RemoveColumnsCommand(grid, 2, 2);
        remove.redo();
        assertEquals(5, grid.getColumnCount());
        assertEquals("1", grid.getCellRaw(at(0, 1)));
        assertEquals("", grid.getCellRaw(at(1, 2)));
        assertEquals("corner", grid.getCellRaw(at(9, 4)));

        remove.undo();
        insert.undo();
        assertEquals(6, grid.getColumnCount());
        assertEquals("=A1*2", grid.getCellRaw(at(1, 1)));
        assertEquals("hello", grid.getCellRaw(at(4, 2)));
        assertEquals("corner", grid.getCellRaw(at(9, 5)));
    }

    /**
     * Several edits applied in sequence and undone in reverse leave every store unchanged.
     */
    @Test
    void testComposedEditsAreInvertible() {
        Map<CellAddress, Cell> cellsBefore = grid.getCells().snapshot();
        Map<CellAddress, CellStyle> stylesBefore = grid.getStyles().snapshot();
        Map<CellAddress, String> notesBefore = notes.snapshot();

        CommandHistory history = new CommandHistory();
        history.push(new InsertRowsCommand(grid, 0, 3));
        history.push(new RemoveColumnsCommand(grid, 1, 2));
        history.push(new InsertColumnsCommand(grid, 4, 5));
        history.push(new RemoveRowsCommand(grid, 5, 2));
        history.push(new InsertRowsCommand(grid, 11, 1));

        while (history.undo()) {
            // unwind everything
        }

        assertEquals(10, grid.getRowCount());
        assertEquals(6, grid.getColumnCount());
        assertEquals(cellsBefore, grid.getCells().snapshot());
        assertEquals(stylesBefore, grid.getStyles().snapshot());
        assertEquals(notesBefore, notes.snapshot());
    }

    /**
     * Formula text is not rewritten: B2 still reads A1 after a row is inserted above it.
     */
    @Test
    void testFormulaTextIsNotRewritten() {
        new InsertRowsCommand(grid, 0, 1).redo();
        assertEquals("=A1*2", grid.getCellRaw(at(2, 1)));
        assertEquals(0.0, grid.evaluateCell(at(2, 1)));
    }

    @Test
    void testValidation() {
        assertThrows(InvalidStructuralEditException.class, () -> new InsertRowsCommand(grid, 0, 0));
        assertThrows(InvalidStructuralEditException.class, () -> new InsertRowsCommand(grid, 11, 1));
        assertThrows(InvalidStructuralEditException.class, () -> new InsertColumnsCommand(grid, -1, 1));
        assertThrows(InvalidStructuralEditException.class, () -> new RemoveRowsCommand(grid, 8, 3));
        assertThrows(InvalidStructuralEditException.class, () -> new RemoveColumnsCommand(grid, 6, 1));

        // appending at the end is allowed
        new InsertRowsCommand(grid, 10, 2).redo();
        assertEquals(12, grid.getRowCount());
    }

    @Test
    void testInsertPastMaximumSizeIsRejectedBeforeAnythingMoves() {
        Map<CellAddress, Cell> cellsBefore = grid.getCells().snapshot();

        assertThrows(InvalidStructuralEditException.class,
                () -> new InsertRowsCommand(grid, 0, Integer.MAX_VALUE));
        assertThrows(InvalidStructuralEditException.class,
                () -> new InsertColumnsCommand(grid, 6, Integer.MAX_VALUE - 5));

        assertEquals(10, grid.getRowCount());
        assertEquals(6, grid.getColumnCount());
        assertEquals(cellsBefore, grid.getCells().snapshot());
    }

    @Test
    void testShiftThatCannotMoveEveryStoreChangesNothing() {
        // A registered store may hold keys beyond the grid; this one cannot move down by 5
        notes.put(at(Integer.MAX_VALUE - 2, 0), "far away");
        Map<CellAddress, Cell> cellsBefore = grid.getCells().snapshot();
        Map<CellAddress, CellStyle> stylesBefore = grid.getStyles().snapshot();
        Map<CellAddress, String> notesBefore = notes.snapshot();

        InsertRowsCommand command = new InsertRowsCommand(grid, 0, 5);
        assertThrows(InvalidStructuralEditException.class, command::redo);

        assertEquals(10, grid.getRowCount());
        assertEquals(cellsBefore, grid.getCells().snapshot());
        assertEquals(stylesBefore, grid.getStyles().snapshot());
        assertEquals(notesBefore, notes.snapshot());
    }

    @Test
    void testCommandText() {
        assertEquals("Insert 2 Rows", new InsertRowsCommand(grid, 0, 2).getText());
        assertEquals("Remove 1 Columns", new RemoveColumnsCommand(grid, 0, 1).getText());
    }
}
