package com.formulagrid.app.models;

import com.formulagrid.app.exceptions.InvalidAddressException;
import com.formulagrid.app.references.CellAddress;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GridTest {

    private Grid grid;

    @BeforeEach
    void setUp() {
        grid = new Grid(3, 3);
    }

    @Test
    void testIdsAreUnique() {
        assertNotEquals(grid.getId(), new Grid(1, 1).getId());
    }

    @Test
    void testEmptyTextClearsCell() {
        CellAddress b2 = CellAddress.parse("B2");
        assertEquals("", grid.setCellRaw(b2, "x"));
        assertEquals(1, grid.getCells().size());
        assertEquals("x", grid.setCellRaw(b2, ""));
        assertEquals(0, grid.getCells().size());
        assertFalse(new Cell("=1").equals(new Cell("1")));
        assertTrue(Cell.isFormula("=A1"));
    }

    @Test
    void testBounds() {
        assertThrows(InvalidAddressException.class, () -> grid.setCellRaw(CellAddress.parse("D1"), "x"));
        assertThrows(InvalidAddressException.class,
                () -> grid.setStyle(CellAddress.parse("A4"), CellStyle.background("#fff")));
        assertEquals("#REF!", grid.evaluateCell(5, 0, new HashSet<>()));
        assertEquals("", grid.getCellRaw(7, 7));
    }

    /**
     * The visited set only holds addresses while they are being evaluated.
     */
    @Test
    void testVisitedSetIsRestored() {
        grid.setCellRaw(CellAddress.parse("A1"), "=B1+1");
        grid.setCellRaw(CellAddress.parse("B1"), "2");
        Set<CellAddress> visited = new HashSet<>();
        assertEquals(3.0, grid.evaluateCell(0, 0, visited));
        assertTrue(visited.isEmpty());

        visited.add(CellAddress.parse("A1"));
        assertEquals("#CYCLE!", grid.evaluateCell(0, 0, visited));
        assertEquals(1, visited.size());
    }

    @Test
    void testRegisteredStoresAreListed() {
        AddressMap<Integer> comments = new AddressMap<>("comments");
        grid.registerStore(comments);
        assertEquals(3, grid.getAddressKeyedStores().size());
        assertSame(comments, grid.getAddressKeyedStores().get(2));
        assertThrows(UnsupportedOperationException.class, () -> grid.getAddressKeyedStores().clear());
    }

    @Test
    void testAddressMapPutNullRemoves() {
        AddressMap<String> map = new AddressMap<>("test");
        map.put(CellAddress.parse("B1"), "b");
        map.put(CellAddress.parse("A2"), "a");
        assertEquals("[B1, A2]", map.keys().toString());
        assertEquals("b", map.put(CellAddress.parse("B1"), null));
        assertEquals(1, map.size());
    }
}
