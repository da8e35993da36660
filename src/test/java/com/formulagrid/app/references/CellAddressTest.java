package com.formulagrid.app.references;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for A1 parsing, column letters and range normalization.
 */
class CellAddressTest {

    @Test
    void testColumnLettersBijection() {
        assertEquals("A", ColumnLetters.toLetters(0));
        assertEquals("Z", ColumnLetters.toLetters(25));
        assertEquals("AA", ColumnLetters.toLetters(26));
        assertEquals("AZ", ColumnLetters.toLetters(51));
        assertEquals("BA", ColumnLetters.toLetters(52));
        assertEquals("ZZ", ColumnLetters.toLetters(701));
        assertEquals("AAA", ColumnLetters.toLetters(702));

        for (int i = 0; i < 2000; i++) {
            assertEquals(i, ColumnLetters.toIndex(ColumnLetters.toLetters(i)));
        }
        assertEquals(27, ColumnLetters.toIndex("ab"));
    }

    @Test
    void testParse() {
        CellAddress address = CellAddress.parse("CV100");
        assertEquals(99, address.getRow());
        assertEquals(99, address.getCol());
        assertEquals("CV100", address.toA1());

        assertEquals(new CellAddress(1, 1), CellAddress.parse("$B$2"));
        assertEquals(new CellAddress(0, 0), CellAddress.parse("a1"));
    }

    @Test
    void testRejectsMalformedAddresses() {
        assertThrows(IllegalArgumentException.class, () -> CellAddress.parse("1A"));
        assertThrows(IllegalArgumentException.class, () -> CellAddress.parse("A0"));
        assertThrows(IllegalArgumentException.class, () -> CellAddress.parse(""));
        assertThrows(IllegalArgumentException.class, () -> CellAddress.parse("A99999999999"));
        assertFalse(CellAddress.isAddress("SUM"));
        assertTrue(CellAddress.isAddress("Z9"));
    }

    @Test
    void testRowMajorOrdering() {
        List<CellAddress> addresses = new ArrayList<>(Arrays.asList(
                CellAddress.parse("B2"), CellAddress.parse("A2"), CellAddress.parse("C1")));
        Collections.sort(addresses);
        assertEquals(Arrays.asList(CellAddress.parse("C1"), CellAddress.parse("A2"), CellAddress.parse("B2")),
                addresses);
    }

    @Test
    void testRangeCornersAreNormalized() {
        RangeAddress range = new RangeAddress(CellAddress.parse("C3"), CellAddress.parse("A1"));
        assertEquals(CellAddress.parse("A1"), range.getTopLeft());
        assertEquals(CellAddress.parse("C3"), range.getBottomRight());
        assertEquals(3, range.getRowCount());
        assertEquals(3, range.getColumnCount());
        assertEquals(9L, range.getCellCount());
    }
}
