package com.formulagrid.app.gematria;

import com.formulagrid.app.dispatch.CrossModuleDispatcher;
import com.formulagrid.app.evaluation.EvaluationLimits;
import com.formulagrid.app.functions.FunctionRegistry;
import com.formulagrid.app.models.Grid;
import com.formulagrid.app.references.CellAddress;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the ciphers, and for reaching them from formulas through the dispatcher.
 */
class GematriaServiceTest {

    private GematriaService gematriaService;
    private Grid grid;

    @BeforeEach
    void setUp() {
        gematriaService = new GematriaService();
        CrossModuleDispatcher dispatcher = new CrossModuleDispatcher();
        dispatcher.register(new GematriaOperationHandler(gematriaService));
        grid = new Grid(10, 10, FunctionRegistry.standard(), dispatcher, EvaluationLimits.defaults());
    }

    @Test
    void testTrigrammaton() {
        assertEquals(24, gematriaService.calculate("LIGHT", "English (TQ)"));
        assertEquals(46, gematriaService.calculate("love", "English (TQ)"));
        assertEquals(60, gematriaService.calculate("Truth!", "english (tq)"));
        assertEquals(0, gematriaService.calculate("", "English (TQ)"));
    }

    @Test
    void testHebrew() {
        // shalom, with and without vowel points
        assertEquals(376, gematriaService.calculate("שלום", "Hebrew (Standard)"));
        assertEquals(376, gematriaService.calculate("שָׁלוֹם", "Hebrew (Standard)"));
        assertEquals(936, gematriaService.calculate("שלום", "Hebrew (Sofit)"));
    }

    @Test
    void testGreekIgnoresAccents() {
        // logos = 30 + 70 + 3 + 70 + 200
        assertEquals(373, gematriaService.calculate("λόγος", "Greek (Isopsephy)"));
        assertEquals(373, gematriaService.calculate("ΛΟΓΟΣ", "Greek (Isopsephy)"));
    }

    @Test
    void testUnknownCipher() {
        assertFalse(gematriaService.hasCipher("Klingon"));
        assertThrows(IllegalArgumentException.class, () -> gematriaService.calculate("x", "Klingon"));
        assertEquals(4, gematriaService.getCipherNames().size());
    }

    @Test
    void testFormulaMatchesDirectCalculation() {
        grid.setCellRaw(CellAddress.parse("A1"), "truth");
        grid.setCellRaw(CellAddress.parse("B1"), "=GEMATRIA(A1)");
        grid.setCellRaw(CellAddress.parse("B2"), "=GEMATRIA(\"שלום\", \"Hebrew (Sofit)\")");

        assertEquals((double) gematriaService.calculate("truth", "English (TQ)"),
                grid.evaluateCell(CellAddress.parse("B1")));
        assertEquals(936.0, grid.evaluateCell(CellAddress.parse("B2")));
        assertEquals(120.0, grid.evaluate("=GEMATRIA(A1)*2"));
    }

    @Test
    void testFormulaWithUnknownCipher() {
        assertEquals("#CIPHER?", grid.evaluate("=GEMATRIA(\"abc\", \"Klingon\")"));
        assertEquals("#CIPHER?", grid.evaluate("=IFERROR(1/0, GEMATRIA(\"abc\", \"Klingon\"))"));
        assertEquals("none", grid.evaluate("=IFERROR(GEMATRIA(\"abc\", \"Klingon\"), \"none\")"));
    }
}
