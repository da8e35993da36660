package com.formulagrid.app.gematria;

import java.util.Map;

/**
 * Greek isopsephy, including the archaic numerals stigma (6), koppa (90) and sampi (900).
 * Accents and breathings are stripped before summing; final sigma counts as sigma.
 */
public class GreekIsopsephyCalculator extends GematriaCalculator {

    public static final String NAME = "Greek (Isopsephy)";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected void initializeMapping(Map<Integer, Integer> values) {
        assign(values, "ΑΒΓΔΕϚΖΗΘ", 1, 2, 3, 4, 5, 6, 7, 8, 9);
        assign(values, "ΙΚΛΜΝΞΟΠϘ", 10, 20, 30, 40, 50, 60, 70, 80, 90);
        assign(values, "ΡΣΤΥΦΧΨΩϠ", 100, 200, 300, 400, 500, 600, 700, 800, 900);
    }
}
