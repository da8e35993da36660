package com.formulagrid.app.gematria;

import java.util.Map;

/**
 * Mispar Hechrachi. Final forms count the same as their regular letters.
 */
public class HebrewStandardCalculator extends GematriaCalculator {

    public static final String NAME = "Hebrew (Standard)";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected void initializeMapping(Map<Integer, Integer> values) {
        assign(values, "אבגדהוזחטיכלמנסעפצקרשת",
                1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 20, 30, 40, 50, 60, 70, 80, 90, 100, 200, 300, 400);
        assign(values, "ךםןףץ", 20, 40, 50, 80, 90);
    }
}
