package com.formulagrid.app.gematria;

import java.util.Map;

/**
 * Standard values, except the five final forms continue the hundreds: ך500 ם600 ן700 ף800 ץ900.
 */
public class HebrewSofitCalculator extends HebrewStandardCalculator {

    public static final String NAME = "Hebrew (Sofit)";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected void initializeMapping(Map<Integer, Integer> values) {
        super.initializeMapping(values);
        assign(values, "ךםןףץ", 500, 600, 700, 800, 900);
    }
}
