package com.formulagrid.app.gematria;

import java.util.Map;

/**
 * Trigrammaton Qabalah: the 26 English letters take the values 0-25 in the order
 * I L C H P A X J W T O G F E R S Q K Y Z B M V D N U.
 * LIGHT = 1 + 0 + 11 + 3 + 9 = 24.
 */
public class TqGematriaCalculator extends GematriaCalculator {

    public static final String NAME = "English (TQ)";

    private static final String ORDER = "ILCHPAXJWTOGFERSQKYZBMVDNU";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected void initializeMapping(Map<Integer, Integer> values) {
        for (int i = 0; i < ORDER.length(); i++) {
            values.put((int) ORDER.charAt(i), i);
        }
    }
}
