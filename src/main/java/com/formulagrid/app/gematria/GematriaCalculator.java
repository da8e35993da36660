package com.formulagrid.app.gematria;

import java.text.Normalizer;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A letter-to-number cipher. The value of a text is the sum of its letters' values;
 * characters the cipher does not know (spaces, digits, punctuation) count as 0.
 */
public abstract class GematriaCalculator {

    // Accents, breathings and vowel points left over after NFD decomposition
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    private final Map<Integer, Integer> mapping;

    protected GematriaCalculator() {
        Map<Integer, Integer> values = new HashMap<>();
        initializeMapping(values);
        this.mapping = Collections.unmodifiableMap(values);
    }

    /** Display name, also the cipher key used by formulas. */
    public abstract String getName();

    /**
     * Fills in the value of each letter, keyed by its upper-case code point.
     */
    protected abstract void initializeMapping(Map<Integer, Integer> values);

    public long calculate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        String normalized = normalize(text);
        long total = 0;
        for (int i = 0; i < normalized.length(); ) {
            int codePoint = normalized.codePointAt(i);
            Integer value = mapping.get(Character.toUpperCase(codePoint));
            if (value != null) {
                total += value;
            }
            i += Character.charCount(codePoint);
        }
        return total;
    }

    protected String normalize(String text) {
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("");
    }

    public Map<Integer, Integer> getMapping() {
        return mapping;
    }

    protected static void assign(Map<Integer, Integer> values, String letters, int... numbers) {
        int[] codePoints = letters.codePoints().toArray();
        if (codePoints.length != numbers.length) {
            throw new IllegalArgumentException("Letter and value counts differ for " + letters);
        }
        for (int i = 0; i < codePoints.length; i++) {
            values.put(codePoints[i], numbers[i]);
        }
    }
}
