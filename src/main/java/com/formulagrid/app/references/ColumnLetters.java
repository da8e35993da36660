package com.formulagrid.app.references;

/**
 * Converts between spreadsheet column letters and zero-based column indexes.
 * Letters use bijective base-26: A=1 ... Z=26, AA=27, so "A" is index 0,
 * "Z" is 25 and "AA" is 26.
 */
public final class ColumnLetters {

    private ColumnLetters() {
    }

    /**
     * Converts letters such as "A", "az" or "CV" to a zero-based index.
     * Throws IllegalArgumentException on empty input or non-letters.
     */
    public static int toIndex(String letters) {
        if (letters == null || letters.isEmpty()) {
            throw new IllegalArgumentException("Column letters must not be empty");
        }
        long index = 0;
        for (int i = 0; i < letters.length(); i++) {
            char c = Character.toUpperCase(letters.charAt(i));
            if (c < 'A' || c > 'Z') {
                throw new IllegalArgumentException("Invalid column letters: " + letters);
            }
            index = index * 26 + (c - 'A' + 1);
            if (index > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Column out of range: " + letters);
            }
        }
        return (int) index - 1;
    }

    /**
     * Converts a zero-based index back to its letters (0 -> "A", 26 -> "AA").
     */
    public static String toLetters(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Column index must not be negative: " + index);
        }
        StringBuilder letters = new StringBuilder();
        int remaining = index + 1;
        while (remaining > 0) {
            int rem = (remaining - 1) % 26;
            letters.append((char) ('A' + rem));
            remaining = (remaining - 1) / 26;
        }
        return letters.reverse().toString();
    }
}
