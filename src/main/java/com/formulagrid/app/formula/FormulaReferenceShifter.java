package com.formulagrid.app.formula;

import com.formulagrid.app.references.ColumnLetters;

import java.util.List;
import java.util.regex.Matcher;

import static com.formulagrid.app.references.CellAddress.A1_PATTERN;

/**
 * Rewrites relative cell references inside formula text when a formula is copied
 * to another cell. Absolute parts ($A, $1) stay put. Shifted references are clamped
 * at row 1 and column A.
 *
 * Structural edits (insert/remove rows or columns) do not use this: they move cells
 * without touching formula text.
 */
public final class FormulaReferenceShifter {

    private FormulaReferenceShifter() {
    }

    /**
     * Returns {@code raw} with every relative reference moved by the deltas.
     * Text that is not a formula is returned unchanged, as is a formula that does not tokenize.
     */
    public static String adjust(String raw, int rowDelta, int colDelta) {
        if (raw == null || !raw.startsWith("=")) {
            return raw;
        }
        String body = raw.substring(1);
        List<Token> tokens;
        try {
            tokens = Tokenizer.tokenize(body);
        } catch (FormulaParseException e) {
            return raw;
        }

        StringBuilder out = new StringBuilder("=");
        int copied = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.getType() != TokenType.IDENTIFIER) {
                continue;
            }
            boolean functionName = tokens.get(i + 1).getType() == TokenType.LPAREN;
            if (functionName) {
                continue;
            }
            String shifted = shiftReference(token.getText(), rowDelta, colDelta);
            out.append(body, copied, token.getStart()).append(shifted);
            copied = token.getEnd();
        }
        out.append(body.substring(copied));
        return out.toString();
    }

    static String shiftReference(String ref, int rowDelta, int colDelta) {
        Matcher matcher = A1_PATTERN.matcher(ref);
        if (!matcher.matches()) {
            return ref;
        }
        String absCol = matcher.group(1);
        String letters = matcher.group(2).toUpperCase();
        String absRow = matcher.group(3);
        String digits = matcher.group(4);

        try {
            if (absCol.isEmpty()) {
                long col = Math.max(0L, (long) ColumnLetters.toIndex(letters) + colDelta);
                letters = ColumnLetters.toLetters((int) Math.min(col, Integer.MAX_VALUE - 1));
            }
            if (absRow.isEmpty()) {
                long row = Math.max(1L, Long.parseLong(digits) + rowDelta);
                digits = Long.toString(row);
            }
        } catch (IllegalArgumentException e) {
            // out-of-range identifier, the evaluator reports it as #PARSE!
            return ref;
        }
        return absCol + letters + absRow + digits;
    }
}
