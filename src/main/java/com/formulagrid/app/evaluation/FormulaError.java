package com.formulagrid.app.evaluation;

/**
 * Error kinds and the sentinel text each one evaluates to.
 * Any evaluated string that starts with '#' is an error; cells display the sentinel
 * and dependents receive it as input.
 */
public enum FormulaError {
    PARSE("#PARSE!", false),
    REF("#REF!", false),
    CYCLE("#CYCLE!", true),
    DEPTH("#DEPTH!", true),
    LIMIT("#LIMIT!", true),
    NAME("#NAME?", false),
    UNKNOWN_OPERATION("#CIPHER?", false),
    VALUE("#VALUE!", false),
    DIV_ZERO("#DIV/0!", false),
    NUM("#NUM!", false),
    ERROR("#ERROR!", false);

    private final String sentinel;
    private final boolean guard;

    FormulaError(String sentinel, boolean guard) {
        this.sentinel = sentinel;
        this.guard = guard;
    }

    public String sentinel() {
        return sentinel;
    }

    /**
     * True for errors raised by a resource guard (cycle, depth, evaluation budget)
     * rather than by the computation itself.
     */
    public boolean isGuard() {
        return guard;
    }

    public static boolean isError(Object value) {
        return value instanceof String && ((String) value).startsWith("#");
    }

    /**
     * Maps a sentinel back to its kind; unknown '#' strings count as ERROR.
     * Returns null for values that are not errors.
     */
    public static FormulaError fromValue(Object value) {
        if (!isError(value)) {
            return null;
        }
        for (FormulaError error : values()) {
            if (error.sentinel.equals(value)) {
                return error;
            }
        }
        return ERROR;
    }

    public static boolean isGuardError(Object value) {
        FormulaError error = fromValue(value);
        return error != null && error.isGuard();
    }
}
