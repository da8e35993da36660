package com.formulagrid.app.formula.ast;

/**
 * A constant: Double, String, Boolean, or null for an omitted function argument.
 */
public final class LiteralNode implements Node {

    public static final LiteralNode OMITTED = new LiteralNode(null);

    private final Object value;

    public LiteralNode(Object value) {
        this.value = value;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value instanceof String ? "\"" + value + "\"" : String.valueOf(value);
    }
}
