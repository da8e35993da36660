package com.formulagrid.app.functions;

/**
 * Describes one parameter of a formula function for help and the formula wizard.
 */
public class ArgumentMetadata {

    private final String name;
    private final String description;
    private final String typeHint;   // "number", "text", "range", "any", "cipher"
    private final boolean optional;

    public ArgumentMetadata(String name, String description, String typeHint, boolean optional) {
        this.name = name;
        this.description = description;
        this.typeHint = typeHint;
        this.optional = optional;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getTypeHint() {
        return typeHint;
    }

    public boolean isOptional() {
        return optional;
    }
}
