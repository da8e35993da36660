package com.formulagrid.app.formula.ast;

import java.util.Collections;
import java.util.List;

/**
 * Call of a named function. The name keeps the case it was written in;
 * lookup is case-insensitive.
 */
public final class FunctionCallNode implements Node {

    private final String name;
    private final List<Node> arguments;

    public FunctionCallNode(String name, List<Node> arguments) {
        this.name = name;
        this.arguments = Collections.unmodifiableList(arguments);
    }

    public String getName() {
        return name;
    }

    public List<Node> getArguments() {
        return arguments;
    }

    @Override
    public String toString() {
        return name + arguments;
    }
}
