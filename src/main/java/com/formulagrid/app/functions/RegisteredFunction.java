package com.formulagrid.app.functions;

public final class RegisteredFunction {

    private final FunctionMetadata metadata;
    private final FormulaFunction implementation;

    public RegisteredFunction(FunctionMetadata metadata, FormulaFunction implementation) {
        this.metadata = metadata;
        this.implementation = implementation;
    }

    public FunctionMetadata getMetadata() {
        return metadata;
    }

    public FormulaFunction getImplementation() {
        return implementation;
    }
}
