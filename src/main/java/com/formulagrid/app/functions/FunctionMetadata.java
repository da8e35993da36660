package com.formulagrid.app.functions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Name, documentation and arity of a registered function.
 * Built with {@link #builder(String)}.
 */
public class FunctionMetadata {

    private final String name;
    private final String description;
    private final String syntax;
    private final String category;
    private final List<ArgumentMetadata> arguments;
    private final boolean variadic;
    private final boolean errorHandling;

    private FunctionMetadata(Builder builder) {
        this.name = builder.name.toUpperCase(Locale.ROOT);
        this.description = builder.description;
        this.syntax = builder.syntax;
        this.category = builder.category;
        this.arguments = Collections.unmodifiableList(new ArrayList<>(builder.arguments));
        this.variadic = builder.variadic;
        this.errorHandling = builder.errorHandling;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getSyntax() {
        return syntax;
    }

    public String getCategory() {
        return category;
    }

    public List<ArgumentMetadata> getArguments() {
        return arguments;
    }

    public boolean isVariadic() {
        return variadic;
    }

    /**
     * True when the function receives error values as arguments instead of
     * short-circuiting to the first one (IFERROR, ISERROR).
     */
    public boolean isErrorHandling() {
        return errorHandling;
    }

    public int getMinArgs() {
        int required = 0;
        for (ArgumentMetadata argument : arguments) {
            if (!argument.isOptional()) {
                required++;
            }
        }
        return required;
    }

    public int getMaxArgs() {
        return variadic ? Integer.MAX_VALUE : arguments.size();
    }

    public static class Builder {
        private final String name;
        private String description = "";
        private String syntax = "";
        private String category = "General";
        private final List<ArgumentMetadata> arguments = new ArrayList<>();
        private boolean variadic;
        private boolean errorHandling;

        private Builder(String name) {
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder syntax(String syntax) {
            this.syntax = syntax;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder argument(String name, String description, String typeHint) {
            arguments.add(new ArgumentMetadata(name, description, typeHint, false));
            return this;
        }

        public Builder optionalArgument(String name, String description, String typeHint) {
            arguments.add(new ArgumentMetadata(name, description, typeHint, true));
            return this;
        }

        public Builder variadic() {
            this.variadic = true;
            return this;
        }

        public Builder handlesErrors() {
            this.errorHandling = true;
            return this;
        }

        public FunctionMetadata build() {
            return new FunctionMetadata(this);
        }
    }
}
