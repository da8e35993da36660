package com.formulagrid.app.functions;

import com.formulagrid.app.evaluation.FormulaError;
import com.formulagrid.app.evaluation.RangeValue;
import com.formulagrid.app.evaluation.Values;

import static com.formulagrid.app.functions.FunctionSupport.arg;
import static com.formulagrid.app.functions.FunctionSupport.scalar;

/**
 * IF and the error-handling functions. IFERROR and ISERROR are the only
 * built-ins that receive error values instead of propagating them.
 */
final class LogicFunctions {

    private LogicFunctions() {
    }

    static void registerAll(FunctionRegistry registry) {
        registry.register(FunctionMetadata.builder("IF")
                        .description("Chooses a value by condition.")
                        .syntax("IF(condition, value_if_true, [value_if_false])")
                        .category("Logic")
                        .argument("condition", "Expression", "any")
                        .argument("value_if_true", "Result if true", "any")
                        .optionalArgument("value_if_false", "Result if false (default FALSE)", "any")
                        .build(),
                (evaluator, args) -> {
                    boolean condition = Values.toBoolean(scalar(arg(args, 0)));
                    if (condition) {
                        return scalar(arg(args, 1));
                    }
                    return args.size() > 2 ? scalar(arg(args, 2)) : Boolean.FALSE;
                });

        registry.register(FunctionMetadata.builder("IFERROR")
                        .description("Returns a fallback when the value is an error.")
                        .syntax("IFERROR(value, value_if_error)")
                        .category("Logic")
                        .argument("value", "Value to check", "any")
                        .argument("value_if_error", "Fallback", "any")
                        .handlesErrors()
                        .build(),
                (evaluator, args) -> {
                    Object value = arg(args, 0);
                    if (errorIn(value) != null) {
                        return scalar(arg(args, 1));
                    }
                    return value;
                });

        registry.register(FunctionMetadata.builder("ISERROR")
                        .description("TRUE when the value is an error.")
                        .syntax("ISERROR(value)")
                        .category("Logic")
                        .argument("value", "Value to check", "any")
                        .handlesErrors()
                        .build(),
                (evaluator, args) -> errorIn(arg(args, 0)) != null);
    }

    // For a range, the first error among its cells
    private static Object errorIn(Object value) {
        if (value instanceof RangeValue) {
            return ((RangeValue) value).firstError();
        }
        return FormulaError.isError(value) ? value : null;
    }
}
