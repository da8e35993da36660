package com.formulagrid.app.functions;

import com.formulagrid.app.evaluation.FormulaError;
import com.formulagrid.app.evaluation.Values;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.function.DoubleUnaryOperator;

import static com.formulagrid.app.functions.FunctionSupport.integer;
import static com.formulagrid.app.functions.FunctionSupport.number;

/**
 * Scalar math and trigonometry.
 */
final class MathFunctions {

    // A double has no digits beyond these scales, so larger ones change nothing
    static final int MAX_ROUND_DIGITS = 340;

    private MathFunctions() {
    }

    static void registerAll(FunctionRegistry registry) {
        unary(registry, "ABS", "Absolute value.", "Math", Math::abs);
        unary(registry, "FLOOR", "Rounds down to an integer.", "Math", Math::floor);
        unary(registry, "CEILING", "Rounds up to an integer.", "Math", Math::ceil);
        // INT truncates toward zero
        unary(registry, "INT", "Integer part.", "Math", v -> v < 0 ? Math.ceil(v) : Math.floor(v));
        unary(registry, "SQRT", "Square root.", "Math", Math::sqrt);
        unary(registry, "LN", "Natural logarithm.", "Math", Math::log);
        unary(registry, "LOG10", "Base 10 logarithm.", "Math", Math::log10);
        unary(registry, "SIN", "Sine of an angle in radians.", "Trig", Math::sin);
        unary(registry, "COS", "Cosine of an angle in radians.", "Trig", Math::cos);
        unary(registry, "TAN", "Tangent of an angle in radians.", "Trig", Math::tan);
        unary(registry, "ASIN", "Arc sine.", "Trig", Math::asin);
        unary(registry, "ACOS", "Arc cosine.", "Trig", Math::acos);
        unary(registry, "ATAN", "Arc tangent.", "Trig", Math::atan);

        registry.register(FunctionMetadata.builder("ROUND")
                        .description("Rounds a number half away from zero.")
                        .syntax("ROUND(number, [digits])")
                        .category("Math")
                        .argument("number", "Value", "number")
                        .optionalArgument("digits", "Decimals (default 0)", "number")
                        .build(),
                (evaluator, args) -> {
                    double value = number(args, 0);
                    int digits = integer(args, 1, 0);
                    if (Double.isNaN(value) || Double.isInfinite(value)) {
                        return FormulaError.NUM.sentinel();
                    }
                    int scale = Math.max(-MAX_ROUND_DIGITS, Math.min(MAX_ROUND_DIGITS, digits));
                    return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
                });

        registry.register(FunctionMetadata.builder("POWER")
                        .description("Raises a base to an exponent.")
                        .syntax("POWER(base, exponent)")
                        .category("Math")
                        .argument("base", "Base", "number")
                        .argument("exponent", "Exponent", "number")
                        .build(),
                (evaluator, args) -> Values.number(Math.pow(number(args, 0), number(args, 1))));

        registry.register(FunctionMetadata.builder("MOD")
                        .description("Remainder of a division, with the sign of the divisor.")
                        .syntax("MOD(number, divisor)")
                        .category("Math")
                        .argument("number", "Number", "number")
                        .argument("divisor", "Divisor", "number")
                        .build(),
                (evaluator, args) -> {
                    double n = number(args, 0);
                    double d = number(args, 1);
                    if (d == 0) {
                        return FormulaError.DIV_ZERO.sentinel();
                    }
                    return Values.number(n - d * Math.floor(n / d));
                });

        registry.register(FunctionMetadata.builder("PI")
                        .description("The constant pi.")
                        .syntax("PI()")
                        .category("Math")
                        .build(),
                (evaluator, args) -> Math.PI);
    }

    private static void unary(FunctionRegistry registry, String name, String description, String category,
                              DoubleUnaryOperator operation) {
        registry.register(FunctionMetadata.builder(name)
                        .description(description)
                        .syntax(name + "(number)")
                        .category(category)
                        .argument("number", "Value", "number")
                        .build(),
                (evaluator, args) -> Values.number(operation.applyAsDouble(number(args, 0))));
    }
}
