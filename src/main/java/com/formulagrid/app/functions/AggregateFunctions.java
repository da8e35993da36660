package com.formulagrid.app.functions;

import com.formulagrid.app.evaluation.Values;

import java.util.ArrayList;
import java.util.List;

/**
 * SUM, AVERAGE, COUNT, MIN, MAX. Arguments and ranges are flattened;
 * values that are not numeric (text, booleans, empty cells) are skipped.
 */
final class AggregateFunctions {

    private AggregateFunctions() {
    }

    static void registerAll(FunctionRegistry registry) {
        registry.register(variadic("SUM", "Adds its arguments.", "SUM(number1, ...)"),
                (evaluator, args) -> Values.number(sum(numbers(args))));

        registry.register(variadic("AVERAGE", "Average of its arguments.", "AVERAGE(number1, ...)"),
                (evaluator, args) -> {
                    List<Double> numbers = numbers(args);
                    return numbers.isEmpty() ? 0.0 : Values.number(sum(numbers) / numbers.size());
                });

        registry.register(variadic("COUNT", "Counts numeric values.", "COUNT(value1, ...)"),
                (evaluator, args) -> (double) numbers(args).size());

        registry.register(variadic("MIN", "Smallest numeric value.", "MIN(number1, ...)"),
                (evaluator, args) -> {
                    List<Double> numbers = numbers(args);
                    double min = Double.POSITIVE_INFINITY;
                    for (double n : numbers) {
                        min = Math.min(min, n);
                    }
                    return numbers.isEmpty() ? 0.0 : Values.number(min);
                });

        registry.register(variadic("MAX", "Largest numeric value.", "MAX(number1, ...)"),
                (evaluator, args) -> {
                    List<Double> numbers = numbers(args);
                    double max = Double.NEGATIVE_INFINITY;
                    for (double n : numbers) {
                        max = Math.max(max, n);
                    }
                    return numbers.isEmpty() ? 0.0 : Values.number(max);
                });
    }

    private static FunctionMetadata variadic(String name, String description, String syntax) {
        return FunctionMetadata.builder(name)
                .description(description)
                .syntax(syntax)
                .category("Math")
                .argument("value1", "Number, cell or range", "range")
                .optionalArgument("value2", "More values", "range")
                .variadic()
                .build();
    }

    private static List<Double> numbers(List<Object> args) {
        List<Double> numbers = new ArrayList<>();
        for (Object value : Values.flatten(args)) {
            Double number = Values.asNumberOrNull(value);
            if (number != null) {
                numbers.add(number);
            }
        }
        return numbers;
    }

    private static double sum(List<Double> numbers) {
        double total = 0;
        for (double n : numbers) {
            total += n;
        }
        return total;
    }
}
