package com.formulagrid.app.functions;

import com.formulagrid.app.evaluation.Values;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.formulagrid.app.functions.FunctionSupport.arg;
import static com.formulagrid.app.functions.FunctionSupport.integer;
import static com.formulagrid.app.functions.FunctionSupport.text;
import static com.formulagrid.app.functions.FunctionSupport.valueError;

/**
 * String functions. Positions are 1-based, as users write them.
 */
final class TextFunctions {

    private TextFunctions() {
    }

    static void registerAll(FunctionRegistry registry) {
        registry.register(single("LEN", "Length of text."),
                (evaluator, args) -> (double) text(args, 0).length());
        registry.register(single("UPPER", "Converts to upper case."),
                (evaluator, args) -> text(args, 0).toUpperCase(Locale.ROOT));
        registry.register(single("LOWER", "Converts to lower case."),
                (evaluator, args) -> text(args, 0).toLowerCase(Locale.ROOT));
        registry.register(single("PROPER", "Capitalizes each word."),
                (evaluator, args) -> proper(text(args, 0)));
        registry.register(single("TRIM", "Removes outer spaces and collapses inner runs to one."),
                (evaluator, args) -> text(args, 0).trim().replaceAll("\\s+", " "));

        registry.register(FunctionMetadata.builder("LEFT")
                        .description("First characters of text.")
                        .syntax("LEFT(text, [count])")
                        .category("Text")
                        .argument("text", "Text", "text")
                        .optionalArgument("count", "Characters (default 1)", "number")
                        .build(),
                (evaluator, args) -> {
                    String s = text(args, 0);
                    int count = nonNegative(integer(args, 1, 1));
                    return s.substring(0, Math.min(count, s.length()));
                });

        registry.register(FunctionMetadata.builder("RIGHT")
                        .description("Last characters of text.")
                        .syntax("RIGHT(text, [count])")
                        .category("Text")
                        .argument("text", "Text", "text")
                        .optionalArgument("count", "Characters (default 1)", "number")
                        .build(),
                (evaluator, args) -> {
                    String s = text(args, 0);
                    int count = nonNegative(integer(args, 1, 1));
                    return s.substring(Math.max(0, s.length() - count));
                });

        registry.register(FunctionMetadata.builder("MID")
                        .description("Characters from the middle of text.")
                        .syntax("MID(text, start, count)")
                        .category("Text")
                        .argument("text", "Text", "text")
                        .argument("start", "Start position (1-based)", "number")
                        .argument("count", "Characters", "number")
                        .build(),
                (evaluator, args) -> {
                    String s = text(args, 0);
                    int start = integer(args, 1, 1) - 1;
                    int count = nonNegative(integer(args, 2, 0));
                    if (start < 0) {
                        throw valueError("MID start must be at least 1");
                    }
                    if (start >= s.length()) {
                        return "";
                    }
                    return s.substring(start, (int) Math.min((long) start + count, s.length()));
                });

        registry.register(FunctionMetadata.builder("REPLACE")
                        .description("Replaces part of text by position.")
                        .syntax("REPLACE(text, start, count, new_text)")
                        .category("Text")
                        .argument("old_text", "Text", "text")
                        .argument("start", "Start position (1-based)", "number")
                        .argument("count", "Characters to replace", "number")
                        .argument("new_text", "Replacement", "text")
                        .build(),
                (evaluator, args) -> {
                    String s = text(args, 0);
                    int start = integer(args, 1, 1) - 1;
                    int count = nonNegative(integer(args, 2, 0));
                    if (start < 0) {
                        throw valueError("REPLACE start must be at least 1");
                    }
                    int from = Math.min(start, s.length());
                    int to = (int) Math.min((long) from + count, s.length());
                    return s.substring(0, from) + text(args, 3) + s.substring(to);
                });

        registry.register(FunctionMetadata.builder("SUBSTITUTE")
                        .description("Replaces occurrences of text, or only the n-th one.")
                        .syntax("SUBSTITUTE(text, old_text, new_text, [instance])")
                        .category("Text")
                        .argument("text", "Text", "text")
                        .argument("old_text", "Text to find", "text")
                        .argument("new_text", "Replacement", "text")
                        .optionalArgument("instance", "Occurrence to replace", "number")
                        .build(),
                (evaluator, args) -> substitute(text(args, 0), text(args, 1), text(args, 2),
                        arg(args, 3) == null ? null : (Integer) integer(args, 3, 0)));

        registry.register(FunctionMetadata.builder("CONCAT")
                        .description("Joins text.")
                        .syntax("CONCAT(text1, ...)")
                        .category("Text")
                        .argument("text1", "Text, cell or range", "range")
                        .optionalArgument("text2", "More text", "range")
                        .variadic()
                        .build(),
                (evaluator, args) -> {
                    StringBuilder joined = new StringBuilder();
                    for (Object value : Values.flatten(args)) {
                        joined.append(Values.toText(value));
                    }
                    return joined.toString();
                });

        registry.register(FunctionMetadata.builder("TEXTJOIN")
                        .description("Joins text with a delimiter.")
                        .syntax("TEXTJOIN(delimiter, ignore_empty, text1, ...)")
                        .category("Text")
                        .argument("delimiter", "Delimiter", "text")
                        .argument("ignore_empty", "Skip empty values (default TRUE)", "any")
                        .argument("text1", "Text, cell or range", "range")
                        .variadic()
                        .build(),
                (evaluator, args) -> {
                    String delimiter = text(args, 0);
                    Object ignore = arg(args, 1);
                    boolean skipEmpty = ignore == null || Values.toBoolean(FunctionSupport.scalar(ignore));
                    List<String> parts = new ArrayList<>();
                    for (Object value : Values.flatten(args.subList(2, args.size()))) {
                        String s = Values.toText(value);
                        if (skipEmpty && s.isEmpty()) {
                            continue;
                        }
                        parts.add(s);
                    }
                    return String.join(delimiter, parts);
                });
    }

    private static FunctionMetadata single(String name, String description) {
        return FunctionMetadata.builder(name)
                .description(description)
                .syntax(name + "(text)")
                .category("Text")
                .argument("text", "Text", "text")
                .build();
    }

    private static int nonNegative(int count) {
        if (count < 0) {
            throw valueError("Character count must not be negative");
        }
        return count;
    }

    static String proper(String s) {
        StringBuilder out = new StringBuilder(s.length());
        boolean startOfWord = true;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isLetter(c)) {
                out.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                out.append(c);
                startOfWord = true;
            }
        }
        return out.toString();
    }

    // null instance replaces every occurrence
    static String substitute(String s, String oldText, String newText, Integer instance) {
        if (oldText.isEmpty()) {
            return s;
        }
        if (instance == null) {
            return s.replace(oldText, newText);
        }
        if (instance < 1) {
            throw valueError("SUBSTITUTE instance must be at least 1");
        }
        int index = -1;
        for (int found = 0; found < instance; found++) {
            index = s.indexOf(oldText, index + 1);
            if (index < 0) {
                return s;
            }
        }
        return s.substring(0, index) + newText + s.substring(index + oldText.length());
    }
}
