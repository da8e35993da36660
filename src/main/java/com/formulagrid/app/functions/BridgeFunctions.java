package com.formulagrid.app.functions;

import com.formulagrid.app.dispatch.CrossModuleDispatcher;
import com.formulagrid.app.evaluation.FormulaError;
import com.formulagrid.app.evaluation.Values;

import java.util.Locale;

import static com.formulagrid.app.functions.FunctionSupport.arg;
import static com.formulagrid.app.functions.FunctionSupport.text;

/**
 * Functions answered by another subsystem through the evaluator's dispatcher.
 * The operation key is the cipher name; the subsystem is never referenced directly.
 */
final class BridgeFunctions {

    static final String DEFAULT_CIPHER = "English (TQ)";

    private BridgeFunctions() {
    }

    static void registerAll(FunctionRegistry registry) {
        registry.register(FunctionMetadata.builder("GEMATRIA")
                        .description("Numeric value of text under a gematria cipher.")
                        .syntax("GEMATRIA(text, [cipher])")
                        .category("Esoteric")
                        .argument("text", "Text or cell", "text")
                        .optionalArgument("cipher", "Cipher name (default " + DEFAULT_CIPHER + ")", "cipher")
                        .build(),
                (evaluator, args) -> {
                    String input = text(args, 0);
                    if (input.isEmpty()) {
                        return 0.0;
                    }
                    String cipher = arg(args, 1) == null ? DEFAULT_CIPHER : text(args, 1);
                    CrossModuleDispatcher dispatcher = evaluator.getDispatcher();
                    if (dispatcher == null) {
                        return FormulaError.UNKNOWN_OPERATION.sentinel();
                    }
                    Object result = dispatcher.request(cipher.toUpperCase(Locale.ROOT), input);
                    if (result instanceof Number) {
                        return Values.number(((Number) result).doubleValue());
                    }
                    return result;
                });
    }
}
