package com.formulagrid.app.dispatch;

import java.util.Set;

/**
 * Logic owned by another subsystem, reachable from formulas through
 * {@link CrossModuleDispatcher}. The engine only knows this interface.
 */
public interface OperationHandler {

    /**
     * Operation keys this handler answers. Matching is case-insensitive.
     */
    Set<String> supportedOperations();

    /**
     * Computes the result for {@code input}. Returning null means the key is not
     * recognized after all. Exceptions are caught by the dispatcher.
     */
    Object handle(String input, String operationKey);
}
