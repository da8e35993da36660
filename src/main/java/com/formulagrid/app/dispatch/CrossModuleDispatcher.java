package com.formulagrid.app.dispatch;

import com.formulagrid.app.evaluation.FormulaError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Request/response bridge from formula functions to independently owned subsystems.
 *
 * A request is answered by exactly one handler, synchronously on the calling thread.
 * {@link #request(String, String)} never throws: a missing handler yields #CIPHER?,
 * a failing handler yields #ERROR!.
 * There is no timeout; a handler that never returns blocks the evaluation that called it.
 */
public class CrossModuleDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CrossModuleDispatcher.class);

    private final Map<String, OperationHandler> handlers = new ConcurrentHashMap<>();

    /**
     * Registers the handler for each of its operation keys.
     *
     * @throws IllegalStateException if a key already has a handler
     */
    public void register(OperationHandler handler) {
        for (String operation : handler.supportedOperations()) {
            OperationHandler existing = handlers.get(normalize(operation));
            if (existing != null) {
                throw new IllegalStateException("Operation '" + normalize(operation)
                        + "' already has a handler: " + existing.getClass().getSimpleName());
            }
        }
        for (String operation : handler.supportedOperations()) {
            handlers.put(normalize(operation), handler);
        }
        log.info("Registered {} for {} operation(s)", handler.getClass().getSimpleName(),
                handler.supportedOperations().size());
    }

    public Object request(String operationKey, String input) {
        if (operationKey == null) {
            return FormulaError.UNKNOWN_OPERATION.sentinel();
        }
        OperationHandler handler = handlers.get(normalize(operationKey));
        if (handler == null) {
            log.debug("No handler for operation '{}'", operationKey);
            return FormulaError.UNKNOWN_OPERATION.sentinel();
        }
        try {
            Object result = handler.handle(input, operationKey);
            return result != null ? result : FormulaError.UNKNOWN_OPERATION.sentinel();
        } catch (RuntimeException e) {
            log.warn("Handler {} failed for operation '{}'", handler.getClass().getSimpleName(), operationKey, e);
            return FormulaError.ERROR.sentinel();
        }
    }

    public boolean supports(String operationKey) {
        return operationKey != null && handlers.containsKey(normalize(operationKey));
    }

    public Set<String> getOperations() {
        return new TreeSet<>(handlers.keySet());
    }

    private static String normalize(String key) {
        return key.trim().toUpperCase(Locale.ROOT);
    }
}
