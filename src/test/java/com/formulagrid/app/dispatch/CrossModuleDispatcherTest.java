package com.formulagrid.app.dispatch;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CrossModuleDispatcherTest {

    private CrossModuleDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new CrossModuleDispatcher();
    }

    @Test
    void testUnknownKeyIsUnknownOperation() {
        assertEquals("#CIPHER?", dispatcher.request("NOPE", "abc"));
        assertEquals("#CIPHER?", dispatcher.request(null, "abc"));
    }

    @Test
    void testRequestReachesHandlerCaseInsensitively() {
        dispatcher.register(new FixedHandler("Length", null));
        assertTrue(dispatcher.supports("LENGTH"));
        assertEquals(4, dispatcher.request("length", "abcd"));
        assertEquals(Collections.singleton("LENGTH"), dispatcher.getOperations());
    }

    @Test
    void testHandlerExceptionBecomesGenericError() {
        dispatcher.register(new FixedHandler("BOOM", new IllegalStateException("broken")));
        assertEquals("#ERROR!", dispatcher.request("BOOM", "x"));
    }

    @Test
    void testNullResultIsUnknownOperation() {
        dispatcher.register(new OperationHandler() {
            @Override
            public Set<String> supportedOperations() {
                return Collections.singleton("SILENT");
            }

            @Override
            public Object handle(String input, String operationKey) {
                return null;
            }
        });
        assertEquals("#CIPHER?", dispatcher.request("SILENT", "x"));
    }

    /**
     * A second handler for a taken key is rejected, and none of its keys are registered.
     */
    @Test
    void testDuplicateKeyIsRejected() {
        dispatcher.register(new FixedHandler("A", null));
        FixedHandler second = new FixedHandler("B", null);
        second.keys.add("a");
        assertThrows(IllegalStateException.class, () -> dispatcher.register(second));
        assertFalse(dispatcher.supports("B"));
    }

    private static class FixedHandler implements OperationHandler {
        final Set<String> keys = new LinkedHashSet<>();
        final RuntimeException failure;

        FixedHandler(String key, RuntimeException failure) {
            keys.add(key);
            this.failure = failure;
        }

        @Override
        public Set<String> supportedOperations() {
            return keys;
        }

        @Override
        public Object handle(String input, String operationKey) {
            if (failure != null) {
                throw failure;
            }
            return input.length();
        }
    }
}
