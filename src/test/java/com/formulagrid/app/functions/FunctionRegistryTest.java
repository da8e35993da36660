package com.formulagrid.app.functions;

import com.formulagrid.app.dispatch.CrossModuleDispatcher;
import com.formulagrid.app.evaluation.EvaluationLimits;
import com.formulagrid.app.models.Grid;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FunctionRegistryTest {

    private FunctionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = FunctionRegistry.withBuiltins();
    }

    @Test
    void testLookupIsCaseInsensitive() {
        assertNotNull(registry.lookup("sum"));
        assertSame(registry.lookup("SUM"), registry.lookup("Sum"));
        assertNull(registry.lookup("NOPE"));
        assertFalse(registry.contains(null));
    }

    @Test
    void testDuplicateRegistrationFails() {
        FunctionMetadata metadata = FunctionMetadata.builder("sum").build();
        assertThrows(IllegalStateException.class,
                () -> registry.register(metadata, (evaluator, args) -> 0.0));
    }

    @Test
    void testMetadataIsSortedAndDescribesArity() {
        List<FunctionMetadata> all = registry.getAllMetadata();
        assertEquals(registry.size(), all.size());
        for (int i = 1; i < all.size(); i++) {
            assertTrue(all.get(i - 1).getName().compareTo(all.get(i).getName()) < 0);
        }

        FunctionMetadata round = registry.lookup("ROUND").getMetadata();
        assertEquals(1, round.getMinArgs());
        assertEquals(2, round.getMaxArgs());
        assertTrue(registry.lookup("IFERROR").getMetadata().isErrorHandling());
        assertTrue(registry.lookup("SUM").getMetadata().isVariadic());
    }

    /**
     * Functions added to a private registry are callable from formulas of grids using it.
     */
    @Test
    void testCustomFunction() {
        registry.register(FunctionMetadata.builder("DOUBLE")
                        .description("Twice the number.")
                        .argument("number", "Value", "number")
                        .build(),
                (evaluator, args) -> ((Double) args.get(0)) * 2);

        Grid grid = new Grid(5, 5, registry, new CrossModuleDispatcher(), EvaluationLimits.defaults());
        assertEquals(42.0, grid.evaluate("=double(21)"));
        assertEquals("#NAME?", new Grid(5, 5).evaluate("=DOUBLE(21)"));
    }
}
