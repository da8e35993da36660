package com.formulagrid.app.gematria;

import com.formulagrid.app.dispatch.OperationHandler;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Exposes every cipher of {@link GematriaService} as a dispatch operation keyed by cipher name.
 */
@Component
public class GematriaOperationHandler implements OperationHandler {

    private final GematriaService gematriaService;

    public GematriaOperationHandler(GematriaService gematriaService) {
        this.gematriaService = gematriaService;
    }

    @Override
    public Set<String> supportedOperations() {
        return new LinkedHashSet<>(gematriaService.getCipherNames());
    }

    @Override
    public Object handle(String input, String operationKey) {
        if (!gematriaService.hasCipher(operationKey)) {
            return null;
        }
        return gematriaService.calculate(input, operationKey);
    }
}
