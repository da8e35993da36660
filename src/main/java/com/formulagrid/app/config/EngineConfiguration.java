package com.formulagrid.app.config;

import com.formulagrid.app.dispatch.CrossModuleDispatcher;
import com.formulagrid.app.dispatch.OperationHandler;
import com.formulagrid.app.functions.FunctionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires the engine's shared collaborators. Handlers from other subsystems are
 * discovered as {@link OperationHandler} beans, so the engine never names them.
 */
@Configuration
public class EngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

    @Bean
    public FunctionRegistry functionRegistry() {
        FunctionRegistry registry = FunctionRegistry.standard();
        log.info("Function registry ready with {} functions", registry.size());
        return registry;
    }

    @Bean
    public CrossModuleDispatcher crossModuleDispatcher(List<OperationHandler> handlers) {
        CrossModuleDispatcher dispatcher = new CrossModuleDispatcher();
        for (OperationHandler handler : handlers) {
            dispatcher.register(handler);
        }
        return dispatcher;
    }
}
