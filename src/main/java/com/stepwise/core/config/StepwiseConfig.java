package com.stepwise.core.config;

import com.stepwise.core.graph.Router;
import com.stepwise.core.tools.ToolCatalog;
import com.stepwise.core.tools.ToolExecutionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Beans shared by every run: the tool catalog discovered at startup and the router.
 */
@Configuration
public class StepwiseConfig {

    private static final Logger log = LoggerFactory.getLogger(StepwiseConfig.class);

    /**
     * Discovers the available tools once. An unreachable tool server yields an empty
     * catalog, so runs still start and fail through the normal recovery path.
     */
    @Bean
    public ToolCatalog toolCatalog(ToolExecutionService toolService) {
        try {
            return ToolCatalog.of(toolService);
        } catch (RuntimeException e) {
            log.warn("Tool discovery failed, starting with an empty tool catalog: {}", e.getMessage());
            return new ToolCatalog(List.of());
        }
    }

    @Bean
    public Router router(StepwiseProperties properties) {
        return new Router(properties.getValidation().getTool());
    }
}
