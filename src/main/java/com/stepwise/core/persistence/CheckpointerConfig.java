package com.stepwise.core.persistence;

import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the LangGraph4j {@link BaseCheckpointSaver} that stores run state under
 * each run key after every step. A saver bean defined elsewhere takes precedence.
 */
@Configuration
public class CheckpointerConfig {

    private static final Logger log = LoggerFactory.getLogger(CheckpointerConfig.class);

    /**
     * In-memory checkpoint saver. Runs can be resumed within the same process;
     * state is lost on restart.
     */
    @Bean
    @ConditionalOnMissingBean(BaseCheckpointSaver.class)
    public BaseCheckpointSaver memoryCheckpointSaver() {
        log.info("Using in-memory checkpoint saver (run state will not persist across restarts)");
        return new MemorySaver();
    }
}
