package com.stepwise.core.persistence;

import com.stepwise.core.state.RunState;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Query operations over the checkpoint store, keyed by run key (the LangGraph4j
 * thread id).
 */
@Service
public class CheckpointQueryService {

    private static final Logger log = LoggerFactory.getLogger(CheckpointQueryService.class);

    private final BaseCheckpointSaver saver;

    public CheckpointQueryService(BaseCheckpointSaver saver) {
        this.saver = saver;
    }

    /**
     * Returns every run key known to the store. Only supported for {@link MemorySaver},
     * whose internal map is read reflectively.
     */
    public List<String> listRunKeys() {
        if (saver instanceof MemorySaver mem) {
            try {
                var field = MemorySaver.class.getDeclaredField("_checkpointsByThread");
                field.setAccessible(true);
                @SuppressWarnings("unchecked")
                var map = (Map<String, ?>) field.get(mem);
                return new ArrayList<>(map.keySet());
            } catch (ReflectiveOperationException e) {
                log.warn("Unable to list run keys from MemorySaver", e);
                return List.of();
            }
        }
        return List.of();
    }

    public Collection<Checkpoint> listCheckpoints(String runKey) {
        return saver.list(config(runKey));
    }

    public Optional<Checkpoint> getLatestCheckpoint(String runKey) {
        return saver.get(config(runKey));
    }

    public boolean exists(String runKey) {
        return getLatestCheckpoint(runKey).isPresent();
    }

    /**
     * The run state stored by the most recent checkpoint for {@code runKey}.
     */
    public Optional<RunState> getLatestState(String runKey) {
        return getLatestCheckpoint(runKey).map(cp -> new RunState(cp.getState()));
    }

    private static RunnableConfig config(String runKey) {
        return RunnableConfig.builder().threadId(runKey).build();
    }
}
