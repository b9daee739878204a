package com.stepwise.core.events;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.stepwise.core.state.RunState;

import java.io.Serializable;

/**
 * Run progress counters attached to each event.
 */
public record StateSnapshot(
    @JsonProperty("iteration_count") int iterationCount,
    @JsonProperty("completed_count") long completedCount,
    @JsonProperty("total_subtasks") int totalSubtasks
) implements Serializable {

    public static StateSnapshot of(RunState state) {
        return new StateSnapshot(state.iterationCount(), state.completedCount(), state.subtasks().size());
    }
}
