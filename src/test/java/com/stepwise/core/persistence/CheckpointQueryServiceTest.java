package com.stepwise.core.persistence;

import com.stepwise.core.state.RunState;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class CheckpointQueryServiceTest {

    @Test
    @DisplayName("unknown runs do not exist and have no state")
    void unknownRun() {
        var service = new CheckpointQueryService(new MemorySaver());

        assertFalse(service.exists("STEP-NONE"));
        assertTrue(service.getLatestState("STEP-NONE").isEmpty());
        assertTrue(service.listRunKeys().isEmpty());
    }

    @Test
    @DisplayName("latest state is read from the latest checkpoint")
    void latestState() {
        var saver = mock(BaseCheckpointSaver.class);
        var checkpoint = mock(Checkpoint.class);
        when(checkpoint.getState()).thenReturn(Map.of(RunState.RUN_KEY, "STEP-1", RunState.REQUEST, "List my accounts"));
        when(saver.get(any(RunnableConfig.class))).thenReturn(Optional.of(checkpoint));
        var service = new CheckpointQueryService(saver);

        assertTrue(service.exists("STEP-1"));
        RunState state = service.getLatestState("STEP-1").orElseThrow();
        assertEquals("STEP-1", state.runKey());
        assertEquals("List my accounts", state.request());
    }

    @Test
    @DisplayName("run keys can only be listed from the in-memory store")
    void listRunKeysOtherStore() {
        var service = new CheckpointQueryService(mock(BaseCheckpointSaver.class));

        assertTrue(service.listRunKeys().isEmpty());
    }
}
