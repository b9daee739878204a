package com.stepwise.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stepwise.core.config.StepwiseProperties;
import com.stepwise.core.events.EventBus;
import com.stepwise.core.events.EventType;
import com.stepwise.core.events.ProgressEventTranslator;
import com.stepwise.core.events.RunEvent;
import com.stepwise.core.graph.Router;
import com.stepwise.core.graph.StepwiseGraph;
import com.stepwise.core.metrics.StepwiseMetrics;
import com.stepwise.core.model.RunOutcome;
import com.stepwise.core.model.SubtaskStatus;
import com.stepwise.core.model.ToolDescriptor;
import com.stepwise.core.nodes.DecomposeNode;
import com.stepwise.core.nodes.ExecuteStepNode;
import com.stepwise.core.nodes.RecoverNode;
import com.stepwise.core.nodes.SynthesizeNode;
import com.stepwise.core.nodes.ValidateNode;
import com.stepwise.core.oracle.OracleResponseParser;
import com.stepwise.core.oracle.ReasoningOracle;
import com.stepwise.core.persistence.CheckpointQueryService;
import com.stepwise.core.state.RunState;
import com.stepwise.core.tools.ToolCatalog;
import com.stepwise.core.tools.ToolExecutionService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link RunEngine} over a real graph, a {@link MemorySaver}, a mocked
 * oracle and a mocked tool service.
 */
class RunEngineTest {

    private static final List<String> TOOLS = List.of("get_all_accounts", "get_positions");

    private ReasoningOracle oracle;
    private ToolExecutionService tools;
    private SimpleMeterRegistry registry;
    private EventBus eventBus;
    private CheckpointQueryService checkpoints;
    private RunEngine engine;
    private final List<RunEvent> events = new CopyOnWriteArrayList<>();

    /** When set, the step executor's oracle call fails with an unexpected exception. */
    private final AtomicBoolean breakExecution = new AtomicBoolean(false);

    @BeforeEach
    void setUp() throws Exception {
        oracle = mock(ReasoningOracle.class);
        tools = mock(ToolExecutionService.class);
        registry = new SimpleMeterRegistry();
        eventBus = new EventBus();
        var saver = new MemorySaver();
        checkpoints = new CheckpointQueryService(saver);

        var properties = new StepwiseProperties();
        var parser = new OracleResponseParser(new ObjectMapper());
        var metrics = new StepwiseMetrics(registry);
        var catalog = new ToolCatalog(TOOLS.stream().map(t -> new ToolDescriptor(t, "", List.of())).toList());
        var graph = new StepwiseGraph(
                new DecomposeNode(oracle, parser, catalog, properties),
                new ExecuteStepNode(oracle, parser, tools, catalog, metrics, new ObjectMapper()),
                new ValidateNode(tools, metrics, properties),
                new RecoverNode(metrics),
                new SynthesizeNode(oracle, properties),
                new Router(properties.getValidation().getTool()),
                properties,
                saver);
        engine = new RunEngine(graph, checkpoints, new ProgressEventTranslator(), eventBus, metrics,
                catalog, tools, properties);

        when(oracle.decide(anyString(), anyString())).thenAnswer(invocation -> {
            String instruction = invocation.getArgument(0);
            if (instruction.contains("break a user's request")) {
                return "[{\"id\": \"task_1\", \"description\": \"List accounts\", \"tools\": [\"get_all_accounts\"]}]";
            }
            if (instruction.contains("executing one subtask")) {
                if (breakExecution.get()) {
                    throw new IllegalStateException("oracle client crashed");
                }
                return "{\"tool\": \"get_all_accounts\"}";
            }
            return "Accounts: 7, 8";
        });
        when(tools.invoke(anyString(), anyMap())).thenReturn("[7, 8]");
        eventBus.subscribeAll(events::add);
    }

    private long count(EventType type) {
        return events.stream().filter(e -> e.eventType() == type).count();
    }

    // ===================================================================
    //  Run
    // ===================================================================

    @Nested
    @DisplayName("run")
    class Run {

        @Test
        @DisplayName("produces a final answer and streams events in order")
        void completes() {
            var state = engine.run("List my accounts", new RunOptions("STEP-A", null, null));

            assertEquals("Accounts: 7, 8", state.finalAnswer().orElseThrow());
            assertEquals(RunOutcome.COMPLETED, state.outcome());
            assertEquals(15, state.maxIterations());
            assertEquals(3, state.maxRetries());
            assertEquals(TOOLS, state.availableTools());

            assertEquals(1, count(EventType.DONE));
            assertEquals(1, count(EventType.FINAL_ANSWER));
            assertEquals(1, count(EventType.TOOL_EXECUTION));
            assertEquals(0, count(EventType.ERROR));
            assertEquals(EventType.DONE, events.get(events.size() - 1).eventType());
            assertEquals(EventType.FINAL_ANSWER, events.get(events.size() - 2).eventType());
            assertTrue(events.stream().allMatch(e -> "STEP-A".equals(e.runKey())));
            assertEquals(1.0, registry.counter("stepwise.runs.total", "outcome", "COMPLETED").count());
        }

        @Test
        @DisplayName("honours per-run limits")
        void perRunLimits() {
            var state = engine.run("List my accounts", new RunOptions("STEP-B", 2, 1));

            assertEquals(2, state.maxIterations());
            assertEquals(1, state.maxRetries());
            assertTrue(state.isFinished());
        }

        @Test
        @DisplayName("generates a run key when none is given")
        void generatedKey() {
            var state = engine.run("List my accounts");

            assertTrue(state.runKey().startsWith("STEP-"));
            assertTrue(checkpoints.exists(state.runKey()));
        }

        @Test
        @DisplayName("rejects a run key that is already in use")
        void keyReuse() {
            engine.run("List my accounts", new RunOptions("STEP-C", null, null));

            var ex = assertThrows(IllegalStateException.class,
                    () -> engine.run("Again", new RunOptions("STEP-C", null, null)));
            assertTrue(ex.getMessage().contains("STEP-C"));
        }

        @Test
        @DisplayName("an engine failure publishes one error event and throws")
        void failure() {
            breakExecution.set(true);

            var ex = assertThrows(RunFailedException.class,
                    () -> engine.run("List my accounts", new RunOptions("STEP-D", null, null)));

            assertEquals("STEP-D", ex.getRunKey());
            assertEquals(1, count(EventType.ERROR));
            assertEquals(0, count(EventType.DONE));
        }
    }

    // ===================================================================
    //  Resume
    // ===================================================================

    @Nested
    @DisplayName("resume")
    class Resume {

        @Test
        @DisplayName("continues an interrupted run from its checkpoint")
        void continuesInterruptedRun() {
            breakExecution.set(true);
            assertThrows(RunFailedException.class,
                    () -> engine.run("List my accounts", new RunOptions("STEP-R", null, null)));
            var saved = engine.getState("STEP-R").orElseThrow();
            assertFalse(saved.isFinished());
            assertEquals(1, saved.subtasks().size());

            breakExecution.set(false);
            var state = engine.resume("STEP-R");

            assertTrue(state.isFinished());
            assertEquals(SubtaskStatus.COMPLETED, state.subtasks().get(0).status());
            assertEquals(1, state.subtasks().size());
            assertEquals(1, count(EventType.DONE));
        }

        @Test
        @DisplayName("returns a finished run unchanged")
        void finishedRun() {
            var first = engine.run("List my accounts", new RunOptions("STEP-F", null, null));
            events.clear();

            var again = engine.resume("STEP-F");

            assertEquals(first.finalAnswer(), again.finalAnswer());
            assertTrue(events.isEmpty());
        }

        @Test
        @DisplayName("rejects an unknown run key")
        void unknownRun() {
            assertThrows(IllegalStateException.class, () -> engine.resume("STEP-NONE"));
        }
    }

    @Test
    @DisplayName("run options reject non-positive budgets")
    void optionValidation() {
        assertThrows(IllegalArgumentException.class, () -> new RunOptions(null, 0, null));
        assertThrows(IllegalArgumentException.class, () -> new RunOptions(null, null, -1));
    }

    @Test
    @DisplayName("an iteration budget without headroom under the graph step limit is rejected before the run starts")
    void budgetAboveGraphStepLimit() {
        var ex = assertThrows(IllegalArgumentException.class,
                () -> engine.run("List my accounts", new RunOptions("STEP-BIG", 150, null)));

        assertTrue(ex.getMessage().contains("graph step limit 100"));
        assertFalse(checkpoints.exists("STEP-BIG"));
        assertTrue(events.isEmpty());
        verify(oracle, never()).decide(anyString(), anyString());
    }

    @Test
    @DisplayName("checkOptions resolves the budget and allows it up to the headroom")
    void checkOptions() {
        assertEquals(15, engine.checkOptions(RunOptions.defaults()));
        assertEquals(100 - RunEngine.GRAPH_STEP_HEADROOM,
                engine.checkOptions(new RunOptions(null, 100 - RunEngine.GRAPH_STEP_HEADROOM, null)));
        assertThrows(IllegalArgumentException.class,
                () -> engine.checkOptions(new RunOptions(null, 101 - RunEngine.GRAPH_STEP_HEADROOM, null)));
    }

    @Test
    @DisplayName("close shuts the tool service")
    void closeDelegates() throws Exception {
        engine.close();
        verify(tools).close();
    }
}
