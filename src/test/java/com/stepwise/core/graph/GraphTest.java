package com.stepwise.core.graph;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stepwise.core.config.StepwiseProperties;
import com.stepwise.core.logging.MdcContext;
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
import com.stepwise.core.state.RunState;
import com.stepwise.core.tools.ToolCatalog;
import com.stepwise.core.tools.ToolExecutionService;
import com.stepwise.core.tools.ToolInvocationException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Runs the compiled graph end to end with real nodes, a mocked oracle and a mocked
 * tool service.
 */
class GraphTest {

    private static final String CALC = "calculate_hypothetical_pnl";
    private static final List<String> TOOLS = List.of("get_all_accounts", "get_positions", CALC);

    private ReasoningOracle oracle;
    private ToolExecutionService tools;
    private StepwiseProperties properties;

    @BeforeEach
    void setUp() {
        oracle = mock(ReasoningOracle.class);
        tools = mock(ToolExecutionService.class);
        properties = new StepwiseProperties();
    }

    private StepwiseGraph graph(BaseCheckpointSaver saver) throws Exception {
        var parser = new OracleResponseParser(new ObjectMapper());
        var metrics = new StepwiseMetrics(new SimpleMeterRegistry());
        var catalog = new ToolCatalog(TOOLS.stream().map(t -> new ToolDescriptor(t, "", List.of())).toList());
        return new StepwiseGraph(
                new DecomposeNode(oracle, parser, catalog, properties),
                new ExecuteStepNode(oracle, parser, tools, catalog, metrics, new ObjectMapper()),
                new ValidateNode(tools, metrics, properties),
                new RecoverNode(metrics),
                new SynthesizeNode(oracle, properties),
                new Router(CALC),
                properties,
                saver);
    }

    /**
     * Answers each node's oracle call by recognising its instruction.
     */
    private void oracleAnswers(String plan, String toolDecision) {
        when(oracle.decide(anyString(), anyString())).thenAnswer(invocation -> {
            String instruction = invocation.getArgument(0);
            if (instruction.contains("break a user's request")) {
                return plan;
            }
            if (instruction.contains("executing one subtask")) {
                return toolDecision;
            }
            return "Final answer";
        });
    }

    private RunState run(StepwiseGraph graph, int maxIterations) throws Exception {
        var input = RunState.initial("STEP-T", "Show P&L for account 7", TOOLS, maxIterations, 3);
        var result = graph.getCompiledGraph().invoke(input, RunnableConfig.builder().threadId("STEP-T").build());
        assertTrue(result.isPresent(), "Graph should produce a result");
        return result.get();
    }

    // ===================================================================
    //  Compilation
    // ===================================================================

    @Test
    @DisplayName("Graph compiles without a checkpoint saver")
    void graphCompiles() throws Exception {
        assertNotNull(graph(null).getCompiledGraph());
    }

    // ===================================================================
    //  Full runs
    // ===================================================================

    @Test
    @DisplayName("single subtask runs decompose, execute and synthesize")
    void happyPath() throws Exception {
        oracleAnswers("[{\"id\": \"task_1\", \"description\": \"List accounts\", \"tools\": [\"get_all_accounts\"]}]",
                "{\"tool\": \"get_all_accounts\", \"arguments\": {}}");
        when(tools.invoke(eq("get_all_accounts"), anyMap())).thenReturn("[7, 8]");

        var state = run(graph(null), 15);

        assertEquals("Final answer", state.finalAnswer().orElseThrow());
        assertEquals(RunOutcome.COMPLETED, state.outcome());
        assertEquals(3, state.iterationCount());
        assertEquals(List.of("task_1"), state.completedIds());
        assertEquals("[7, 8]", state.resultsBySubtask().get("task_1"));
    }

    @Test
    @DisplayName("log context names the step that is running")
    void stepInLogContext() throws Exception {
        var steps = new CopyOnWriteArrayList<String>();
        when(oracle.decide(anyString(), anyString())).thenAnswer(invocation -> {
            steps.add(MDC.get("step"));
            String instruction = invocation.getArgument(0);
            if (instruction.contains("break a user's request")) {
                return "[{\"id\": \"task_1\", \"description\": \"List accounts\", \"tools\": [\"get_all_accounts\"]}]";
            }
            if (instruction.contains("executing one subtask")) {
                return "{\"tool\": \"get_all_accounts\"}";
            }
            return "Final answer";
        });
        when(tools.invoke(anyString(), anyMap())).thenReturn("[7]");

        try {
            run(graph(null), 15);
        } finally {
            MdcContext.clear();
        }

        assertEquals(List.of("decompose", "execute", "synthesize"), steps);
    }

    @Test
    @DisplayName("fallback plan when the oracle returns no subtasks")
    void fallbackPlan() throws Exception {
        oracleAnswers("[]", "{\"tool\": \"get_all_accounts\"}");
        when(tools.invoke(anyString(), anyMap())).thenReturn("ok");

        var state = run(graph(null), 15);

        assertEquals(1, state.subtasks().size());
        assertEquals("task_1", state.subtasks().get(0).id());
        assertEquals(TOOLS, state.subtasks().get(0).candidateTools());
        assertEquals(SubtaskStatus.COMPLETED, state.subtasks().get(0).status());
    }

    @Test
    @DisplayName("a failure retried once by tier 0 ends completed with two executions")
    void retryOnceThenSucceed() throws Exception {
        oracleAnswers("[{\"id\": \"task_1\", \"description\": \"List accounts\", \"tools\": [\"get_all_accounts\"]}]",
                "{\"tool\": \"get_all_accounts\"}");
        when(tools.invoke(eq("get_all_accounts"), anyMap()))
                .thenThrow(new ToolInvocationException("flaky"))
                .thenReturn("[7]");

        var state = run(graph(null), 15);

        assertEquals(1, state.retryCount());
        assertEquals(SubtaskStatus.COMPLETED, state.subtasks().get(0).status());
        assertEquals(2, state.toolLog().size());
        assertTrue(state.toolLog().stream().allMatch(e -> e.subtaskId().equals("task_1")));
        assertFalse(state.toolLog().get(0).succeeded());
        assertTrue(state.toolLog().get(1).succeeded());
        assertEquals(RunOutcome.COMPLETED, state.outcome());
    }

    @Test
    @DisplayName("calculation results are cross-validated before synthesis")
    void validationBeforeSynthesis() throws Exception {
        oracleAnswers("[{\"id\": \"task_1\", \"description\": \"Compute P&L\", \"tools\": [\"" + CALC + "\"]}]",
                "{\"tool\": \"" + CALC + "\", \"arguments\": {\"account_id\": \"7\", \"hierarchy\": \"FHC\"}}");
        when(tools.invoke(eq(CALC), anyMap())).thenReturn("{\"pnl\": 1000}");

        var state = run(graph(null), 15);

        assertEquals(1, state.validations().size());
        assertEquals(0.95, state.validations().get(0).confidence(), 1e-9);
        assertTrue(state.validations().get(0).valid());
        assertFalse(state.needsValidation());
        verify(tools).invoke(eq(CALC), eq(Map.of("account_id", "7", "hierarchy", "PRA")));
    }

    @Test
    @DisplayName("a persistently failing single-tool subtask exhausts recovery")
    void recoveryExhausted() throws Exception {
        oracleAnswers("[{\"id\": \"task_1\", \"description\": \"List accounts\", \"tools\": [\"get_all_accounts\"]}]",
                "{\"tool\": \"get_all_accounts\"}");
        when(tools.invoke(anyString(), anyMap())).thenThrow(new ToolInvocationException("down"));

        var state = run(graph(null), 15);

        assertEquals(3, state.retryCount());
        assertEquals(SubtaskStatus.FAILED, state.subtasks().get(0).status());
        assertEquals(RunOutcome.RECOVERY_EXHAUSTED, state.outcome());
        assertTrue(state.isFinished());
        assertEquals(2, state.errorLog().size());
    }

    @Test
    @DisplayName("the iteration ceiling truncates a run with pending subtasks")
    void ceilingTruncates() throws Exception {
        oracleAnswers("""
                [{"id": "task_1", "description": "a", "tools": ["get_all_accounts"]},
                 {"id": "task_2", "description": "b", "tools": ["get_all_accounts"]},
                 {"id": "task_3", "description": "c", "tools": ["get_all_accounts"]}]
                """, "{\"tool\": \"get_all_accounts\"}");
        when(tools.invoke(anyString(), anyMap())).thenReturn("ok");

        var state = run(graph(null), 3);

        assertEquals(RunOutcome.TRUNCATED, state.outcome());
        assertEquals(SubtaskStatus.PENDING, state.subtasks().get(2).status());
        assertEquals(4, state.iterationCount());
        assertTrue(state.isFinished());
    }

    // ===================================================================
    //  Checkpointing
    // ===================================================================

    @Test
    @DisplayName("every step is checkpointed under the run key")
    void checkpointsUnderRunKey() throws Exception {
        oracleAnswers("[]", "{\"tool\": \"get_all_accounts\"}");
        when(tools.invoke(anyString(), anyMap())).thenReturn("ok");
        var saver = new MemorySaver();

        run(graph(saver), 15);

        var config = RunnableConfig.builder().threadId("STEP-T").build();
        var latest = saver.get(config);
        assertTrue(latest.isPresent());
        assertTrue(new RunState(latest.get().getState()).isFinished());
        assertTrue(saver.list(config).size() >= 3);
    }
}
