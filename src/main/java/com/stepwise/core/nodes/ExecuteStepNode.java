package com.stepwise.core.nodes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stepwise.core.metrics.StepwiseMetrics;
import com.stepwise.core.model.ErrorRecord;
import com.stepwise.core.model.ProgressKind;
import com.stepwise.core.model.ProgressRecord;
import com.stepwise.core.model.Subtask;
import com.stepwise.core.model.SubtaskStatus;
import com.stepwise.core.model.ToolExecution;
import com.stepwise.core.oracle.OracleException;
import com.stepwise.core.oracle.OracleResponse;
import com.stepwise.core.oracle.OracleResponseParser;
import com.stepwise.core.oracle.ReasoningOracle;
import com.stepwise.core.state.RunState;
import com.stepwise.core.tools.ToolCatalog;
import com.stepwise.core.tools.ToolExecutionService;
import com.stepwise.core.tools.ToolInvocationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the current subtask: asks the oracle for a {@code {tool, arguments}} decision,
 * invokes that tool, and records the outcome.
 * <p>
 * The subtask is the one named by {@code currentTask}, else the first pending one.
 * When neither exists the node only clears {@code continueFlag}. Tool failures and
 * unusable oracle decisions mark the subtask failed and raise
 * {@code errorRecoveryFlag}; the recovery node decides what happens next.
 */
@Component
public class ExecuteStepNode {

    private static final Logger log = LoggerFactory.getLogger(ExecuteStepNode.class);

    private static final String INSTRUCTION = """
            You are executing one subtask of a multi-step workflow. Decide which single
            tool to call and with what arguments.

            Rules:
            1. Choose one of the candidate tools, preferring them in the order given.
            2. Use the EXACT parameter names from the tool descriptions.
            3. Use values from previous results when the subtask depends on them.
            4. If tools already failed for this subtask, choose a different tool or
               different arguments.

            Respond ONLY with a valid JSON object in this exact format:
            {"tool": "tool_name", "arguments": {"arg_name": "arg_value"}}

            Example: {"tool": "get_all_accounts", "arguments": {}}
            """;

    private final ReasoningOracle oracle;
    private final OracleResponseParser parser;
    private final ToolExecutionService toolService;
    private final ToolCatalog catalog;
    private final StepwiseMetrics metrics;
    private final ObjectMapper mapper;

    public ExecuteStepNode(ReasoningOracle oracle, OracleResponseParser parser,
                           ToolExecutionService toolService, ToolCatalog catalog,
                           StepwiseMetrics metrics, ObjectMapper mapper) {
        this.oracle = oracle;
        this.parser = parser;
        this.toolService = toolService;
        this.catalog = catalog;
        this.metrics = metrics;
        this.mapper = mapper;
    }

    public Map<String, Object> apply(RunState state) {
        int nextIteration = state.iterationCount() + 1;

        Optional<Subtask> target = resolveTarget(state);
        if (target.isEmpty()) {
            log.info("No runnable subtask remains");
            return Map.of(
                    RunState.CONTINUE_FLAG, false,
                    RunState.CURRENT_TASK, "",
                    RunState.ITERATION_COUNT, nextIteration
            );
        }

        Subtask running = target.get().startAttempt();
        log.info("Executing subtask {} (attempt {}): {}", running.id(), running.attemptCount(), running.description());

        var progress = new ArrayList<ProgressRecord>();
        var update = new LinkedHashMap<String, Object>();
        Subtask finished;

        ToolDecision decision;
        try {
            decision = decide(state, running);
        } catch (OracleException e) {
            decision = ToolDecision.unusable("Oracle call failed: " + e.getMessage());
        }

        if (decision.tool() == null) {
            log.warn("Unusable tool decision for subtask {}: {}", running.id(), decision.problem());
            finished = running.fail(decision.problem());
            var error = new ErrorRecord(running.id(), ErrorRecord.UNKNOWN_TOOL, decision.problem(), Instant.now());
            progress.add(ProgressRecord.of(ProgressKind.ERROR,
                    "Could not determine a tool call for " + running.id() + ": " + decision.problem(),
                    Map.of("subtask_id", running.id(), "tool", ErrorRecord.UNKNOWN_TOOL)));
            update.put(RunState.ERROR_LOG, List.of(error));
            update.put(RunState.ERROR_RECOVERY_FLAG, true);
        } else {
            progress.add(ProgressRecord.of(ProgressKind.TOOL_CALL,
                    "Calling " + decision.tool() + " with args: " + decision.arguments(),
                    Map.of("subtask_id", running.id(), "tool", decision.tool(), "args", decision.arguments())));
            String executionId = "exec-" + (state.toolLog().size() + 1);
            long start = System.currentTimeMillis();
            try {
                String output = toolService.invoke(decision.tool(), decision.arguments());
                String result = output == null ? "" : output;
                metrics.recordToolCall(decision.tool(), true, System.currentTimeMillis() - start);
                finished = running.complete(result);

                var results = new LinkedHashMap<>(state.resultsBySubtask());
                results.put(running.id(), result);
                update.put(RunState.TOOL_LOG, List.of(new ToolExecution(executionId, decision.tool(),
                        decision.arguments(), result, null, Instant.now(), running.id())));
                update.put(RunState.RESULTS_BY_SUBTASK, Map.copyOf(results));
                update.put(RunState.COMPLETED_IDS, List.of(running.id()));
                update.put(RunState.ERROR_RECOVERY_FLAG, false);
                log.info("Subtask {} completed via {}", running.id(), decision.tool());
            } catch (ToolInvocationException e) {
                metrics.recordToolCall(decision.tool(), false, System.currentTimeMillis() - start);
                String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                log.warn("Tool {} failed for subtask {}: {}", decision.tool(), running.id(), message);
                finished = running.fail(message);
                Instant now = Instant.now();
                update.put(RunState.TOOL_LOG, List.of(new ToolExecution(executionId, decision.tool(),
                        decision.arguments(), null, message, now, running.id())));
                update.put(RunState.ERROR_LOG, List.of(new ErrorRecord(running.id(), decision.tool(), message, now)));
                update.put(RunState.ERROR_RECOVERY_FLAG, true);
                progress.add(ProgressRecord.of(ProgressKind.ERROR,
                        "Tool " + decision.tool() + " failed: " + message,
                        Map.of("subtask_id", running.id(), "tool", decision.tool())));
            }
        }

        List<Subtask> subtasks = replace(state.subtasks(), finished);
        String nextTask = subtasks.stream()
                .filter(st -> st.status() == SubtaskStatus.PENDING)
                .map(Subtask::id)
                .findFirst()
                .orElse("");

        update.put(RunState.SUBTASKS, subtasks);
        update.put(RunState.CURRENT_TASK, nextTask);
        update.put(RunState.PROGRESS_LOG, List.copyOf(progress));
        update.put(RunState.ITERATION_COUNT, nextIteration);
        return update;
    }

    /**
     * The subtask named by {@code currentTask} if it can still run, else the first pending one.
     */
    private static Optional<Subtask> resolveTarget(RunState state) {
        Optional<Subtask> current = state.currentTask()
                .flatMap(state::subtask)
                .filter(st -> st.status() != SubtaskStatus.COMPLETED);
        return current.isPresent() ? current : state.firstPending();
    }

    private ToolDecision decide(RunState state, Subtask subtask) {
        String raw = oracle.decide(INSTRUCTION, buildContext(state, subtask));
        OracleResponse response = parser.parseObject(raw);
        if (response instanceof OracleResponse.Parsed parsed) {
            return toDecision(parsed.value());
        }
        if (response instanceof OracleResponse.Malformed malformed) {
            log.debug("Raw tool decision: {}", malformed.rawText());
            return ToolDecision.unusable("Failed to parse tool selection from oracle response: " + malformed.reason());
        }
        return ToolDecision.unusable("Oracle returned an empty tool selection");
    }

    @SuppressWarnings("unchecked")
    private ToolDecision toDecision(JsonNode node) {
        String tool = node.path("tool").asText("").strip();
        if (tool.isEmpty()) {
            return ToolDecision.unusable("Tool selection has no \"tool\" field");
        }
        JsonNode args = node.path("arguments");
        if (args.isMissingNode() || args.isNull()) {
            return new ToolDecision(tool, Map.of(), null);
        }
        if (!args.isObject()) {
            return ToolDecision.unusable("Tool selection \"arguments\" is not an object");
        }
        Map<String, Object> arguments = mapper.convertValue(args, LinkedHashMap.class);
        return new ToolDecision(tool, arguments, null);
    }

    private String buildContext(RunState state, Subtask subtask) {
        var sb = new StringBuilder();
        sb.append("Current subtask: ").append(subtask.description()).append("\n");
        sb.append("Candidate tools: ").append(String.join(", ", subtask.candidateTools())).append("\n");
        String signatures = catalog.describe(subtask.candidateTools());
        if (!signatures.isBlank()) {
            sb.append("\nTool descriptions:\n").append(signatures).append("\n");
        }
        var results = state.resultsBySubtask();
        if (!results.isEmpty()) {
            sb.append("\nPrevious results:\n");
            results.forEach((id, result) -> sb.append("- ").append(id).append(": ").append(result).append("\n"));
        }
        var failures = state.errorLog().stream()
                .filter(e -> e.subtaskId().equals(subtask.id()))
                .toList();
        if (!failures.isEmpty()) {
            sb.append("\nFailed attempts for this subtask:\n");
            failures.forEach(e -> sb.append("- ").append(e.toolName()).append(": ").append(e.message()).append("\n"));
        }
        sb.append("\nOriginal query: ").append(state.request()).append("\n");
        return sb.toString();
    }

    private static List<Subtask> replace(List<Subtask> subtasks, Subtask updated) {
        return subtasks.stream()
                .map(st -> st.id().equals(updated.id()) ? updated : st)
                .toList();
    }

    /**
     * Parsed oracle decision; {@code tool} is null when the decision is unusable.
     */
    record ToolDecision(String tool, Map<String, Object> arguments, String problem) {

        static ToolDecision unusable(String problem) {
            return new ToolDecision(null, Map.of(), problem);
        }
    }
}
