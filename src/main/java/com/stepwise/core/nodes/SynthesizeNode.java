package com.stepwise.core.nodes;

import com.stepwise.core.config.StepwiseProperties;
import com.stepwise.core.model.ProgressKind;
import com.stepwise.core.model.ProgressRecord;
import com.stepwise.core.model.RunOutcome;
import com.stepwise.core.model.Subtask;
import com.stepwise.core.model.SubtaskStatus;
import com.stepwise.core.model.ToolExecution;
import com.stepwise.core.model.ValidationResult;
import com.stepwise.core.oracle.OracleException;
import com.stepwise.core.oracle.ReasoningOracle;
import com.stepwise.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Terminal node. Composes every completed result, the tool log and the validation
 * summary into one final answer.
 * <p>
 * Synthesis never refuses to answer. When the oracle fails or returns nothing, the
 * answer is assembled directly from the recorded results. The run outcome is recorded
 * alongside the answer so partial runs stay distinguishable from clean completions.
 */
@Component
public class SynthesizeNode {

    private static final Logger log = LoggerFactory.getLogger(SynthesizeNode.class);

    private static final String INSTRUCTION = """
            Synthesize a comprehensive answer to the user's query based on the workflow results.

            Provide an answer that:
            1. Directly answers the original query
            2. Integrates all relevant data points from the tool results
            3. Notes any inconsistencies or validation concerns if present
            4. Is clear and concise
            5. Cites the specific tools/data sources used

            If the run outcome says the work is incomplete, say plainly which parts are missing.
            Do not include any preamble or meta-commentary about the workflow, just provide the
            answer to the user's query.
            """;

    private final ReasoningOracle oracle;
    private final int previewLength;

    public SynthesizeNode(ReasoningOracle oracle, StepwiseProperties properties) {
        this.oracle = oracle;
        this.previewLength = properties.getSynthesis().getResultPreviewLength();
    }

    public Map<String, Object> apply(RunState state) {
        RunOutcome outcome = classify(state);
        List<Subtask> completed = state.subtasks().stream()
                .filter(st -> st.status() == SubtaskStatus.COMPLETED)
                .toList();

        String answer;
        try {
            answer = oracle.decide(INSTRUCTION, buildContext(state, completed, outcome));
        } catch (OracleException e) {
            log.warn("Synthesis oracle call failed, composing answer from raw results: {}", e.getMessage());
            answer = null;
        }
        if (answer == null || answer.isBlank()) {
            answer = fallbackAnswer(state, completed, outcome);
        }

        var toolsUsed = new LinkedHashSet<String>();
        state.toolLog().forEach(e -> toolsUsed.add(e.toolName()));
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("subtasks_completed", completed.size());
        metadata.put("tools_used", List.copyOf(toolsUsed));
        metadata.put("total_tool_calls", state.toolLog().size());
        metadata.put("outcome", outcome.name());

        log.info("Synthesized final answer ({}, {} of {} subtasks completed)",
                outcome, completed.size(), state.subtasks().size());

        return Map.of(
                RunState.FINAL_ANSWER, answer,
                RunState.CONTINUE_FLAG, false,
                RunState.OUTCOME, outcome.name(),
                RunState.PROGRESS_LOG, List.of(ProgressRecord.of(ProgressKind.SUMMARY,
                        "Synthesized final answer from all subtask results", metadata)),
                RunState.ITERATION_COUNT, state.iterationCount() + 1
        );
    }

    /**
     * {@link RunOutcome#TRUNCATED} when the iteration budget cut work short,
     * {@link RunOutcome#RECOVERY_EXHAUSTED} when a subtask stayed failed, otherwise
     * {@link RunOutcome#COMPLETED}.
     */
    static RunOutcome classify(RunState state) {
        if (state.budgetExhausted()) {
            boolean workLeft = !state.allResolved()
                    || state.retryScheduled()
                    || (state.errorRecoveryFlag() && state.retryCount() < state.maxRetries())
                    || state.replanFlag();
            if (workLeft) {
                return RunOutcome.TRUNCATED;
            }
        }
        boolean anyFailed = state.subtasks().stream().anyMatch(st -> st.status() == SubtaskStatus.FAILED);
        return anyFailed ? RunOutcome.RECOVERY_EXHAUSTED : RunOutcome.COMPLETED;
    }

    private String buildContext(RunState state, List<Subtask> completed, RunOutcome outcome) {
        var sb = new StringBuilder();
        sb.append("Original query: ").append(state.request()).append("\n\n");

        sb.append("Completed subtasks and their results:\n");
        if (completed.isEmpty()) {
            sb.append("(none)\n");
        }
        for (Subtask st : completed) {
            sb.append("\n").append(st.id()).append(": ").append(st.description()).append("\n");
            sb.append("Result: ").append(resultOf(state, st)).append("\n");
        }

        List<ToolExecution> executions = state.toolLog();
        sb.append("\nTool executions performed:\n");
        sb.append(executions.size()).append(" tool calls were made:\n");
        for (ToolExecution e : executions) {
            sb.append("- ").append(e.toolName()).append("(").append(e.arguments()).append("): ");
            sb.append(e.succeeded()
                    ? TextPreview.truncate(e.result(), previewLength)
                    : "FAILED: " + e.error());
            sb.append("\n");
        }

        sb.append("\nValidation results:\n").append(validationSummary(state.validations())).append("\n");
        sb.append("\nRun outcome: ").append(outcomeNote(outcome)).append("\n");
        return sb.toString();
    }

    private static String validationSummary(List<ValidationResult> validations) {
        if (validations.isEmpty()) {
            return "No validation was performed";
        }
        var lines = new ArrayList<String>();
        for (ValidationResult v : validations) {
            String line = String.format("- Confidence: %.2f, Valid: %s", v.confidence(), v.valid());
            if (!v.issues().isEmpty()) {
                line += ", Issues: " + String.join(", ", v.issues());
            }
            lines.add(line);
        }
        return String.join("\n", lines);
    }

    private static String outcomeNote(RunOutcome outcome) {
        return switch (outcome) {
            case TRUNCATED -> "incomplete, the step budget ran out before all work finished";
            case RECOVERY_EXHAUSTED -> "partial, some subtasks failed after all recovery attempts";
            default -> "complete";
        };
    }

    private String fallbackAnswer(RunState state, List<Subtask> completed, RunOutcome outcome) {
        var sb = new StringBuilder();
        sb.append("Results for: ").append(state.request()).append("\n");
        if (completed.isEmpty()) {
            sb.append("\nNo subtask produced a result.\n");
        }
        for (Subtask st : completed) {
            sb.append("\n- ").append(st.description()).append(": ")
                    .append(TextPreview.truncate(resultOf(state, st), previewLength));
        }
        if (outcome != RunOutcome.COMPLETED) {
            sb.append("\n\nNote: this answer is ").append(outcomeNote(outcome)).append(".");
        }
        return sb.toString().strip();
    }

    private static String resultOf(RunState state, Subtask subtask) {
        String result = state.resultsBySubtask().get(subtask.id());
        if (result == null) {
            result = subtask.result();
        }
        return result == null ? "" : result;
    }
}
