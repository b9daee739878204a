package com.stepwise.core.nodes;

import com.stepwise.core.metrics.StepwiseMetrics;
import com.stepwise.core.model.ErrorRecord;
import com.stepwise.core.model.ProgressKind;
import com.stepwise.core.model.ProgressRecord;
import com.stepwise.core.model.Subtask;
import com.stepwise.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Picks a recovery tactic for the latest failure, keyed on {@code retryCount}:
 * <ul>
 *   <li>0: retry the same subtask unchanged</li>
 *   <li>1: retry with the failed tool moved behind the other candidates; skipped
 *       straight to 3 when the subtask has a single candidate</li>
 *   <li>2: ask the decomposer for a new plan</li>
 *   <li>3 and above: give up and continue with partial results</li>
 * </ul>
 * This node only repositions state. It never calls the oracle or a tool.
 */
@Component
public class RecoverNode {

    private static final Logger log = LoggerFactory.getLogger(RecoverNode.class);

    private final StepwiseMetrics metrics;

    public RecoverNode(StepwiseMetrics metrics) {
        this.metrics = metrics;
    }

    public Map<String, Object> apply(RunState state) {
        int nextIteration = state.iterationCount() + 1;

        Optional<ErrorRecord> latest = state.latestError();
        if (latest.isEmpty()) {
            log.info("Recovery requested without a recorded error, resuming normal flow");
            return Map.of(
                    RunState.ERROR_RECOVERY_FLAG, false,
                    RunState.PROGRESS_LOG, List.of(ProgressRecord.of(ProgressKind.ERROR,
                            "No error to recover from")),
                    RunState.ITERATION_COUNT, nextIteration
            );
        }

        ErrorRecord error = latest.get();
        int retry = state.retryCount();
        var progress = new ArrayList<ProgressRecord>();
        progress.add(ProgressRecord.of(ProgressKind.ERROR,
                "Encountered error: " + error.message()
                        + ". Attempting recovery (retry " + retry + "/" + state.maxRetries() + ")",
                errorMetadata(error)));

        var update = new LinkedHashMap<String, Object>();
        update.put(RunState.ITERATION_COUNT, nextIteration);

        if (retry == 0) {
            retrySame(error, progress, update);
        } else if (retry == 1) {
            tryAlternative(state, error, progress, update);
        } else if (retry == 2) {
            replan(progress, update);
        } else {
            giveUp(retry, progress, update);
        }
        update.put(RunState.PROGRESS_LOG, List.copyOf(progress));
        return update;
    }

    private void retrySame(ErrorRecord error, List<ProgressRecord> progress, Map<String, Object> update) {
        log.info("Retrying subtask {} unchanged", error.subtaskId());
        metrics.recordRecoveryTier("retry");
        progress.add(ProgressRecord.of(ProgressKind.ERROR, "Retrying subtask " + error.subtaskId(),
                Map.of("strategy", "retry", "subtask", error.subtaskId())));
        update.put(RunState.RETRY_COUNT, 1);
        update.put(RunState.CURRENT_TASK, error.subtaskId());
        update.put(RunState.ERROR_RECOVERY_FLAG, false);
    }

    private void tryAlternative(RunState state, ErrorRecord error, List<ProgressRecord> progress,
                                Map<String, Object> update) {
        Optional<Subtask> failed = state.subtask(error.subtaskId());
        if (failed.isEmpty() || failed.get().candidateTools().size() <= 1) {
            log.info("No alternative tool for subtask {}, skipping straight to giving up", error.subtaskId());
            metrics.recordRecoveryTier("skip_alternative");
            progress.add(ProgressRecord.of(ProgressKind.ERROR, "No alternative tool available, skipping to the give-up tier",
                    Map.of("strategy", "skip_alternative", "subtask", error.subtaskId())));
            update.put(RunState.RETRY_COUNT, 3);
            return;
        }

        Subtask reordered = failed.get().demoteTool(error.toolName());
        log.info("Retrying subtask {} with alternative tools {}", reordered.id(), reordered.candidateTools());
        metrics.recordRecoveryTier("alternative_tool");
        progress.add(ProgressRecord.of(ProgressKind.ERROR, "Trying alternative tool approach",
                Map.of("strategy", "alternative_tool", "subtask", reordered.id(),
                        "candidates", reordered.candidateTools())));
        update.put(RunState.RETRY_COUNT, 2);
        update.put(RunState.CURRENT_TASK, reordered.id());
        update.put(RunState.SUBTASKS, state.subtasks().stream()
                .map(st -> st.id().equals(reordered.id()) ? reordered : st)
                .toList());
        update.put(RunState.ERROR_RECOVERY_FLAG, false);
    }

    private void replan(List<ProgressRecord> progress, Map<String, Object> update) {
        log.info("Replanning with a different approach");
        metrics.recordRecoveryTier("replan");
        progress.add(ProgressRecord.of(ProgressKind.ERROR, "Replanning query with different approach",
                Map.of("strategy", "replan")));
        update.put(RunState.RETRY_COUNT, 3);
        update.put(RunState.REPLAN_FLAG, true);
        update.put(RunState.ERROR_RECOVERY_FLAG, false);
    }

    private void giveUp(int retry, List<ProgressRecord> progress, Map<String, Object> update) {
        log.warn("Max retries exceeded, proceeding with partial results");
        metrics.recordRecoveryTier("give_up");
        progress.add(ProgressRecord.of(ProgressKind.ERROR, "Max retries exceeded. Proceeding with partial results.",
                Map.of("strategy", "give_up", "retry_count", retry)));
        update.put(RunState.ERROR_RECOVERY_FLAG, false);
    }

    private static Map<String, Object> errorMetadata(ErrorRecord error) {
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("subtask_id", error.subtaskId());
        metadata.put("tool", error.toolName());
        metadata.put("error", error.message());
        return metadata;
    }
}
