package com.stepwise.core.state;

import com.stepwise.core.model.*;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Run state threaded through the orchestration graph for one request.
 * <p>
 * {@link #SCHEMA} is the single declaration of how partial updates merge: log-like
 * fields use appender channels (new items are concatenated, never deduplicated),
 * everything else uses base channels (the new value replaces the old one). Every
 * node returns a sparse map of field updates and LangGraph4j applies this schema
 * identically, whichever node produced the update.
 */
public class RunState extends AgentState {

    public static final String RUN_KEY = "runKey";
    public static final String REQUEST = "request";
    public static final String SUBTASKS = "subtasks";
    public static final String CURRENT_TASK = "currentTask";
    public static final String COMPLETED_IDS = "completedIds";
    public static final String TOOL_LOG = "toolLog";
    public static final String PROGRESS_LOG = "progressLog";
    public static final String AVAILABLE_TOOLS = "availableTools";
    public static final String ITERATION_COUNT = "iterationCount";
    public static final String MAX_ITERATIONS = "maxIterations";
    public static final String VALIDATIONS = "validations";
    public static final String NEEDS_VALIDATION = "needsValidation";
    public static final String ERROR_LOG = "errorLog";
    public static final String RETRY_COUNT = "retryCount";
    public static final String MAX_RETRIES = "maxRetries";
    public static final String RESULTS_BY_SUBTASK = "resultsBySubtask";
    public static final String FINAL_ANSWER = "finalAnswer";
    public static final String CONTINUE_FLAG = "continueFlag";
    public static final String REPLAN_FLAG = "replanFlag";
    public static final String ERROR_RECOVERY_FLAG = "errorRecoveryFlag";
    public static final String OUTCOME = "outcome";

    public static final int DEFAULT_MAX_ITERATIONS = 15;
    public static final int DEFAULT_MAX_RETRIES = 3;

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        // ── Overwrite channels ───────────────────────────────────────
        Map.entry(RUN_KEY,             Channels.base(() -> "")),
        Map.entry(REQUEST,             Channels.base(() -> "")),
        Map.entry(SUBTASKS,            Channels.base((Supplier<List<Subtask>>) List::of)),
        Map.entry(CURRENT_TASK,        Channels.base(() -> "")),
        Map.entry(AVAILABLE_TOOLS,     Channels.base((Supplier<List<String>>) List::of)),
        Map.entry(ITERATION_COUNT,     Channels.base(() -> 0)),
        Map.entry(MAX_ITERATIONS,      Channels.base(() -> DEFAULT_MAX_ITERATIONS)),
        Map.entry(NEEDS_VALIDATION,    Channels.base(() -> false)),
        Map.entry(RETRY_COUNT,         Channels.base(() -> 0)),
        Map.entry(MAX_RETRIES,         Channels.base(() -> DEFAULT_MAX_RETRIES)),
        Map.entry(RESULTS_BY_SUBTASK,  Channels.base((Supplier<Map<String, String>>) Map::of)),
        Map.entry(FINAL_ANSWER,        Channels.base(() -> "")),
        Map.entry(CONTINUE_FLAG,       Channels.base(() -> true)),
        Map.entry(REPLAN_FLAG,         Channels.base(() -> false)),
        Map.entry(ERROR_RECOVERY_FLAG, Channels.base(() -> false)),
        Map.entry(OUTCOME,             Channels.base(() -> RunOutcome.RUNNING.name())),

        // ── Appender channels ────────────────────────────────────────
        Map.entry(COMPLETED_IDS,       Channels.appender(ArrayList::new)),
        Map.entry(TOOL_LOG,            Channels.appender(ArrayList::new)),
        Map.entry(PROGRESS_LOG,        Channels.appender(ArrayList::new)),
        Map.entry(VALIDATIONS,         Channels.appender(ArrayList::new)),
        Map.entry(ERROR_LOG,           Channels.appender(ArrayList::new))
    );

    public RunState(Map<String, Object> initData) {
        super(initData);
    }

    /**
     * Builds the input map for a fresh run.
     */
    public static Map<String, Object> initial(String runKey, String request, List<String> availableTools,
                                              int maxIterations, int maxRetries) {
        var init = new HashMap<String, Object>();
        init.put(RUN_KEY, runKey);
        init.put(REQUEST, request);
        init.put(AVAILABLE_TOOLS, List.copyOf(availableTools));
        init.put(MAX_ITERATIONS, maxIterations);
        init.put(MAX_RETRIES, maxRetries);
        init.put(ITERATION_COUNT, 0);
        init.put(RETRY_COUNT, 0);
        return Map.copyOf(init);
    }

    /**
     * Applies a partial update using the per-field policy declared in {@link #SCHEMA}.
     */
    public static RunState merge(RunState state, Map<String, Object> partial) {
        return new RunState(AgentState.updateState(state.data(), partial, SCHEMA));
    }

    // ── Scalar accessors ─────────────────────────────────────────────

    public String runKey() {
        return this.<String>value(RUN_KEY).orElse("");
    }

    public String request() {
        return this.<String>value(REQUEST).orElse("");
    }

    public Optional<String> currentTask() {
        return this.<String>value(CURRENT_TASK).filter(id -> !id.isBlank());
    }

    public List<String> availableTools() {
        return this.<List<String>>value(AVAILABLE_TOOLS).orElse(List.of());
    }

    public int iterationCount() {
        return this.<Integer>value(ITERATION_COUNT).orElse(0);
    }

    public int maxIterations() {
        return this.<Integer>value(MAX_ITERATIONS).orElse(DEFAULT_MAX_ITERATIONS);
    }

    public boolean budgetExhausted() {
        return iterationCount() >= maxIterations();
    }

    public boolean needsValidation() {
        return this.<Boolean>value(NEEDS_VALIDATION).orElse(false);
    }

    public int retryCount() {
        return this.<Integer>value(RETRY_COUNT).orElse(0);
    }

    public int maxRetries() {
        return this.<Integer>value(MAX_RETRIES).orElse(DEFAULT_MAX_RETRIES);
    }

    public Map<String, String> resultsBySubtask() {
        return this.<Map<String, String>>value(RESULTS_BY_SUBTASK).orElse(Map.of());
    }

    public Optional<String> finalAnswer() {
        return this.<String>value(FINAL_ANSWER).filter(answer -> !answer.isBlank());
    }

    public boolean continueFlag() {
        return this.<Boolean>value(CONTINUE_FLAG).orElse(true);
    }

    public boolean replanFlag() {
        return this.<Boolean>value(REPLAN_FLAG).orElse(false);
    }

    public boolean errorRecoveryFlag() {
        return this.<Boolean>value(ERROR_RECOVERY_FLAG).orElse(false);
    }

    public RunOutcome outcome() {
        return RunOutcome.valueOf(this.<String>value(OUTCOME).orElse(RunOutcome.RUNNING.name()));
    }

    // ── List accessors ───────────────────────────────────────────────

    public List<Subtask> subtasks() {
        return this.<List<Subtask>>value(SUBTASKS).orElse(List.of());
    }

    public List<String> completedIds() {
        return this.<List<String>>value(COMPLETED_IDS).orElse(List.of());
    }

    public List<ToolExecution> toolLog() {
        return this.<List<ToolExecution>>value(TOOL_LOG).orElse(List.of());
    }

    public List<ProgressRecord> progressLog() {
        return this.<List<ProgressRecord>>value(PROGRESS_LOG).orElse(List.of());
    }

    public List<ValidationResult> validations() {
        return this.<List<ValidationResult>>value(VALIDATIONS).orElse(List.of());
    }

    public List<ErrorRecord> errorLog() {
        return this.<List<ErrorRecord>>value(ERROR_LOG).orElse(List.of());
    }

    // ── Derived views ────────────────────────────────────────────────

    public Optional<Subtask> subtask(String id) {
        return subtasks().stream().filter(st -> st.id().equals(id)).findFirst();
    }

    public Optional<Subtask> firstPending() {
        return subtasks().stream().filter(st -> st.status() == SubtaskStatus.PENDING).findFirst();
    }

    /** True when every subtask is completed or failed; vacuously true when there are none. */
    public boolean allResolved() {
        return subtasks().stream().allMatch(st -> st.status().isResolved());
    }

    /** True when recovery has repositioned {@code currentTask} onto a failed subtask. */
    public boolean retryScheduled() {
        return currentTask()
                .flatMap(this::subtask)
                .map(st -> st.status() == SubtaskStatus.FAILED)
                .orElse(false);
    }

    public long completedCount() {
        return subtasks().stream().filter(st -> st.status() == SubtaskStatus.COMPLETED).count();
    }

    public Optional<ErrorRecord> latestError() {
        var errors = errorLog();
        return errors.isEmpty() ? Optional.empty() : Optional.of(errors.get(errors.size() - 1));
    }

    public boolean isFinished() {
        return finalAnswer().isPresent();
    }
}
