package com.stepwise.core.events;

import com.stepwise.core.graph.Step;
import com.stepwise.core.model.ProgressRecord;
import com.stepwise.core.model.Subtask;
import com.stepwise.core.model.ToolExecution;
import com.stepwise.core.state.RunState;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Turns the difference between two consecutive run states into wire events.
 * <p>
 * Nodes only append structured records to state; everything presentation-specific
 * lives here. Events for one step are ordered: reasoning, subtask updates, tool
 * executions, then {@code final_answer} and {@code done} after synthesis.
 */
@Component
public class ProgressEventTranslator {

    public List<RunEvent> translate(Step step, RunState before, RunState after) {
        String runKey = after.runKey();
        StateSnapshot snapshot = StateSnapshot.of(after);
        var events = new ArrayList<RunEvent>();

        for (ProgressRecord record : added(before.progressLog(), after.progressLog())) {
            events.add(new RunEvent(runKey, EventType.REASONING, reasoning(step, record), snapshot));
        }

        Map<String, Subtask> previous = before.subtasks().stream()
                .collect(Collectors.toMap(Subtask::id, Function.identity(), (a, b) -> a));
        for (Subtask subtask : after.subtasks()) {
            Subtask old = previous.get(subtask.id());
            if (old == null || old.status() != subtask.status()) {
                events.add(new RunEvent(runKey, EventType.SUBTASK_UPDATE, subtaskUpdate(subtask), snapshot));
            }
        }

        for (ToolExecution execution : added(before.toolLog(), after.toolLog())) {
            events.add(new RunEvent(runKey, EventType.TOOL_EXECUTION, toolExecution(execution), snapshot));
        }

        if (step == Step.SYNTHESIZE) {
            var answer = new LinkedHashMap<String, Object>();
            answer.put("answer", after.finalAnswer().orElse(""));
            answer.put("outcome", after.outcome().name());
            events.add(new RunEvent(runKey, EventType.FINAL_ANSWER, answer, snapshot));
            events.add(new RunEvent(runKey, EventType.DONE, Map.of("outcome", after.outcome().name()), snapshot));
        }
        return events;
    }

    /**
     * Event for a failure of the engine itself.
     */
    public RunEvent error(String runKey, String message, RunState lastKnown) {
        var data = new LinkedHashMap<String, Object>();
        data.put("message", message == null ? "Unknown engine failure" : message);
        return new RunEvent(runKey, EventType.ERROR, data, lastKnown == null ? null : StateSnapshot.of(lastKnown));
    }

    private static <T> List<T> added(List<T> before, List<T> after) {
        if (after.size() <= before.size()) {
            return List.of();
        }
        return after.subList(before.size(), after.size());
    }

    private static Map<String, Object> reasoning(Step step, ProgressRecord record) {
        var data = new LinkedHashMap<String, Object>();
        data.put("step", step.nodeName());
        data.put("type", record.kind().wireName());
        data.put("content", record.content());
        data.put("timestamp", record.timestamp().toString());
        data.put("metadata", record.metadata());
        return data;
    }

    private static Map<String, Object> subtaskUpdate(Subtask subtask) {
        var data = new LinkedHashMap<String, Object>();
        data.put("id", subtask.id());
        data.put("description", subtask.description());
        data.put("status", subtask.status().name().toLowerCase(Locale.ROOT));
        data.put("tools", subtask.candidateTools());
        data.put("attempts", subtask.attemptCount());
        if (subtask.error() != null) {
            data.put("error", subtask.error());
        }
        return data;
    }

    private static Map<String, Object> toolExecution(ToolExecution execution) {
        var data = new LinkedHashMap<String, Object>();
        data.put("id", execution.id());
        data.put("tool", execution.toolName());
        data.put("arguments", execution.arguments());
        data.put("subtask_id", execution.subtaskId());
        data.put("success", execution.succeeded());
        data.put(execution.succeeded() ? "result" : "error",
                execution.succeeded() ? execution.result() : execution.error());
        data.put("timestamp", execution.timestamp().toString());
        return data;
    }
}
