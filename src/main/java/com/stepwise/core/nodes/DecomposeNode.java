package com.stepwise.core.nodes;

import com.fasterxml.jackson.databind.JsonNode;
import com.stepwise.core.config.StepwiseProperties;
import com.stepwise.core.model.ProgressKind;
import com.stepwise.core.model.ProgressRecord;
import com.stepwise.core.model.Subtask;
import com.stepwise.core.oracle.OracleException;
import com.stepwise.core.oracle.OracleResponse;
import com.stepwise.core.oracle.OracleResponseParser;
import com.stepwise.core.oracle.ReasoningOracle;
import com.stepwise.core.state.RunState;
import com.stepwise.core.tools.ToolCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns the original request into an ordered list of {@link Subtask}s by asking the
 * oracle for a plan.
 * <p>
 * An unusable plan is never fatal: the node falls back to a single subtask covering
 * the whole request with every available tool as a candidate. When invoked again for
 * replanning, existing subtasks are kept and the new plan is appended, with colliding
 * ids renamed so ids stay unique for the whole run.
 */
@Component
public class DecomposeNode {

    private static final Logger log = LoggerFactory.getLogger(DecomposeNode.class);

    static final String FALLBACK_ID = "task_1";

    private static final String INSTRUCTION = """
            You break a user's request into specific subtasks that can each be completed
            with exactly one tool call from the list of available tools.

            For each subtask:
            1. Describe what needs to be done.
            2. List which tool(s) could do it, most suitable first.
            3. Order subtasks so that any subtask relying on an earlier result comes after it.

            Keep the plan simple and focused. For simple requests create only 1-2 subtasks.
            For requests involving several entities, break the work into logical steps.

            Respond ONLY with a valid JSON array in this exact format:
            [
              {"id": "task_1", "description": "Brief description of what to do", "tools": ["tool_name"]},
              {"id": "task_2", "description": "Another task", "tools": ["tool_name"]}
            ]
            """;

    private final ReasoningOracle oracle;
    private final OracleResponseParser parser;
    private final ToolCatalog catalog;
    private final String validationTool;

    public DecomposeNode(ReasoningOracle oracle, OracleResponseParser parser, ToolCatalog catalog,
                         StepwiseProperties properties) {
        this.oracle = oracle;
        this.parser = parser;
        this.catalog = catalog;
        this.validationTool = properties.getValidation().getTool();
    }

    public Map<String, Object> apply(RunState state) {
        boolean replanning = !state.subtasks().isEmpty();
        List<String> availableTools = state.availableTools();

        List<Subtask> planned = plan(state, availableTools);
        boolean fallback = planned.isEmpty();
        if (fallback) {
            planned = List.of(Subtask.pending(FALLBACK_ID,
                    "Address query: " + state.request(), availableTools));
        }

        List<Subtask> appended = replanning ? renameCollisions(state, planned) : planned;
        var subtasks = new ArrayList<>(state.subtasks());
        subtasks.addAll(appended);

        boolean needsValidation = subtasks.stream()
                .anyMatch(st -> st.candidateTools().contains(validationTool));

        var summaries = new ArrayList<Map<String, Object>>();
        for (Subtask st : appended) {
            var summary = new LinkedHashMap<String, Object>();
            summary.put("id", st.id());
            summary.put("description", st.description());
            summary.put("tools", st.candidateTools());
            summaries.add(summary);
        }
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("subtask_count", appended.size());
        metadata.put("subtasks", summaries);
        metadata.put("fallback", fallback);
        metadata.put("replan", replanning);

        String content = (replanning ? "Replanned query into " : "Decomposed query into ")
                + appended.size() + " subtask(s): "
                + String.join(", ", appended.stream().map(Subtask::description).toList());
        log.info("{}{}", content, fallback ? " (fallback plan)" : "");

        var update = new LinkedHashMap<String, Object>();
        update.put(RunState.SUBTASKS, List.copyOf(subtasks));
        update.put(RunState.PROGRESS_LOG, List.of(ProgressRecord.of(ProgressKind.PLANNING, content, metadata)));
        update.put(RunState.CURRENT_TASK, appended.isEmpty() ? "" : appended.get(0).id());
        update.put(RunState.ITERATION_COUNT, state.iterationCount() + 1);
        update.put(RunState.REPLAN_FLAG, false);
        update.put(RunState.NEEDS_VALIDATION, needsValidation);
        return update;
    }

    /**
     * Asks the oracle for a plan. Returns an empty list when the response is unusable.
     */
    private List<Subtask> plan(RunState state, List<String> availableTools) {
        String raw;
        try {
            raw = oracle.decide(INSTRUCTION, buildContext(state, availableTools));
        } catch (OracleException e) {
            log.warn("Decomposition oracle call failed, using fallback plan: {}", e.getMessage());
            return List.of();
        }

        OracleResponse response = parser.parseArray(raw);
        if (response instanceof OracleResponse.Parsed parsed) {
            return toSubtasks(parsed.value(), availableTools);
        }
        if (response instanceof OracleResponse.Malformed malformed) {
            log.warn("Decomposition response malformed ({}), using fallback plan", malformed.reason());
            log.debug("Raw decomposition response: {}", malformed.rawText());
            return List.of();
        }
        log.warn("Decomposition response empty, using fallback plan");
        return List.of();
    }

    private List<Subtask> toSubtasks(JsonNode array, List<String> availableTools) {
        if (!array.isArray()) {
            return List.of();
        }
        var subtasks = new ArrayList<Subtask>();
        Set<String> seen = new HashSet<>();
        int index = 0;
        for (JsonNode item : array) {
            index++;
            if (!item.isObject()) {
                log.warn("Decomposition entry {} is not an object, discarding plan", index);
                return List.of();
            }
            String description = item.path("description").asText("").strip();
            if (description.isEmpty()) {
                log.warn("Decomposition entry {} has no description, discarding plan", index);
                return List.of();
            }
            String id = item.path("id").asText("").strip();
            if (id.isEmpty()) {
                id = "task_" + index;
            }
            while (!seen.add(id)) {
                id = id + "_" + index;
            }
            var tools = new ArrayList<String>();
            for (JsonNode tool : item.path("tools")) {
                if (tool.isTextual() && !tool.asText().isBlank()) {
                    tools.add(tool.asText().strip());
                }
            }
            subtasks.add(Subtask.pending(id, description, tools.isEmpty() ? availableTools : tools));
        }
        return subtasks;
    }

    private static List<Subtask> renameCollisions(RunState state, List<Subtask> planned) {
        Set<String> taken = new HashSet<>();
        state.subtasks().forEach(st -> taken.add(st.id()));
        long round = state.progressLog().stream()
                .filter(p -> p.kind() == ProgressKind.PLANNING)
                .count();

        var renamed = new ArrayList<Subtask>();
        for (Subtask st : planned) {
            String id = st.id();
            long n = Math.max(round, 1);
            while (taken.contains(id)) {
                id = "r" + n + "_" + st.id();
                n++;
            }
            taken.add(id);
            renamed.add(id.equals(st.id()) ? st : st.withId(id));
        }
        return renamed;
    }

    private String buildContext(RunState state, List<String> availableTools) {
        var sb = new StringBuilder();
        sb.append("Request: ").append(state.request()).append("\n\n");
        sb.append("Available tools: ").append(String.join(", ", availableTools)).append("\n");
        String signatures = catalog.describe(availableTools);
        if (!signatures.isBlank()) {
            sb.append("\nTool descriptions:\n").append(signatures).append("\n");
        }
        if (!state.errorLog().isEmpty()) {
            sb.append("\nA previous plan ran into these failures; plan a different approach:\n");
            state.errorLog().forEach(e -> sb.append("- ").append(e.subtaskId())
                    .append(" (").append(e.toolName()).append("): ").append(e.message()).append("\n"));
        }
        var results = state.resultsBySubtask();
        if (!results.isEmpty()) {
            sb.append("\nResults already obtained:\n");
            results.forEach((id, result) -> sb.append("- ").append(id).append(": ").append(result).append("\n"));
        }
        return sb.toString();
    }
}
