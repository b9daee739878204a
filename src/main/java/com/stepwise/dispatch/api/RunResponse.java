package com.stepwise.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.stepwise.core.model.ErrorRecord;
import com.stepwise.core.model.Subtask;
import com.stepwise.core.model.ValidationResult;
import com.stepwise.core.state.RunState;

import java.util.List;

/**
 * JSON view of a run's latest state.
 */
public record RunResponse(
    @JsonProperty("run_key") String runKey,
    String status,
    String request,
    @JsonProperty("iteration_count") int iterationCount,
    @JsonProperty("max_iterations") int maxIterations,
    @JsonProperty("retry_count") int retryCount,
    List<SubtaskResponse> subtasks,
    @JsonProperty("tool_calls") int toolCalls,
    List<ValidationResponse> validations,
    List<String> errors,
    @JsonProperty("final_answer") String finalAnswer
) {

    public record SubtaskResponse(
        String id,
        String description,
        String status,
        List<String> tools,
        int attempts,
        String error
    ) {}

    public record ValidationResponse(
        @JsonProperty("execution_id") String executionId,
        boolean valid,
        double confidence,
        List<String> issues
    ) {}

    /**
     * Status is the outcome once the run finished, otherwise RUNNING.
     */
    public static RunResponse from(RunState state) {
        String status = state.isFinished() ? state.outcome().name() : "RUNNING";
        return from(state, status);
    }

    public static RunResponse from(RunState state, String status) {
        return new RunResponse(
                state.runKey(),
                status,
                state.request(),
                state.iterationCount(),
                state.maxIterations(),
                state.retryCount(),
                state.subtasks().stream().map(RunResponse::toSubtask).toList(),
                state.toolLog().size(),
                state.validations().stream().map(RunResponse::toValidation).toList(),
                state.errorLog().stream().map(RunResponse::describe).toList(),
                state.finalAnswer().orElse(null)
        );
    }

    private static SubtaskResponse toSubtask(Subtask st) {
        return new SubtaskResponse(st.id(), st.description(), st.status().name(),
                st.candidateTools(), st.attemptCount(), st.error());
    }

    private static ValidationResponse toValidation(ValidationResult v) {
        return new ValidationResponse(v.executionId(), v.valid(), v.confidence(), v.issues());
    }

    private static String describe(ErrorRecord e) {
        return e.subtaskId() + " (" + e.toolName() + "): " + e.message();
    }
}
