package com.stepwise.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable record of one tool invocation made by the step executor.
 *
 * @param id        run-unique identifier ("exec-1", "exec-2", ...)
 * @param toolName  tool that was invoked
 * @param arguments arguments the oracle chose
 * @param result    tool output, null when the call failed
 * @param error     failure message, null when the call succeeded
 * @param timestamp when the call finished
 * @param subtaskId owning subtask
 */
public record ToolExecution(
    String id,
    String toolName,
    Map<String, Object> arguments,
    String result,
    String error,
    Instant timestamp,
    String subtaskId
) implements Serializable {

    public ToolExecution {
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public boolean succeeded() {
        return error == null;
    }

    public boolean hasResult() {
        return result != null && !result.isBlank();
    }
}
