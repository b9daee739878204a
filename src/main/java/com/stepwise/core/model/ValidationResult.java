package com.stepwise.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of cross-checking one tool execution.
 *
 * @param executionId the {@link ToolExecution#id()} that was validated
 * @param valid       whether the cross-check agrees with the original result
 * @param confidence  in [0, 1]
 * @param issues      human-readable concerns, empty when none
 * @param crossCheck  auxiliary evidence (original and alternate parameters and results)
 */
public record ValidationResult(
    String executionId,
    boolean valid,
    double confidence,
    List<String> issues,
    Map<String, Object> crossCheck
) implements Serializable {

    public ValidationResult {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1]: " + confidence);
        }
        issues = issues == null ? List.of() : List.copyOf(issues);
        crossCheck = crossCheck == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(crossCheck));
    }
}
