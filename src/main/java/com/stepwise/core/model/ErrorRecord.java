package com.stepwise.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A domain failure recorded against a subtask. Tool name is {@code "unknown"} when
 * the oracle's tool decision could not be used.
 */
public record ErrorRecord(
    String subtaskId,
    String toolName,
    String message,
    Instant timestamp
) implements Serializable {

    public static final String UNKNOWN_TOOL = "unknown";
}
