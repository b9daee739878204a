package com.stepwise.core.events;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Wire names of the progress events streamed to front ends.
 */
public enum EventType {
    REASONING,
    SUBTASK_UPDATE,
    TOOL_EXECUTION,
    FINAL_ANSWER,
    DONE,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
