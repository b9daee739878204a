package com.stepwise.core.events;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A progress event emitted during a run, used for SSE streaming and CLI output.
 *
 * @param runKey        the run this event belongs to (not part of the wire shape)
 * @param eventType     event type
 * @param data          event payload, usually a map
 * @param stateSnapshot counters at the time of the event, omitted when null
 */
public record RunEvent(
    @JsonIgnore String runKey,
    @JsonProperty("event_type") EventType eventType,
    @JsonProperty("data") Object data,
    @JsonProperty("state_snapshot") @JsonInclude(JsonInclude.Include.NON_NULL) StateSnapshot stateSnapshot
) implements Serializable {}
