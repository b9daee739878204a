package com.stepwise.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured, UI-agnostic note of what a component did. Translation to the wire
 * event shape happens in {@code ProgressEventTranslator}.
 */
public record ProgressRecord(
    ProgressKind kind,
    String content,
    Instant timestamp,
    Map<String, Object> metadata
) implements Serializable {

    public ProgressRecord {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ProgressRecord of(ProgressKind kind, String content) {
        return new ProgressRecord(kind, content, Instant.now(), Map.of());
    }

    public static ProgressRecord of(ProgressKind kind, String content, Map<String, Object> metadata) {
        return new ProgressRecord(kind, content, Instant.now(), metadata);
    }
}
