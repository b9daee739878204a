package com.stepwise.core.model;

import java.util.Locale;

/**
 * Category of a {@link ProgressRecord}.
 */
public enum ProgressKind {
    PLANNING,
    TOOL_CALL,
    VALIDATION,
    ERROR,
    SUMMARY;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
