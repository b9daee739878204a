package com.stepwise.core.engine;

/**
 * Per-run settings. A null field falls back to the configured default.
 *
 * @param runKey        resumability key; generated when null or blank
 * @param maxIterations iteration budget
 * @param maxRetries    recovery budget
 */
public record RunOptions(String runKey, Integer maxIterations, Integer maxRetries) {

    public static RunOptions defaults() {
        return new RunOptions(null, null, null);
    }

    public RunOptions {
        if (maxIterations != null && maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
        }
        if (maxRetries != null && maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative, got " + maxRetries);
        }
    }

    public boolean hasRunKey() {
        return runKey != null && !runKey.isBlank();
    }
}
