package com.stepwise.core.engine;

/**
 * Thrown when the engine itself fails while driving a run. Domain failures (tool
 * errors, unusable oracle output) never surface as this exception.
 */
public class RunFailedException extends RuntimeException {

    private final String runKey;

    public RunFailedException(String runKey, String message, Throwable cause) {
        super(message, cause);
        this.runKey = runKey;
    }

    public String getRunKey() {
        return runKey;
    }
}
