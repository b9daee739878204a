package com.stepwise.core.model;

/**
 * Lifecycle of a {@link Subtask}.
 * <p>
 * A subtask starts {@link #PENDING}, moves to {@link #IN_PROGRESS} when the step
 * executor picks it up, and ends {@link #COMPLETED} or {@link #FAILED}. A failed
 * subtask may re-enter {@link #IN_PROGRESS} when recovery retries it, but nothing
 * ever returns to {@link #PENDING}.
 */
public enum SubtaskStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    public boolean isResolved() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Returns {@code true} if a subtask in this status may move to {@code next}.
     */
    public boolean canTransitionTo(SubtaskStatus next) {
        return switch (this) {
            case PENDING -> next == IN_PROGRESS;
            case IN_PROGRESS -> next == COMPLETED || next == FAILED;
            case FAILED -> next == IN_PROGRESS;
            case COMPLETED -> false;
        };
    }
}
