package com.stepwise.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * One unit of decomposed work.
 *
 * @param id             unique within a run (e.g. "task_1")
 * @param description    what this subtask should accomplish
 * @param status         current lifecycle status
 * @param candidateTools tools the oracle may choose from, in preference order
 * @param result         tool output once completed, otherwise null
 * @param error          last failure message, otherwise null
 * @param attemptCount   how many times the step executor has run this subtask
 */
public record Subtask(
    String id,
    String description,
    SubtaskStatus status,
    List<String> candidateTools,
    String result,
    String error,
    int attemptCount
) implements Serializable {

    public Subtask {
        candidateTools = candidateTools == null ? List.of() : List.copyOf(candidateTools);
    }

    public static Subtask pending(String id, String description, List<String> candidateTools) {
        return new Subtask(id, description, SubtaskStatus.PENDING, candidateTools, null, null, 0);
    }

    /**
     * Marks the subtask in progress for a new attempt. A subtask left in progress by an
     * interrupted run stays in progress.
     */
    public Subtask startAttempt() {
        SubtaskStatus next = status == SubtaskStatus.IN_PROGRESS ? status : transition(SubtaskStatus.IN_PROGRESS);
        return new Subtask(id, description, next,
                candidateTools, result, error, attemptCount + 1);
    }

    public Subtask complete(String output) {
        return new Subtask(id, description, transition(SubtaskStatus.COMPLETED),
                candidateTools, output, null, attemptCount);
    }

    public Subtask fail(String message) {
        return new Subtask(id, description, transition(SubtaskStatus.FAILED),
                candidateTools, result, message, attemptCount);
    }

    /**
     * Returns a copy whose candidates list {@code tool} last, so a retry prefers a different one.
     */
    public Subtask demoteTool(String tool) {
        if (!candidateTools.contains(tool)) {
            return this;
        }
        var reordered = new ArrayList<>(candidateTools);
        reordered.remove(tool);
        reordered.add(tool);
        return new Subtask(id, description, status, reordered, result, error, attemptCount);
    }

    public Subtask withId(String newId) {
        return new Subtask(newId, description, status, candidateTools, result, error, attemptCount);
    }

    private SubtaskStatus transition(SubtaskStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Subtask " + id + " cannot move from " + status + " to " + next);
        }
        return next;
    }
}
