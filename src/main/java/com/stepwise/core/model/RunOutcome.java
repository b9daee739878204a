package com.stepwise.core.model;

/**
 * How a run ended. Set by the synthesizer; {@link #RUNNING} until then.
 */
public enum RunOutcome {
    RUNNING,
    /** Every subtask completed. */
    COMPLETED,
    /** Failed subtasks remain after recovery gave up or its retry budget ran out. */
    RECOVERY_EXHAUSTED,
    /** The iteration ceiling forced synthesis while work was pending or recovery was in progress. */
    TRUNCATED
}
