package com.stepwise.core.graph;

import com.stepwise.core.model.Subtask;
import com.stepwise.core.model.ToolExecution;
import com.stepwise.core.model.ValidationResult;
import com.stepwise.core.state.RunState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RouterTest {

    private static final String CALC = "calculate_hypothetical_pnl";

    private final Router router = new Router(CALC);

    private static RunState state(Map<String, Object> overrides) {
        var data = new HashMap<String, Object>(RunState.initial("STEP-1", "q", List.of("a", CALC), 15, 3));
        data.putAll(overrides);
        return new RunState(data);
    }

    private static Subtask pending(String id) {
        return Subtask.pending(id, "do " + id, List.of("a"));
    }

    private static Subtask completed(String id) {
        return pending(id).startAttempt().complete("ok");
    }

    private static Subtask failed(String id) {
        return pending(id).startAttempt().fail("boom");
    }

    private static ToolExecution calcExecution() {
        return new ToolExecution("exec-1", CALC, Map.of("hierarchy", "FHC"), "1000", null, Instant.EPOCH, "task_1");
    }

    // ===================================================================
    //  Rule 1: iteration ceiling
    // ===================================================================

    @Nested
    @DisplayName("iteration ceiling")
    class Ceiling {

        @Test
        @DisplayName("dominates contradictory recovery and replan flags")
        void dominatesFlags() {
            var s = state(Map.of(
                    RunState.ITERATION_COUNT, 15,
                    RunState.ERROR_RECOVERY_FLAG, true,
                    RunState.REPLAN_FLAG, true,
                    RunState.NEEDS_VALIDATION, true,
                    RunState.SUBTASKS, List.of(pending("task_1"))));
            assertEquals(Step.SYNTHESIZE, router.next(s));
        }

        @ParameterizedTest(name = "iteration {0} of 15")
        @ValueSource(ints = {15, 16, 40})
        @DisplayName("synthesizes at or beyond the ceiling with pending work")
        void atOrBeyond(int iteration) {
            var s = state(Map.of(
                    RunState.ITERATION_COUNT, iteration,
                    RunState.CURRENT_TASK, "task_1",
                    RunState.SUBTASKS, List.of(pending("task_1"))));
            assertEquals(Step.SYNTHESIZE, router.next(s));
        }
    }

    // ===================================================================
    //  Rules 2 and 3: recovery and replanning
    // ===================================================================

    @Test
    @DisplayName("error recovery with retries left goes to recover")
    void recover() {
        var s = state(Map.of(
                RunState.ERROR_RECOVERY_FLAG, true,
                RunState.REPLAN_FLAG, true,
                RunState.SUBTASKS, List.of(failed("task_1"))));
        assertEquals(Step.RECOVER, router.next(s));
    }

    @Test
    @DisplayName("error recovery without retries left falls through")
    void recoveryBudgetSpent() {
        var s = state(Map.of(
                RunState.ERROR_RECOVERY_FLAG, true,
                RunState.RETRY_COUNT, 3,
                RunState.SUBTASKS, List.of(failed("task_1"))));
        assertEquals(Step.SYNTHESIZE, router.next(s));
    }

    @Test
    @DisplayName("replan flag goes to decompose")
    void replan() {
        var s = state(Map.of(
                RunState.REPLAN_FLAG, true,
                RunState.SUBTASKS, List.of(failed("task_1"))));
        assertEquals(Step.DECOMPOSE, router.next(s));
    }

    // ===================================================================
    //  Rule 4: everything resolved
    // ===================================================================

    @Test
    @DisplayName("no subtasks and no validation pending synthesizes")
    void emptySynthesizes() {
        assertEquals(Step.SYNTHESIZE, router.next(state(Map.of(RunState.ITERATION_COUNT, 1))));
    }

    @Test
    @DisplayName("all resolved with validation pending validates")
    void allResolvedValidates() {
        var s = state(Map.of(
                RunState.NEEDS_VALIDATION, true,
                RunState.SUBTASKS, List.of(completed("task_1"), failed("task_2"))));
        assertEquals(Step.VALIDATE, router.next(s));
    }

    @Test
    @DisplayName("all resolved without validation synthesizes")
    void allResolvedSynthesizes() {
        var s = state(Map.of(RunState.SUBTASKS, List.of(completed("task_1"), completed("task_2"))));
        assertEquals(Step.SYNTHESIZE, router.next(s));
    }

    @Test
    @DisplayName("a retry scheduled on a failed subtask executes it")
    void scheduledRetryExecutes() {
        var s = state(Map.of(
                RunState.RETRY_COUNT, 1,
                RunState.CURRENT_TASK, "task_1",
                RunState.SUBTASKS, List.of(failed("task_1"))));
        assertEquals(Step.EXECUTE, router.next(s));
    }

    // ===================================================================
    //  Rule 5: mid-run validation
    // ===================================================================

    @Test
    @DisplayName("validates mid-run when an eligible execution exists and nothing was validated")
    void midRunValidation() {
        var s = state(Map.of(
                RunState.NEEDS_VALIDATION, true,
                RunState.TOOL_LOG, List.of(calcExecution()),
                RunState.SUBTASKS, List.of(completed("task_1"), pending("task_2"))));
        assertEquals(Step.VALIDATE, router.next(s));
    }

    @Test
    @DisplayName("skips mid-run validation once any validation exists")
    void midRunValidationOnlyOnce() {
        var s = state(Map.of(
                RunState.NEEDS_VALIDATION, true,
                RunState.TOOL_LOG, List.of(calcExecution()),
                RunState.VALIDATIONS, List.of(new ValidationResult("exec-1", true, 0.95, List.of(), Map.of())),
                RunState.SUBTASKS, List.of(completed("task_1"), pending("task_2"))));
        assertEquals(Step.EXECUTE, router.next(s));
    }

    @Test
    @DisplayName("skips mid-run validation without an eligible execution")
    void midRunValidationNeedsExecution() {
        var s = state(Map.of(
                RunState.NEEDS_VALIDATION, true,
                RunState.SUBTASKS, List.of(pending("task_1"))));
        assertEquals(Step.EXECUTE, router.next(s));
    }

    // ===================================================================
    //  Rules 6 and 7
    // ===================================================================

    @Test
    @DisplayName("pending subtask executes")
    void pendingExecutes() {
        var s = state(Map.of(RunState.SUBTASKS, List.of(completed("task_1"), pending("task_2"))));
        assertEquals(Step.EXECUTE, router.next(s));
    }

    @Test
    @DisplayName("an in-progress subtask with no current task synthesizes")
    void nothingRunnable() {
        var inProgress = pending("task_1").startAttempt();
        var s = state(Map.of(RunState.SUBTASKS, List.of(inProgress)));
        assertEquals(Step.SYNTHESIZE, router.next(s));
    }

    // ===================================================================
    //  Entry routing
    // ===================================================================

    @Test
    @DisplayName("fresh run enters at decompose")
    void entryFresh() {
        assertEquals(Step.DECOMPOSE, router.entry(state(Map.of())));
        assertEquals("decompose", router.routeEntry(state(Map.of())));
    }

    @Test
    @DisplayName("resumed run enters wherever the rules point")
    void entryResumed() {
        var s = state(Map.of(
                RunState.ITERATION_COUNT, 3,
                RunState.CURRENT_TASK, "task_2",
                RunState.SUBTASKS, List.of(completed("task_1"), pending("task_2"))));
        assertEquals(Step.EXECUTE, router.entry(s));
        assertEquals("execute", router.route(s));
    }
}
