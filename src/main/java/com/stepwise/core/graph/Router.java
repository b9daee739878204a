package com.stepwise.core.graph;

import com.stepwise.core.model.ToolExecution;
import com.stepwise.core.state.RunState;

/**
 * Pure decision function from run state to the next component.
 * <p>
 * Rules are evaluated in a fixed priority order, first match wins:
 * <ol>
 *   <li>iteration ceiling reached: synthesize (always wins)</li>
 *   <li>error recovery requested and retries left: recover</li>
 *   <li>replan requested: decompose</li>
 *   <li>every subtask resolved and no retry scheduled: validate if validation is pending, else synthesize</li>
 *   <li>validation pending, an eligible execution exists and nothing validated yet: validate</li>
 *   <li>a current subtask is selected or one is pending: execute</li>
 *   <li>otherwise: synthesize</li>
 * </ol>
 */
public class Router {

    private final String validationTool;

    public Router(String validationTool) {
        this.validationTool = validationTool;
    }

    public Step next(RunState state) {
        if (state.budgetExhausted()) {
            return Step.SYNTHESIZE;
        }
        if (state.errorRecoveryFlag() && state.retryCount() < state.maxRetries()) {
            return Step.RECOVER;
        }
        if (state.replanFlag()) {
            return Step.DECOMPOSE;
        }
        boolean allResolved = state.allResolved() && !state.retryScheduled();
        if (allResolved) {
            return state.needsValidation() ? Step.VALIDATE : Step.SYNTHESIZE;
        }
        if (state.needsValidation() && hasEligibleExecution(state) && state.validations().isEmpty()) {
            return Step.VALIDATE;
        }
        if (state.currentTask().isPresent() || state.firstPending().isPresent()) {
            return Step.EXECUTE;
        }
        return Step.SYNTHESIZE;
    }

    /**
     * Entry routing: a fresh run always starts by decomposing; a resumed run
     * (iteration count above zero) continues wherever the router sends it.
     */
    public Step entry(RunState state) {
        if (state.iterationCount() == 0 && state.subtasks().isEmpty()) {
            return Step.DECOMPOSE;
        }
        return next(state);
    }

    /** Edge action for LangGraph4j conditional edges. */
    public String route(RunState state) {
        return next(state).nodeName();
    }

    public String routeEntry(RunState state) {
        return entry(state).nodeName();
    }

    private boolean hasEligibleExecution(RunState state) {
        for (ToolExecution execution : state.toolLog()) {
            if (validationTool.equals(execution.toolName()) && execution.hasResult()) {
                return true;
            }
        }
        return false;
    }
}
