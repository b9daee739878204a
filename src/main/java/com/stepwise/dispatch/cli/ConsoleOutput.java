package com.stepwise.dispatch.cli;

import com.stepwise.core.events.RunEvent;
import com.stepwise.core.model.RunOutcome;
import com.stepwise.core.model.Subtask;
import com.stepwise.core.model.SubtaskStatus;
import com.stepwise.core.state.RunState;
import picocli.CommandLine;

import java.util.Locale;
import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the Stepwise CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) STEPWISE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [STEPWISE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    /**
     * Live rendering of one progress event. {@code final_answer} and {@code done} are
     * left to the command, which prints the final state.
     */
    @SuppressWarnings("unchecked")
    public static void event(RunEvent event) {
        if (!(event.data() instanceof Map<?, ?> raw)) {
            return;
        }
        Map<String, Object> data = (Map<String, Object>) raw;
        switch (event.eventType()) {
            case REASONING -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(blue) [" + String.valueOf(data.get("type")).toUpperCase(Locale.ROOT) + "]|@ " + data.get("content")));
            case SUBTASK_UPDATE -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(magenta) [" + data.get("id") + "]|@ " + data.get("status") + " - " + data.get("description")));
            case TOOL_EXECUTION -> {
                boolean ok = Boolean.TRUE.equals(data.get("success"));
                String symbol = ok ? "@|fg(green) +|@" : "@|fg(red) x|@";
                System.out.println(CommandLine.Help.Ansi.AUTO.string(
                        "  " + symbol + " " + data.get("tool") + " " + data.get("arguments")));
            }
            case ERROR -> error(String.valueOf(data.get("message")));
            default -> { }
        }
    }

    public static void subtask(Subtask subtask) {
        String color = subtask.status() == SubtaskStatus.COMPLETED ? "green"
                : subtask.status() == SubtaskStatus.FAILED ? "red" : "yellow";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  %s. @|fg(%s) [%-11s]|@ %s (attempts: %d)",
                subtask.id(), color, subtask.status(), subtask.description(), subtask.attemptCount())));
        if (subtask.error() != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("      @|fg(red) -|@ " + subtask.error()));
        }
    }

    /**
     * Prints subtasks, errors and the final answer of a run.
     */
    public static void summary(RunState state) {
        System.out.println();
        System.out.println("RUN " + state.runKey());
        System.out.println("Request: " + state.request());
        System.out.println("Iterations: " + state.iterationCount() + " / " + state.maxIterations()
                + " | Retries: " + state.retryCount() + " / " + state.maxRetries()
                + " | Tool calls: " + state.toolLog().size());

        if (!state.subtasks().isEmpty()) {
            System.out.println();
            System.out.println("SUBTASKS:");
            state.subtasks().forEach(ConsoleOutput::subtask);
        }

        if (!state.validations().isEmpty()) {
            System.out.println();
            System.out.println("VALIDATIONS:");
            for (var v : state.validations()) {
                System.out.printf("  %s: confidence %.2f, valid %s%n", v.executionId(), v.confidence(), v.valid());
            }
        }

        var errors = state.errorLog();
        if (!errors.isEmpty()) {
            System.out.println();
            error("Errors (" + errors.size() + "):");
            for (var e : errors) {
                error("  " + e.subtaskId() + " (" + e.toolName() + "): " + e.message());
            }
        }

        System.out.println();
        if (state.finalAnswer().isEmpty()) {
            info("Run not finished (resume with: stepwise resume " + state.runKey() + ")");
            return;
        }
        System.out.println("ANSWER:");
        System.out.println(state.finalAnswer().get());
        System.out.println();
        RunOutcome outcome = state.outcome();
        if (outcome == RunOutcome.COMPLETED) {
            success("Run complete.");
        } else if (outcome == RunOutcome.TRUNCATED) {
            warn("Run truncated: iteration budget exhausted before all work finished.");
        } else {
            warn("Run finished with partial results: recovery exhausted.");
        }
    }
}
