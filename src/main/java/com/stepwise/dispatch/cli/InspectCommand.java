package com.stepwise.dispatch.cli;

import com.stepwise.core.model.ProgressRecord;
import com.stepwise.core.model.ToolExecution;
import com.stepwise.core.persistence.CheckpointQueryService;
import com.stepwise.core.state.RunState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: stepwise inspect &lt;run-key&gt;
 * <p>
 * Shows the latest checkpointed state of a run: subtasks, tool calls, validations,
 * errors and, with {@code --log}, the full progress log.
 */
@Command(name = "inspect", mixinStandardHelpOptions = true, description = "Inspect the latest state of a run")
@Component
public class InspectCommand implements Runnable {

    @Parameters(index = "0", description = "Run key")
    private String runKey;

    @Option(names = {"--log", "-l"}, description = "Also print the progress log")
    private boolean showLog;

    private final CheckpointQueryService queryService;

    public InspectCommand(CheckpointQueryService queryService) {
        this.queryService = queryService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var stateOpt = queryService.getLatestState(runKey);
        if (stateOpt.isEmpty()) {
            ConsoleOutput.error("Run not found: " + runKey);
            return;
        }
        RunState state = stateOpt.get();

        if (!state.toolLog().isEmpty()) {
            System.out.println();
            System.out.println("TOOL CALLS:");
            for (ToolExecution e : state.toolLog()) {
                System.out.printf("  %s [%s] %s %s -> %s%n", e.id(), e.subtaskId(), e.toolName(), e.arguments(),
                        e.succeeded() ? "ok" : "FAILED: " + e.error());
            }
        }

        if (showLog) {
            System.out.println();
            System.out.println("PROGRESS LOG:");
            for (ProgressRecord p : state.progressLog()) {
                System.out.printf("  %s [%s] %s%n", p.timestamp(), p.kind().wireName(), p.content());
            }
        }

        ConsoleOutput.summary(state);
    }
}
