package com.stepwise.dispatch.cli;

import com.stepwise.core.persistence.CheckpointQueryService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: stepwise history
 * <p>
 * Lists the runs known to the checkpoint store.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List known runs")
@Component
public class HistoryCommand implements Runnable {

    private final CheckpointQueryService queryService;

    public HistoryCommand(CheckpointQueryService queryService) {
        this.queryService = queryService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var keys = queryService.listRunKeys();
        if (keys.isEmpty()) {
            ConsoleOutput.info("No runs found.");
            return;
        }

        System.out.printf("%-16s %-20s %-10s %s%n", "RUN", "OUTCOME", "STEPS", "REQUEST");
        for (String key : keys) {
            queryService.getLatestState(key).ifPresent(state -> System.out.printf("%-16s %-20s %-10d %s%n",
                    key,
                    state.isFinished() ? state.outcome().name() : "UNFINISHED",
                    state.iterationCount(),
                    truncate(state.request(), 60)));
        }
    }

    private static String truncate(String text, int max) {
        return text.length() > max ? text.substring(0, max - 3) + "..." : text;
    }
}
