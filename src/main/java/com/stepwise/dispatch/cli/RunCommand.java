package com.stepwise.dispatch.cli;

import com.stepwise.core.engine.RunEngine;
import com.stepwise.core.engine.RunOptions;
import com.stepwise.core.events.EventBus;
import com.stepwise.core.state.RunState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: stepwise run "&lt;request&gt;"
 * <p>
 * Runs a request to completion, printing progress events as they happen and the
 * final answer at the end.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a request to completion")
@Component
public class RunCommand implements Runnable {

    @Parameters(index = "0", description = "Natural language request")
    private String request;

    @Option(names = {"--max-iterations", "-i"}, description = "Iteration budget (default: configured)")
    private Integer maxIterations;

    @Option(names = {"--max-retries", "-r"}, description = "Recovery budget (default: configured)")
    private Integer maxRetries;

    @Option(names = {"--key", "-k"}, description = "Run key, used to resume the run later")
    private String runKey;

    @Option(names = {"--quiet", "-q"}, description = "Only print the final summary")
    private boolean quiet;

    private final RunEngine runEngine;
    private final EventBus eventBus;

    public RunCommand(RunEngine runEngine, EventBus eventBus) {
        this.runEngine = runEngine;
        this.eventBus = eventBus;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        RunOptions options;
        try {
            options = new RunOptions(runKey, maxIterations, maxRetries);
            runEngine.checkOptions(options);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }

        EventBus.Subscription subscription = quiet ? null : eventBus.subscribeAll(ConsoleOutput::event);
        RunState finalState;
        try {
            ConsoleOutput.info("Decomposing request...");
            finalState = runEngine.run(request, options);
        } catch (Exception e) {
            ConsoleOutput.error("Run failed: " + rootCauseMessage(e));
            return;
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }

        ConsoleOutput.summary(finalState);
    }

    static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
