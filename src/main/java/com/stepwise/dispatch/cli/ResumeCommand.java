package com.stepwise.dispatch.cli;

import com.stepwise.core.engine.RunEngine;
import com.stepwise.core.events.EventBus;
import com.stepwise.core.state.RunState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: stepwise resume &lt;run-key&gt;
 * <p>
 * Continues an interrupted run from its latest checkpoint.
 */
@Command(name = "resume", mixinStandardHelpOptions = true, description = "Resume an interrupted run")
@Component
public class ResumeCommand implements Runnable {

    @Parameters(index = "0", description = "Run key")
    private String runKey;

    private final RunEngine runEngine;
    private final EventBus eventBus;

    public ResumeCommand(RunEngine runEngine, EventBus eventBus) {
        this.runEngine = runEngine;
        this.eventBus = eventBus;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        EventBus.Subscription subscription = eventBus.subscribe(runKey, ConsoleOutput::event);
        RunState finalState;
        try {
            ConsoleOutput.info("Resuming run " + runKey + "...");
            finalState = runEngine.resume(runKey);
        } catch (IllegalStateException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        } catch (Exception e) {
            ConsoleOutput.error("Run failed: " + RunCommand.rootCauseMessage(e));
            return;
        } finally {
            subscription.unsubscribe();
        }

        ConsoleOutput.summary(finalState);
    }
}
