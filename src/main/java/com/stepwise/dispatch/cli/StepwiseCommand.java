package com.stepwise.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Stepwise.
 */
@Command(
        name = "stepwise",
        mixinStandardHelpOptions = true,
        version = "Stepwise 0.1.0",
        description = "Multi-step tool orchestration powered by LangGraph4j and MCP",
        subcommands = {
                RunCommand.class,
                ResumeCommand.class,
                InspectCommand.class,
                HistoryCommand.class,
                ToolsCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class StepwiseCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
