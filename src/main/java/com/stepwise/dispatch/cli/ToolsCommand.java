package com.stepwise.dispatch.cli;

import com.stepwise.core.tools.ToolCatalog;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: stepwise tools
 */
@Command(name = "tools", mixinStandardHelpOptions = true, description = "List the tools available to runs")
@Component
public class ToolsCommand implements Runnable {

    private final ToolCatalog toolCatalog;

    public ToolsCommand(ToolCatalog toolCatalog) {
        this.toolCatalog = toolCatalog;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (toolCatalog.isEmpty()) {
            ConsoleOutput.info("No tools available. Is the MCP server configured?");
            return;
        }
        System.out.println("TOOLS:");
        System.out.println(toolCatalog.describeAll().indent(2).stripTrailing());
    }
}
