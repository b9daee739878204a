package com.stepwise.mcp;

import com.stepwise.core.model.ToolDescriptor;
import com.stepwise.core.tools.ToolExecutionService;
import com.stepwise.core.tools.ToolInvocationException;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Executes tools on the configured MCP server.
 * <p>
 * Error results ({@code isError}) and transport failures both surface as
 * {@link ToolInvocationException}, so callers handle a single failure type.
 */
@Service
public class McpToolExecutionService implements ToolExecutionService {

    private static final Logger log = LoggerFactory.getLogger(McpToolExecutionService.class);

    private final McpClientManager clientManager;

    public McpToolExecutionService(McpClientManager clientManager) {
        this.clientManager = clientManager;
    }

    @Override
    public String invoke(String name, Map<String, Object> arguments) throws ToolInvocationException {
        McpSyncClient client = connectedClient();
        McpSchema.CallToolResult result;
        try {
            result = client.callTool(new McpSchema.CallToolRequest(name,
                    arguments == null ? Map.of() : new LinkedHashMap<>(arguments)));
        } catch (RuntimeException e) {
            throw new ToolInvocationException("Tool " + name + " call failed: " + e.getMessage(), e);
        }

        String text = textOf(result);
        if (Boolean.TRUE.equals(result.isError())) {
            throw new ToolInvocationException(text.isBlank() ? "Tool " + name + " reported an error" : text);
        }
        log.debug("Tool {} returned {} chars", name, text.length());
        return text;
    }

    @Override
    public List<ToolDescriptor> listTools() {
        if (!clientManager.isConfigured()) {
            log.info("MCP not configured; no tools available");
            return List.of();
        }
        McpSyncClient client = clientManager.getClient();
        var tools = client.listTools().tools();
        if (tools == null) {
            return List.of();
        }
        var descriptors = new ArrayList<ToolDescriptor>();
        for (McpSchema.Tool tool : tools) {
            descriptors.add(toDescriptor(tool));
        }
        log.info("Discovered {} MCP tool(s): {}", descriptors.size(),
                descriptors.stream().map(ToolDescriptor::name).collect(Collectors.joining(", ")));
        return descriptors;
    }

    @Override
    public void close() {
        clientManager.close();
    }

    private McpSyncClient connectedClient() throws ToolInvocationException {
        if (!clientManager.isConfigured()) {
            throw new ToolInvocationException("No MCP tool server is configured");
        }
        try {
            return clientManager.getClient();
        } catch (RuntimeException e) {
            throw new ToolInvocationException("Could not connect to MCP server: " + e.getMessage(), e);
        }
    }

    /**
     * Required parameters first, then optional ones, each in schema order.
     */
    static ToolDescriptor toDescriptor(McpSchema.Tool tool) {
        var parameters = new ArrayList<String>();
        McpSchema.JsonSchema schema = tool.inputSchema();
        if (schema != null) {
            List<String> required = schema.required() == null ? List.of() : schema.required();
            parameters.addAll(required);
            if (schema.properties() != null) {
                for (String property : schema.properties().keySet()) {
                    if (!required.contains(property)) {
                        parameters.add(property);
                    }
                }
            }
        }
        String description = tool.description() == null ? "" : tool.description().strip();
        return new ToolDescriptor(tool.name(), description, parameters);
    }

    private static String textOf(McpSchema.CallToolResult result) {
        if (result.content() == null) {
            return "";
        }
        return result.content().stream()
                .filter(c -> c instanceof McpSchema.TextContent)
                .map(c -> ((McpSchema.TextContent) c).text())
                .collect(Collectors.joining("\n"));
    }
}
