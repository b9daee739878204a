package com.stepwise.mcp;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Connection settings for the MCP server that executes tools.
 *
 * <pre>
 * stepwise:
 *   mcp:
 *     enabled: true
 *     transport: streamable-http   # or stdio
 *     url: http://localhost:8000/mcp
 *     token: optional-bearer-token
 *     command: python              # stdio only
 *     args: [server.py]
 *     request-timeout: 30s
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "stepwise.mcp")
public class McpProperties {

    public enum Transport { STREAMABLE_HTTP, STDIO }

    private boolean enabled = false;
    private Transport transport = Transport.STREAMABLE_HTTP;
    private String url = "";
    private String token = "";
    private String command = "";
    private List<String> args = new ArrayList<>();
    private Duration requestTimeout = Duration.ofSeconds(30);

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public Transport getTransport() { return transport; }
    public void setTransport(Transport transport) { this.transport = transport; }
    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public String getToken() { return token; }
    public void setToken(String token) { this.token = token; }
    public String getCommand() { return command; }
    public void setCommand(String command) { this.command = command; }
    public List<String> getArgs() { return args; }
    public void setArgs(List<String> args) { this.args = args; }
    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }

    /**
     * Returns {@code true} when MCP is enabled and the selected transport has its endpoint set.
     */
    public boolean isConfigured() {
        if (!enabled) {
            return false;
        }
        return transport == Transport.STDIO
                ? command != null && !command.isBlank()
                : url != null && !url.isBlank();
    }

    /** Where the server lives, for logs and health details. */
    public String describeEndpoint() {
        return transport == Transport.STDIO
                ? (command + " " + String.join(" ", args)).strip()
                : url;
    }
}
