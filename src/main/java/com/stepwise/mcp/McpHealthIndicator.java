package com.stepwise.mcp;

import io.modelcontextprotocol.client.McpSyncClient;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for the MCP tool server. Pings the client once it exists.
 */
@Component
@ConditionalOnProperty(prefix = "stepwise.mcp", name = "enabled", havingValue = "true")
public class McpHealthIndicator implements HealthIndicator {

    private final McpClientManager clientManager;
    private final McpProperties props;

    public McpHealthIndicator(McpClientManager clientManager, McpProperties props) {
        this.clientManager = clientManager;
        this.props = props;
    }

    @Override
    public Health health() {
        if (!clientManager.isConfigured()) {
            return Health.unknown().withDetail("reason", "not configured").build();
        }
        if (!clientManager.hasClient()) {
            return Health.up()
                    .withDetail("endpoint", props.describeEndpoint())
                    .withDetail("connection", "configured (not connected yet)")
                    .build();
        }
        try {
            McpSyncClient client = clientManager.getClient();
            client.ping();
            return Health.up().withDetail("endpoint", props.describeEndpoint()).build();
        } catch (Exception e) {
            return Health.down()
                    .withDetail("endpoint", props.describeEndpoint())
                    .withDetail("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}
