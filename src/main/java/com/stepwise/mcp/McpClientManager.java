package com.stepwise.mcp;

import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.HttpClientStreamableHttpTransport;
import io.modelcontextprotocol.client.transport.ServerParameters;
import io.modelcontextprotocol.client.transport.StdioClientTransport;
import io.modelcontextprotocol.spec.McpClientTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Owns the single MCP sync client used to execute tools.
 * <p>
 * The client is created and initialized on first use and reused for every call
 * afterwards. A failed connection attempt is not cached, so the next call retries.
 */
@Component
public class McpClientManager {

    private static final Logger log = LoggerFactory.getLogger(McpClientManager.class);

    private final McpProperties props;
    private volatile McpSyncClient client;

    public McpClientManager(McpProperties props) {
        this.props = props;
    }

    /**
     * Returns the connected client, connecting if needed.
     *
     * @return the client, or null if MCP is not configured
     */
    public McpSyncClient getClient() {
        if (!props.isConfigured()) {
            return null;
        }
        McpSyncClient current = client;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (client == null) {
                client = connect();
            }
            return client;
        }
    }

    private McpSyncClient connect() {
        McpSyncClient created = newClient();
        try {
            created.initialize();
        } catch (RuntimeException e) {
            try {
                created.close();
            } catch (RuntimeException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        log.info("MCP client connected via {} to {}", props.getTransport(), props.describeEndpoint());
        return created;
    }

    McpSyncClient newClient() {
        return McpClient.sync(createTransport())
                .requestTimeout(props.getRequestTimeout())
                .build();
    }

    private McpClientTransport createTransport() {
        if (props.getTransport() == McpProperties.Transport.STDIO) {
            var params = ServerParameters.builder(props.getCommand())
                    .args(props.getArgs())
                    .build();
            return new StdioClientTransport(params);
        }
        var transportBuilder = HttpClientStreamableHttpTransport.builder(props.getUrl());
        String token = props.getToken();
        if (token != null && !token.isBlank()) {
            transportBuilder.customizeRequest(req -> req.header("Authorization", "Bearer " + token));
        }
        return transportBuilder.build();
    }

    public boolean hasClient() {
        return client != null;
    }

    public boolean isConfigured() {
        return props.isConfigured();
    }

    public synchronized void close() {
        if (client == null) {
            return;
        }
        try {
            client.close();
            log.info("MCP client disconnected from {}", props.describeEndpoint());
        } catch (Exception e) {
            log.debug("Error closing MCP client: {}", e.getMessage());
        } finally {
            client = null;
        }
    }
}
