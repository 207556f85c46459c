package com.lad.index.mcp;

import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.HttpClientSseClientTransport;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Owns the MCP sync client for the remote project-index server.
 * <p>
 * The client is created on first use and shared by every reviewer. A failed connection
 * attempt is not cached, so the next review tries again.
 */
@Component
public class McpClientManager {

    private static final Logger log = LoggerFactory.getLogger(McpClientManager.class);

    private final McpProperties props;
    private McpSyncClient client;

    public McpClientManager(McpProperties props) {
        this.props = props;
    }

    /**
     * Returns the connected client, creating it if needed.
     *
     * @return the MCP sync client, or null if not configured or unreachable
     */
    public synchronized McpSyncClient getClient() {
        if (!props.isConfigured()) return null;
        if (client != null) return client;

        try {
            var transport = HttpClientSseClientTransport.builder(props.getUrl())
                    .sseEndpoint(props.getSseEndpoint())
                    .build();
            var created = McpClient.sync(transport)
                    .requestTimeout(Duration.ofSeconds(props.getRequestTimeoutSeconds()))
                    .build();
            created.initialize();

            var tools = created.listTools();
            log.info("MCP project index connected at {} ({} tool(s))", props.getUrl(),
                    tools.tools() != null ? tools.tools().size() : 0);
            client = created;
            return client;
        } catch (Exception e) {
            log.warn("Failed to connect to MCP project index at {}: {}", props.getUrl(), e.getMessage());
            return null;
        }
    }

    public boolean isConfigured() {
        return props.isConfigured();
    }

    public String getUrl() {
        return props.getUrl();
    }

    @PreDestroy
    synchronized void shutdown() {
        if (client == null) return;
        try {
            client.close();
            log.info("MCP project index client disconnected");
        } catch (Exception e) {
            log.debug("Error closing MCP client: {}", e.getMessage());
        }
        client = null;
    }
}
