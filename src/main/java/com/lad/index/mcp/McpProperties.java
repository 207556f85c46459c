package com.lad.index.mcp;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Connection settings for a remote project-index server (Serena) reached over MCP.
 *
 * <pre>
 * lad:
 *   index:
 *     mcp:
 *       enabled: true
 *       url: http://localhost:9121
 *       sse-endpoint: /sse
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "lad.index.mcp")
public class McpProperties {

    private boolean enabled = false;
    private String url = "";
    private String sseEndpoint = "/sse";
    private int requestTimeoutSeconds = 30;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public String getSseEndpoint() { return sseEndpoint; }
    public void setSseEndpoint(String sseEndpoint) { this.sseEndpoint = sseEndpoint; }
    public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }

    /**
     * Returns {@code true} when MCP is enabled and a server URL is set.
     */
    public boolean isConfigured() {
        return enabled && url != null && !url.isBlank();
    }
}
