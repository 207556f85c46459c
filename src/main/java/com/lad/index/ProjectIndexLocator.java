package com.lad.index;

import com.lad.core.config.LadProperties;
import com.lad.index.mcp.McpClientManager;
import com.lad.index.mcp.McpProjectIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Chooses the project index for a review.
 * <p>
 * Order: the remote MCP server when configured and reachable; otherwise the filesystem
 * index when the project root carries a {@code .serena} directory; otherwise none, with
 * the reason recorded for the disclosure footer.
 */
@Component
public class ProjectIndexLocator {

    private static final Logger log = LoggerFactory.getLogger(ProjectIndexLocator.class);

    private final McpClientManager mcpClientManager;
    private final LadProperties properties;

    public ProjectIndexLocator(McpClientManager mcpClientManager, LadProperties properties) {
        this.mcpClientManager = mcpClientManager;
        this.properties = properties;
    }

    public IndexLookup locate(Path projectRoot) {
        if (mcpClientManager.isConfigured()) {
            var client = mcpClientManager.getClient();
            if (client != null) {
                return IndexLookup.found(new McpProjectIndex(client, mcpClientManager.getUrl()));
            }
            log.warn("MCP project index configured but unreachable, falling back to filesystem detection");
        }

        if (projectRoot == null) {
            return IndexLookup.unavailable("No project root was provided.");
        }
        if (!Files.isDirectory(projectRoot)) {
            return IndexLookup.unavailable("Project root does not exist: " + projectRoot.getFileName());
        }
        if (!FileSystemProjectIndex.isIndexed(projectRoot)) {
            return IndexLookup.unavailable("No .serena directory found at the project root.");
        }

        var tools = properties.getTools();
        return IndexLookup.found(new FileSystemProjectIndex(projectRoot,
                tools.getMaxDirEntries(), tools.getMaxSearchResults(),
                Duration.ofSeconds(tools.getToolTimeoutSeconds())));
    }

    /**
     * Result of index selection: either an index or the reason none is available.
     */
    public record IndexLookup(ProjectIndex index, String unavailableReason) {

        public static IndexLookup found(ProjectIndex index) {
            return new IndexLookup(index, null);
        }

        public static IndexLookup unavailable(String reason) {
            return new IndexLookup(null, reason);
        }

        public boolean isAvailable() {
            return index != null;
        }
    }
}
