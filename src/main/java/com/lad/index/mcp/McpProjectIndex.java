package com.lad.index.mcp;

import com.lad.index.ProjectIndex;
import com.lad.index.ProjectIndexException;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link ProjectIndex} that forwards each operation to a Serena server over MCP.
 * Results are the server's text content, passed through unchanged.
 */
public class McpProjectIndex implements ProjectIndex {

    private final McpSyncClient client;
    private final String serverUrl;

    public McpProjectIndex(McpSyncClient client, String serverUrl) {
        this.client = client;
        this.serverUrl = serverUrl;
    }

    @Override
    public String activateProject(String project) {
        return call("activate_project", Map.of("project", project == null || project.isBlank() ? "." : project));
    }

    @Override
    public String listDirectory(String path) {
        return call("list_dir", Map.of("relative_path", path == null ? "." : path, "recursive", false));
    }

    @Override
    public String readFile(String path, Integer head, Integer tail) {
        if (head != null && head < 0) {
            throw new ProjectIndexException("head must be >= 0");
        }
        if (tail != null && tail < 0) {
            throw new ProjectIndexException("tail must be >= 0");
        }
        if (Integer.valueOf(0).equals(head) || Integer.valueOf(0).equals(tail)) {
            return "";
        }
        var args = new LinkedHashMap<String, Object>();
        args.put("relative_path", path);
        if (head != null) {
            args.put("start_line", 0);
            args.put("end_line", head - 1);
        }
        String text = call("read_file", args);
        if (tail == null) {
            return text;
        }
        boolean trailingNewline = text.endsWith("\n");
        String body = trailingNewline ? text.substring(0, text.length() - 1) : text;
        String[] lines = body.split("\n", -1);
        int from = Math.max(0, lines.length - tail);
        return String.join("\n", Arrays.copyOfRange(lines, from, lines.length)) + (trailingNewline ? "\n" : "");
    }

    @Override
    public String readMemory(String name) {
        return call("read_memory", Map.of("memory_file_name", name));
    }

    @Override
    public String listMemories() {
        return call("list_memories", Map.of());
    }

    @Override
    public String searchPattern(String pattern, String scope) {
        return call("search_for_pattern", Map.of(
                "substring_pattern", pattern,
                "relative_path", scope == null || ".".equals(scope) ? "" : scope));
    }

    private String call(String tool, Map<String, Object> arguments) {
        McpSchema.CallToolResult result;
        try {
            result = client.callTool(new McpSchema.CallToolRequest(tool, arguments));
        } catch (RuntimeException e) {
            throw new ProjectIndexException("MCP call '" + tool + "' failed: " + e.getMessage(), e);
        }
        var text = new StringBuilder();
        if (result.content() != null) {
            for (McpSchema.Content content : result.content()) {
                if (content instanceof McpSchema.TextContent tc) {
                    if (!text.isEmpty()) text.append('\n');
                    text.append(tc.text());
                }
            }
        }
        if (Boolean.TRUE.equals(result.isError())) {
            throw new ProjectIndexException(text.isEmpty() ? "MCP tool '" + tool + "' reported an error" : text.toString());
        }
        return text.toString();
    }

    @Override
    public String describe() {
        return "mcp:" + serverUrl;
    }
}
