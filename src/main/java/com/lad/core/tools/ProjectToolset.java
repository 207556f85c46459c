package com.lad.core.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lad.index.ProjectIndex;
import com.lad.index.ProjectIndexException;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;

import java.util.List;
import java.util.Map;

/**
 * Read-only tool surface offered to reviewer models, backed by one {@link ProjectIndex}.
 * <p>
 * The callbacks carry only the definitions shown to the model; execution is driven by
 * {@link ToolCallBridge} through {@link #execute(String, Map)}.
 */
public class ProjectToolset {

    public static final String ACTIVATE_PROJECT = "activate_project";
    public static final String LIST_DIR = "list_dir";
    public static final String READ_FILE = "read_file";
    public static final String READ_MEMORY = "read_memory";
    public static final String LIST_MEMORIES = "list_memories";
    public static final String READ_PROJECT_OVERVIEW = "read_project_overview";
    public static final String SEARCH_FOR_PATTERN = "search_for_pattern";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ProjectIndex index;
    private final List<ToolCallback> callbacks;

    public ProjectToolset(ProjectIndex index) {
        this.index = index;
        this.callbacks = List.of(
                callback(ACTIVATE_PROJECT,
                        "Activate the current project (required preflight). Call with project='.' to activate the repo root.",
                        """
                        {"type":"object","properties":{"project":{"type":"string","description":"Must be '.' or the absolute path to the repo root."}},"required":["project"]}
                        """),
                callback(LIST_MEMORIES,
                        "List available project memories (from .serena/memories).",
                        """
                        {"type":"object","properties":{},"required":[]}
                        """),
                callback(READ_PROJECT_OVERVIEW,
                        "Read the project_overview memory, if present.",
                        """
                        {"type":"object","properties":{},"required":[]}
                        """),
                callback(READ_MEMORY,
                        "Read a project memory by name (no path traversal).",
                        """
                        {"type":"object","properties":{"name":{"type":"string","description":"Memory name (with or without .md)."}},"required":["name"]}
                        """),
                callback(LIST_DIR,
                        "List files and directories under a repo-relative path (read-only).",
                        """
                        {"type":"object","properties":{"path":{"type":"string","description":"Repo-relative path. Use '.' for the repo root."}},"required":["path"]}
                        """),
                callback(READ_FILE,
                        "Read a text file under the repo root (read-only).",
                        """
                        {"type":"object","properties":{"path":{"type":"string","description":"Repo-relative file path."},"head":{"type":"integer","description":"Optional: read only the first N lines."},"tail":{"type":"integer","description":"Optional: read only the last N lines."}},"required":["path"]}
                        """),
                callback(SEARCH_FOR_PATTERN,
                        "Search repo files for a literal substring (read-only).",
                        """
                        {"type":"object","properties":{"pattern":{"type":"string","description":"Substring to search for."},"path":{"type":"string","description":"Optional repo-relative path to restrict the search."}},"required":["pattern"]}
                        """));
    }

    public static boolean isActivation(String toolName) {
        return ACTIVATE_PROJECT.equals(toolName);
    }

    public List<ToolCallback> callbacks() {
        return callbacks;
    }

    public ProjectIndex index() {
        return index;
    }

    /**
     * Runs one tool against the index.
     *
     * @throws ProjectIndexException on unknown tools, bad arguments or index failures
     */
    public String execute(String toolName, Map<String, Object> args) {
        return switch (toolName) {
            case ACTIVATE_PROJECT -> index.activateProject(stringArg(args, "project"));
            case LIST_MEMORIES -> index.listMemories();
            case READ_PROJECT_OVERVIEW -> index.readMemory("project_overview");
            case READ_MEMORY -> index.readMemory(stringArg(args, "name"));
            case LIST_DIR -> index.listDirectory(stringArg(args, "path"));
            case READ_FILE -> index.readFile(stringArg(args, "path"), intArg(args, "head"), intArg(args, "tail"));
            case SEARCH_FOR_PATTERN -> index.searchPattern(stringArg(args, "pattern"), stringArg(args, "path"));
            default -> throw new ProjectIndexException("Unknown tool: " + toolName);
        };
    }

    /**
     * Parses a tool-call argument string. Blank input yields an empty map.
     *
     * @throws ProjectIndexException if the text is not a JSON object
     */
    public static Map<String, Object> parseArguments(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = MAPPER.readValue(json, new TypeReference<Map<String, Object>>() {});
            return parsed != null ? parsed : Map.of();
        } catch (JsonProcessingException e) {
            throw new ProjectIndexException("Tool arguments must be a JSON object: " + e.getOriginalMessage());
        }
    }

    private static String stringArg(Map<String, Object> args, String key) {
        Object value = args.get(key);
        return value != null ? value.toString() : null;
    }

    private static Integer intArg(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (value instanceof Number n) return n.intValue();
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw new ProjectIndexException(key + " must be an integer");
            }
        }
        return null;
    }

    private ToolCallback callback(String name, String description, String schema) {
        var definition = ToolDefinition.builder()
                .name(name)
                .description(description)
                .inputSchema(schema.strip())
                .build();
        return new IndexToolCallback(definition, this);
    }

    private static final class IndexToolCallback implements ToolCallback {

        private final ToolDefinition definition;
        private final ProjectToolset toolset;

        IndexToolCallback(ToolDefinition definition, ProjectToolset toolset) {
            this.definition = definition;
            this.toolset = toolset;
        }

        @Override
        public ToolDefinition getToolDefinition() {
            return definition;
        }

        @Override
        public String call(String toolInput) {
            return toolset.execute(definition.name(), parseArguments(toolInput));
        }
    }
}
