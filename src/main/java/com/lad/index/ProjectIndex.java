package com.lad.index;

/**
 * Read-only view of a project offered to reviewer models through tool calls.
 * <p>
 * Every operation returns text ready to be handed back to the model (JSON for the
 * filesystem adapter) or throws {@link ProjectIndexException}.
 */
public interface ProjectIndex {

    /**
     * Activates the project. Only the project root (or {@code "."}) may be activated.
     */
    String activateProject(String project);

    String listDirectory(String path);

    /**
     * Reads a text file. {@code head} and {@code tail} optionally limit the result to the
     * first or last N lines. When both are given, {@code head} is applied first and the tail
     * is taken from those lines, except for files too large to load, which return both ends.
     */
    String readFile(String path, Integer head, Integer tail);

    String readMemory(String name);

    String listMemories();

    /**
     * Searches project files for {@code pattern}, optionally restricted to {@code scope}.
     */
    String searchPattern(String pattern, String scope);

    /**
     * Short description for disclosure footers, e.g. {@code filesystem} or {@code mcp:http://...}.
     */
    String describe();
}
