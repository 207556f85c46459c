package com.lad.index;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.ByteBuffer;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Read-only project index backed by the local filesystem.
 * <p>
 * Memories live under {@code <root>/.serena/memories/*.md}. All paths are resolved through
 * {@link RepoPaths#resolveUnder} so traversal and symlink escapes are rejected. Search is a
 * literal substring match over text files, skipping hidden and vendored directories.
 */
public class FileSystemProjectIndex implements ProjectIndex {

    private static final Logger log = LoggerFactory.getLogger(FileSystemProjectIndex.class);

    static final long MAX_FILE_BYTES = 1_000_000;
    static final int MAX_PATTERN_LENGTH = 500;
    private static final int MATCH_LINE_CHARS = 200;
    private static final Set<String> EXCLUDED_DIRS = Set.of(".git", ".venv", "__pycache__", "node_modules", "target", "build");

    private final Path root;
    private final Path memoriesDir;
    private final int maxDirEntries;
    private final int maxSearchResults;
    private final Duration searchTimeout;
    private final ObjectMapper objectMapper;

    public FileSystemProjectIndex(Path root, int maxDirEntries, int maxSearchResults, Duration searchTimeout) {
        this.root = root.toAbsolutePath().normalize();
        this.memoriesDir = this.root.resolve(".serena").resolve("memories");
        this.maxDirEntries = maxDirEntries;
        this.maxSearchResults = maxSearchResults;
        this.searchTimeout = searchTimeout;
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * True when {@code root} carries a {@code .serena} directory.
     */
    public static boolean isIndexed(Path root) {
        return Files.isDirectory(root.resolve(".serena"));
    }

    @Override
    public String activateProject(String project) {
        String requested = project == null || project.isBlank() ? "." : project.trim();
        String rootText = root.toString().replace('\\', '/');
        boolean allowed = ".".equals(requested)
                || requested.equals(root.toString())
                || requested.replace('\\', '/').replaceAll("/+$", "").equals(rootText);
        if (!allowed) {
            throw new ProjectIndexException("Only the current repo root can be activated");
        }
        var result = new LinkedHashMap<String, Object>();
        result.put("status", "activated");
        result.put("project", requested);
        result.put("note", "Project activated. You may now use list_dir, read_file, search_for_pattern and the memory tools.");
        return toJson(result);
    }

    @Override
    public String listDirectory(String path) {
        Path target = ".".equals(path) ? root : RepoPaths.resolveUnder(root, path);
        if (!Files.exists(target)) {
            throw new ProjectIndexException("path not found");
        }
        if (!Files.isDirectory(target)) {
            throw new ProjectIndexException("path is not a directory");
        }

        var entries = new ArrayList<Map<String, String>>();
        int total;
        try (Stream<Path> children = Files.list(target)) {
            List<Path> sorted = children.sorted(Comparator.comparing(p -> p.getFileName().toString())).toList();
            total = sorted.size();
            for (Path child : sorted.subList(0, Math.min(sorted.size(), maxDirEntries))) {
                entries.add(Map.of(
                        "name", child.getFileName().toString(),
                        "type", Files.isDirectory(child) ? "dir" : "file"));
            }
        } catch (IOException e) {
            throw new ProjectIndexException("failed to list directory", e);
        }

        var result = new LinkedHashMap<String, Object>();
        result.put("path", RepoPaths.relativize(root, target));
        result.put("entries", entries);
        if (total > entries.size()) {
            result.put("note", "Listing capped at " + maxDirEntries + " of " + total + " entries.");
        }
        return toJson(result);
    }

    @Override
    public String readFile(String path, Integer head, Integer tail) {
        Path target = RepoPaths.resolveUnder(root, path);
        if (!Files.isRegularFile(target)) {
            throw new ProjectIndexException("path is not a file");
        }
        if (head != null && head < 0) {
            throw new ProjectIndexException("head must be >= 0");
        }
        if (tail != null && tail < 0) {
            throw new ProjectIndexException("tail must be >= 0");
        }

        long size;
        try {
            size = Files.size(target);
        } catch (IOException e) {
            throw new ProjectIndexException("failed to stat file", e);
        }
        if (size > MAX_FILE_BYTES && head == null && tail == null) {
            throw new ProjectIndexException("file is too large to read without head/tail");
        }

        String content;
        try {
            content = size > MAX_FILE_BYTES ? streamSlices(target, head, tail) : sliceLines(readText(target), head, tail);
        } catch (IOException e) {
            throw new ProjectIndexException("failed to read file", e);
        }

        var result = new LinkedHashMap<String, Object>();
        result.put("path", RepoPaths.relativize(root, target));
        result.put("content", content);
        return toJson(result);
    }

    private static String sliceLines(String text, Integer head, Integer tail) {
        List<String> lines = splitKeepingEnds(text);
        if (head != null) {
            lines = lines.subList(0, Math.min(head, lines.size()));
        }
        if (tail != null) {
            lines = tail == 0 ? List.of() : lines.subList(Math.max(0, lines.size() - tail), lines.size());
        }
        return String.join("", lines);
    }

    private static String streamSlices(Path target, Integer head, Integer tail) throws IOException {
        var headLines = new ArrayList<String>();
        Deque<String> tailLines = tail != null && tail > 0 ? new ArrayDeque<>() : null;
        try (BufferedReader reader = newLenientReader(target)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (head != null && lineNo <= head) {
                    headLines.add(line + "\n");
                }
                if (tailLines != null) {
                    tailLines.addLast(line + "\n");
                    if (tailLines.size() > tail) {
                        tailLines.removeFirst();
                    }
                }
            }
        }
        var out = new StringBuilder();
        headLines.forEach(out::append);
        if (tailLines != null) {
            if (head != null) {
                out.append("\n[NOTE: Middle of file omitted due to size.]\n");
            }
            tailLines.forEach(out::append);
        }
        return out.toString();
    }

    @Override
    public String readMemory(String name) {
        if (name == null || name.isBlank()) {
            throw new ProjectIndexException("name must be a non-empty string");
        }
        String fileName = name.endsWith(".md") ? name : name + ".md";
        if (fileName.contains("/") || fileName.contains("\\") || fileName.contains("..")) {
            throw new ProjectIndexException("path traversal is not allowed");
        }
        Path memory = memoriesDir.resolve(fileName).normalize();
        if (!memory.startsWith(memoriesDir) || !Files.isRegularFile(memory)) {
            throw new ProjectIndexException("memory not found");
        }
        try {
            if (!memory.toRealPath().startsWith(root.toRealPath())) {
                throw new ProjectIndexException("invalid memory path");
            }
            var result = new LinkedHashMap<String, Object>();
            result.put("name", fileName);
            result.put("content", readText(memory));
            return toJson(result);
        } catch (IOException e) {
            throw new ProjectIndexException("failed to read memory", e);
        }
    }

    @Override
    public String listMemories() {
        var result = new LinkedHashMap<String, Object>();
        if (!Files.isDirectory(memoriesDir)) {
            result.put("memories", List.of());
            result.put("note", "No .serena/memories directory found.");
            return toJson(result);
        }
        try (Stream<Path> files = Files.list(memoriesDir)) {
            List<String> names = files
                    .filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .filter(n -> n.endsWith(".md"))
                    .sorted()
                    .toList();
            result.put("memories", names);
            return toJson(result);
        } catch (IOException e) {
            throw new ProjectIndexException("failed to list memories", e);
        }
    }

    @Override
    public String searchPattern(String pattern, String scope) {
        if (pattern == null || pattern.isBlank()) {
            throw new ProjectIndexException("pattern must be a non-empty string");
        }
        var result = new LinkedHashMap<String, Object>();
        if (pattern.length() > MAX_PATTERN_LENGTH) {
            result.put("matches", List.of());
            result.put("note", "Pattern rejected: longer than " + MAX_PATTERN_LENGTH + " characters.");
            return toJson(result);
        }

        Path start = root;
        if (scope != null && !scope.isBlank() && !".".equals(scope)) {
            start = RepoPaths.resolveUnder(root, scope);
            if (Files.isRegularFile(start)) {
                start = start.getParent();
            }
        }

        final Path searchRoot = start;
        long deadline = System.nanoTime() + searchTimeout.toNanos();
        var matches = new ArrayList<String>();
        boolean timedOut = false;
        try (Stream<Path> walk = Files.walk(searchRoot)) {
            var files = walk
                    .filter(p -> !isExcluded(searchRoot, p))
                    .filter(Files::isRegularFile)
                    .sorted()
                    .iterator();
            while (files.hasNext() && matches.size() < maxSearchResults) {
                if (System.nanoTime() > deadline) {
                    timedOut = true;
                    break;
                }
                searchFile(files.next(), pattern, matches);
            }
        } catch (IOException e) {
            throw new ProjectIndexException("search failed", e);
        }

        result.put("matches", matches);
        result.put("note", timedOut
                ? "Search timed out; results are partial."
                : "Literal substring search; regex metacharacters are matched literally.");
        return toJson(result);
    }

    private void searchFile(Path file, String pattern, List<String> matches) {
        try {
            if (Files.size(file) > MAX_FILE_BYTES || looksBinary(file)) {
                return;
            }
            String relative = RepoPaths.relativize(root, file);
            List<String> lines = splitKeepingEnds(readText(file));
            for (int i = 0; i < lines.size() && matches.size() < maxSearchResults; i++) {
                String line = lines.get(i).stripTrailing();
                if (line.contains(pattern)) {
                    String excerpt = line.length() > MATCH_LINE_CHARS ? line.substring(0, MATCH_LINE_CHARS) : line;
                    matches.add(relative + ":" + (i + 1) + ":" + excerpt);
                }
            }
        } catch (IOException e) {
            log.debug("Skipping unreadable file {}: {}", file, e.getMessage());
        }
    }

    private static boolean isExcluded(Path start, Path path) {
        Path relative = start.relativize(path);
        for (Path part : relative) {
            String name = part.toString();
            if (EXCLUDED_DIRS.contains(name) || (name.startsWith(".") && !name.equals("."))) {
                return true;
            }
        }
        return false;
    }

    static boolean looksBinary(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            byte[] sample = in.readNBytes(8192);
            for (byte b : sample) {
                if (b == 0) return true;
            }
            return false;
        }
    }

    static String readText(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
    }

    private static BufferedReader newLenientReader(Path file) throws IOException {
        var decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        return new BufferedReader(new InputStreamReader(Files.newInputStream(file), decoder));
    }

    private static List<String> splitKeepingEnds(String text) {
        var lines = new ArrayList<String>();
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lines.add(text.substring(start, i + 1));
                start = i + 1;
            }
        }
        if (start < text.length()) {
            lines.add(text.substring(start));
        }
        return lines;
    }

    private String toJson(Map<String, Object> value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ProjectIndexException("failed to encode result", e);
        }
    }

    public Path root() {
        return root;
    }

    @Override
    public String describe() {
        return "filesystem";
    }
}
