package com.lad.dispatch.request;

import com.lad.core.model.EmbeddedFile;
import com.lad.index.ProjectIndexException;
import com.lad.index.RepoPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads caller-named files and directories into {@link EmbeddedFile}s.
 * <p>
 * Paths are resolved under the project root. Directories are walked in sorted order,
 * skipping hidden entries and well-known tool directories. Binary files, files over
 * {@value #MAX_BYTES_PER_FILE} bytes, and files beyond the character budget are skipped;
 * when the very first file does not fit, it is embedded partially.
 */
@Component
public class FileContextLoader {

    private static final Logger log = LoggerFactory.getLogger(FileContextLoader.class);

    static final int MAX_BYTES_PER_FILE = 1_000_000;
    static final int MAX_FILES = 2000;
    static final String PARTIAL_NOTE = "\n[NOTE: File content truncated due to budget.]\n";

    private static final Set<String> EXCLUDED_DIRS = Set.of(".git", ".venv", "__pycache__", "node_modules", ".serena");

    private static final Set<String> BINARY_EXTENSIONS = Set.of(
            ".png", ".jpg", ".jpeg", ".gif", ".webp", ".ico", ".pdf", ".zip", ".tar", ".gz", ".7z", ".rar",
            ".exe", ".dll", ".so", ".dylib", ".class", ".jar", ".wasm", ".pyc", ".pyo", ".db", ".sqlite",
            ".parquet", ".feather", ".bin", ".mp3", ".mp4", ".mov", ".avi");

    private static final int BINARY_SAMPLE_BYTES = 65536;

    /**
     * @param root     project root every path must stay under
     * @param paths    absolute or root-relative files and directories
     * @param maxChars character budget across all embedded files, including per-file framing
     * @throws ReviewValidationException if a path is unsafe
     */
    public FileContext load(Path root, List<String> paths, int maxChars) {
        if (paths == null || paths.isEmpty() || maxChars <= 0) {
            return FileContext.empty();
        }

        List<Path> inputs = new ArrayList<>();
        for (String path : paths) {
            try {
                inputs.add(RepoPaths.resolveUnder(root, path));
            } catch (ProjectIndexException e) {
                throw new ReviewValidationException("Invalid path '" + path + "': " + e.getMessage());
            }
        }

        List<FileContext.SkippedFile> skipped = new ArrayList<>();
        List<Path> files = collectFiles(inputs, skipped);

        List<EmbeddedFile> embedded = new ArrayList<>();
        int remaining = maxChars;
        for (int i = 0; i < files.size(); i++) {
            Path file = files.get(i);
            String rel = RepoPaths.relativize(root, file);
            String ext = extension(file);
            if (BINARY_EXTENSIONS.contains(ext)) {
                skipped.add(new FileContext.SkippedFile(rel, "binary_extension"));
                continue;
            }

            String content;
            try {
                if (Files.size(file) > MAX_BYTES_PER_FILE) {
                    skipped.add(new FileContext.SkippedFile(rel, "too_large"));
                    continue;
                }
                byte[] data = Files.readAllBytes(file);
                if (looksBinary(data)) {
                    skipped.add(new FileContext.SkippedFile(rel, "binary"));
                    continue;
                }
                content = decode(data);
            } catch (IOException e) {
                log.debug("Could not read {}: {}", rel, e.getMessage());
                skipped.add(new FileContext.SkippedFile(rel, "read_failed"));
                continue;
            }

            int framing = framingChars(rel);
            if (content.length() + framing <= remaining) {
                embedded.add(new EmbeddedFile(rel, content));
                remaining -= content.length() + framing;
                continue;
            }

            int othersLeft = files.size() - i - 1;
            String note = othersLeft + " additional files also skipped due to budget";
            if (embedded.isEmpty() && remaining > framing + PARTIAL_NOTE.length() + 50) {
                int usable = remaining - framing - PARTIAL_NOTE.length();
                embedded.add(new EmbeddedFile(rel, content.substring(0, usable) + PARTIAL_NOTE));
                if (othersLeft > 0) {
                    skipped.add(new FileContext.SkippedFile(RepoPaths.relativize(root, files.get(i + 1)),
                            "budget_exhausted", (othersLeft - 1) + " additional files also skipped due to budget"));
                }
            } else {
                skipped.add(new FileContext.SkippedFile(rel, "budget_exhausted", note));
            }
            break;
        }

        log.info("Embedded {} file(s), skipped {}", embedded.size(), skipped.size());
        return new FileContext(embedded, skipped);
    }

    private List<Path> collectFiles(List<Path> inputs, List<FileContext.SkippedFile> skipped) {
        List<Path> files = new ArrayList<>();
        for (Path input : inputs) {
            List<Path> candidates;
            if (Files.isDirectory(input)) {
                candidates = walk(input);
            } else if (Files.isRegularFile(input)) {
                candidates = List.of(input);
            } else {
                continue;
            }
            for (Path candidate : candidates) {
                if (files.size() >= MAX_FILES) {
                    skipped.add(new FileContext.SkippedFile("(directory scan)", "too_many_files",
                            "stopped after " + MAX_FILES + " files; additional files were not considered"));
                    return files;
                }
                files.add(candidate);
            }
        }
        return files;
    }

    private static List<Path> walk(Path dir) {
        try (Stream<Path> stream = Files.walk(dir)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(p -> !isExcluded(dir, p))
                    .sorted(Comparator.comparing(Path::toString))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ReviewValidationException("Failed to list " + dir.getFileName() + ": " + e.getMessage());
        }
    }

    private static boolean isExcluded(Path start, Path path) {
        for (Path part : start.relativize(path)) {
            String name = part.toString();
            if (name.startsWith(".") || EXCLUDED_DIRS.contains(name)) {
                return true;
            }
        }
        return false;
    }

    private static String extension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }

    static boolean looksBinary(byte[] data) {
        int limit = Math.min(data.length, BINARY_SAMPLE_BYTES);
        for (int i = 0; i < limit; i++) {
            if (data[i] == 0) {
                return true;
            }
        }
        return false;
    }

    private static String decode(byte[] data) throws IOException {
        var decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        return decoder.decode(ByteBuffer.wrap(data)).toString();
    }

    /**
     * Characters of framing the prompt adds around one embedded file.
     */
    static int framingChars(String rel) {
        return ("--- BEGIN FILE: " + rel + " ---\n").length()
                + ("\n--- END FILE: " + rel + " ---\n").length()
                + ("- `" + rel + "`\n").length();
    }
}
