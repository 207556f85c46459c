package com.lad.dispatch.request;

import com.lad.core.config.LadProperties;
import com.lad.core.model.ReviewRequest;
import com.lad.core.security.SecretRedactor;
import com.lad.index.RepoPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * Validates raw transport input and turns it into a {@link ReviewRequest}.
 * <p>
 * Shared by the CLI and the REST API so both reject the same inputs with the same messages.
 */
@Component
public class ReviewRequestFactory {

    private static final Logger log = LoggerFactory.getLogger(ReviewRequestFactory.class);

    static final int MIN_PROPOSAL_CHARS = 10;
    static final int MAX_NOTE_CHARS = 10_000;
    static final int MAX_LANGUAGE_CHARS = 40;
    private static final int ROOT_SEARCH_DEPTH = 25;

    private final FileContextLoader fileContextLoader;
    private final int maxInputChars;
    private final Supplier<Path> workingDirectory;

    @Autowired
    public ReviewRequestFactory(FileContextLoader fileContextLoader, LadProperties properties) {
        this(fileContextLoader, properties.getBudget().getMaxInputChars(),
                () -> Path.of("").toAbsolutePath());
    }

    ReviewRequestFactory(FileContextLoader fileContextLoader, int maxInputChars, Supplier<Path> workingDirectory) {
        this.fileContextLoader = fileContextLoader;
        this.maxInputChars = maxInputChars;
        this.workingDirectory = workingDirectory;
    }

    public ReviewRequest designReview(String proposal, List<String> paths, String projectRoot,
                                      String constraints, String context) {
        if (proposal != null) {
            requireNonBlank(proposal, "proposal");
            if (proposal.length() < MIN_PROPOSAL_CHARS) {
                throw new ReviewValidationException("proposal must be at least " + MIN_PROPOSAL_CHARS + " characters");
            }
            requireMaxInput(proposal, "proposal");
            requireSurvivesRedaction(proposal);
        }
        List<String> cleaned = cleanPaths(paths);
        if (proposal == null && cleaned.isEmpty()) {
            throw new ReviewValidationException("Either proposal or paths must be provided");
        }
        requireMaxLength(constraints, "constraints", MAX_NOTE_CHARS);
        requireMaxLength(context, "context", MAX_NOTE_CHARS);

        Path root = resolveProjectRoot(projectRoot, cleaned);
        FileContext files = loadFiles(root, cleaned, proposal);
        return ReviewRequest.design(proposal, files.embedded(), constraints, context, root);
    }

    public ReviewRequest codeReview(String code, List<String> paths, String projectRoot,
                                    String language, String focus, String context) {
        if (code != null) {
            requireNonBlank(code, "code");
            requireMaxInput(code, "code");
            requireSurvivesRedaction(code);
        }
        List<String> cleaned = cleanPaths(paths);
        if (code == null && cleaned.isEmpty()) {
            throw new ReviewValidationException("Either code or paths must be provided");
        }
        if (language != null) {
            requireNonBlank(language, "language");
            requireMaxLength(language, "language", MAX_LANGUAGE_CHARS);
        }
        if (focus != null) {
            requireNonBlank(focus, "focus");
            if (!ReviewRequest.FOCUS_AREAS.contains(focus)) {
                throw new ReviewValidationException(
                        "focus must be one of: " + String.join(", ", new TreeSet<>(ReviewRequest.FOCUS_AREAS)));
            }
        }
        requireMaxLength(context, "context", MAX_NOTE_CHARS);

        Path root = resolveProjectRoot(projectRoot, cleaned);
        FileContext files = loadFiles(root, cleaned, code);
        return ReviewRequest.code(code, files.embedded(), language, focus, context, root);
    }

    private FileContext loadFiles(Path root, List<String> paths, String inlineText) {
        if (paths.isEmpty()) {
            return FileContext.empty();
        }
        int budget = maxInputChars > 0
                ? maxInputChars - (inlineText == null ? 0 : inlineText.length())
                : Integer.MAX_VALUE;
        FileContext files = fileContextLoader.load(root, paths, budget);
        for (FileContext.SkippedFile skipped : files.skipped()) {
            log.info("Skipped {} ({}{})", skipped.path(), skipped.reason(),
                    skipped.note() != null ? ": " + skipped.note() : "");
        }
        if (inlineText == null && files.embedded().isEmpty()) {
            throw new ReviewValidationException("None of the given paths produced readable text files");
        }
        return files;
    }

    /**
     * Explicit root when given; otherwise inferred from absolute paths by walking up from
     * their common parent to a {@code .serena} or {@code .git} marker; otherwise the
     * working directory. A root too broad to review from is rejected when paths are given.
     */
    Path resolveProjectRoot(String explicitRoot, List<String> paths) {
        Path root;
        if (explicitRoot != null && !explicitRoot.isBlank()) {
            root = toPath(explicitRoot).toAbsolutePath().normalize();
            if (!Files.isDirectory(root)) {
                throw new ReviewValidationException("project_root is not a directory: " + explicitRoot);
            }
        } else {
            root = inferFromPaths(paths);
            if (root == null) {
                root = workingDirectory.get().toAbsolutePath().normalize();
            }
        }
        if (!paths.isEmpty() && RepoPaths.isDangerousRoot(root)) {
            throw new ReviewValidationException(
                    "paths resolve to an unsafe project root; provide paths under a real repository directory");
        }
        return root;
    }

    private static Path inferFromPaths(List<String> paths) {
        if (paths.isEmpty()) {
            return null;
        }
        Path common = null;
        for (String raw : paths) {
            Path path = toPath(raw);
            if (!path.isAbsolute()) {
                return null;
            }
            Path dir = path.normalize();
            if (Files.isRegularFile(dir)) {
                dir = dir.getParent();
            }
            common = common == null ? dir : commonParent(common, dir);
            if (common == null) {
                return null;
            }
        }
        return Files.isDirectory(common) ? walkUpToMarker(common) : null;
    }

    private static Path commonParent(Path a, Path b) {
        Path candidate = a;
        while (candidate != null && !b.startsWith(candidate)) {
            candidate = candidate.getParent();
        }
        return candidate;
    }

    private static Path walkUpToMarker(Path start) {
        Path current = start;
        for (int i = 0; i < ROOT_SEARCH_DEPTH && current != null; i++) {
            if (Files.isDirectory(current.resolve(".serena")) || Files.isDirectory(current.resolve(".git"))) {
                return current;
            }
            current = current.getParent();
        }
        return start;
    }

    private static Path toPath(String raw) {
        try {
            return Path.of(raw);
        } catch (InvalidPathException e) {
            throw new ReviewValidationException("Invalid path '" + raw + "': " + e.getReason());
        }
    }

    private static List<String> cleanPaths(List<String> paths) {
        if (paths == null) {
            return List.of();
        }
        if (paths.isEmpty()) {
            throw new ReviewValidationException("paths must be a non-empty list of strings when provided");
        }
        List<String> cleaned = new ArrayList<>(paths.size());
        for (String path : paths) {
            requireNonBlank(path, "paths[]");
            cleaned.add(path.strip());
        }
        return cleaned;
    }

    private static void requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ReviewValidationException(field + " must not be blank");
        }
    }

    private void requireMaxInput(String value, String field) {
        if (maxInputChars > 0 && value.length() > maxInputChars) {
            throw new ReviewValidationException(field + " must be <= " + maxInputChars + " characters");
        }
    }

    private static void requireMaxLength(String value, String field, int max) {
        if (value != null && value.length() > max) {
            throw new ReviewValidationException(field + " must be <= " + max + " characters");
        }
    }

    private static void requireSurvivesRedaction(String value) {
        if (SecretRedactor.redact(value).replace(SecretRedactor.REPLACEMENT, "").isBlank()) {
            throw new ReviewValidationException("Content is empty after sanitization");
        }
    }
}
