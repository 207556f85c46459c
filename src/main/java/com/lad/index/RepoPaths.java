package com.lad.index;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Path helpers that keep every file access inside a project root.
 */
public final class RepoPaths {

    private static final Pattern WINDOWS_ABSOLUTE = Pattern.compile("^[A-Za-z]:[\\\\/].*");

    private static final List<Path> BLOCKED_PREFIXES = List.of(
            Path.of("/etc"), Path.of("/proc"), Path.of("/sys"), Path.of("/dev"), Path.of("/run"),
            Path.of("/var"), Path.of("/bin"), Path.of("/sbin"), Path.of("/lib"), Path.of("/lib64"),
            Path.of("/boot"));

    private RepoPaths() {}

    /**
     * Resolves {@code pathStr} (absolute or root-relative) and verifies it stays under {@code root},
     * following symlinks for paths that exist.
     *
     * @throws ProjectIndexException if the path is blank, uses {@code ..}, or escapes the root
     */
    public static Path resolveUnder(Path root, String pathStr) {
        if (pathStr == null || pathStr.isBlank()) {
            throw new ProjectIndexException("path must be a non-empty string");
        }
        if (WINDOWS_ABSOLUTE.matcher(pathStr).matches() || pathStr.startsWith("\\\\")) {
            throw new ProjectIndexException("windows absolute paths are not supported");
        }
        Path candidate;
        try {
            candidate = Path.of(pathStr);
        } catch (InvalidPathException e) {
            throw new ProjectIndexException("invalid path: " + e.getReason());
        }
        for (Path part : candidate) {
            if ("..".equals(part.toString())) {
                throw new ProjectIndexException("path traversal is not allowed");
            }
        }

        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path resolved = (candidate.isAbsolute() ? candidate : normalizedRoot.resolve(candidate))
                .toAbsolutePath().normalize();
        if (!resolved.startsWith(normalizedRoot)) {
            throw new ProjectIndexException("path is outside repo root");
        }

        if (Files.exists(resolved)) {
            try {
                Path realRoot = normalizedRoot.toRealPath();
                if (!resolved.toRealPath().startsWith(realRoot)) {
                    throw new ProjectIndexException("path is outside repo root");
                }
            } catch (IOException e) {
                throw new ProjectIndexException("failed to resolve path", e);
            }
        }
        return resolved;
    }

    /**
     * Root-relative form with forward slashes; {@code "."} for the root itself.
     */
    public static String relativize(Path root, Path path) {
        Path relative = root.toAbsolutePath().normalize().relativize(path.toAbsolutePath().normalize());
        String text = relative.toString().replace('\\', '/');
        return text.isEmpty() ? "." : text;
    }

    /**
     * True for roots too broad to review from: the filesystem root, the user's home
     * directory, and well-known system directories.
     */
    public static boolean isDangerousRoot(Path root) {
        Path normalized = root.toAbsolutePath().normalize();
        if (normalized.getParent() == null) {
            return true;
        }
        String home = System.getProperty("user.home");
        if (home != null && !home.isBlank() && normalized.equals(Path.of(home).toAbsolutePath().normalize())) {
            return true;
        }
        for (Path prefix : BLOCKED_PREFIXES) {
            if (normalized.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
