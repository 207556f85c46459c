package com.lad.dispatch.request;

import com.lad.core.model.ReviewKind;
import com.lad.core.model.ReviewRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReviewRequestFactoryTest {

    @TempDir
    Path workspace;

    private Path repo;
    private ReviewRequestFactory factory;

    @BeforeEach
    void setUp() throws Exception {
        repo = workspace.resolve("repo");
        Files.createDirectories(repo.resolve(".git"));
        Files.createDirectories(repo.resolve("src/main"));
        Files.writeString(repo.resolve("src/main/App.java"), "class App {}");
        factory = new ReviewRequestFactory(new FileContextLoader(), 1000, () -> repo);
    }

    private String message(Runnable call) {
        return assertThrows(ReviewValidationException.class, call::run).getMessage();
    }

    @Test
    @DisplayName("Inline design proposal becomes a design request rooted at the working directory")
    void designInline() {
        ReviewRequest request = factory.designReview("Use event sourcing for orders", null, null, "small team", null);

        assertEquals(ReviewKind.DESIGN, request.kind());
        assertEquals("Use event sourcing for orders", request.inlineText());
        assertEquals("small team", request.constraints());
        assertTrue(request.embeddedFiles().isEmpty());
        assertEquals(repo.toAbsolutePath().normalize(), request.projectRoot());
    }

    @Test
    @DisplayName("Design input rules are enforced")
    void designValidation() {
        assertEquals("proposal must be at least 10 characters",
                message(() -> factory.designReview("short", null, null, null, null)));
        assertEquals("proposal must not be blank",
                message(() -> factory.designReview("   ", null, null, null, null)));
        assertEquals("Either proposal or paths must be provided",
                message(() -> factory.designReview(null, null, null, null, null)));
        assertEquals("proposal must be <= 1000 characters",
                message(() -> factory.designReview("x".repeat(1001), null, null, null, null)));
        assertEquals("constraints must be <= 10000 characters",
                message(() -> factory.designReview("a valid proposal", null, null, "c".repeat(10_001), null)));
        assertEquals("Content is empty after sanitization",
                message(() -> factory.designReview("sk-or-v1-" + "k".repeat(30), null, null, null, null)));
    }

    @Test
    @DisplayName("Code review from paths infers the root from the nearest repository marker")
    void codeFromAbsolutePaths() {
        String file = repo.resolve("src/main/App.java").toString();

        ReviewRequest request = factory.codeReview(null, List.of(file), null, "java", null, null);

        assertEquals(ReviewKind.CODE, request.kind());
        assertEquals(repo.toAbsolutePath().normalize(), request.projectRoot());
        assertEquals(1, request.embeddedFiles().size());
        assertEquals("src/main/App.java", request.embeddedFiles().get(0).path());
        assertEquals("java", request.language());
    }

    @Test
    @DisplayName("Code input rules are enforced")
    void codeValidation() {
        assertEquals("Either code or paths must be provided",
                message(() -> factory.codeReview(null, null, null, null, null, null)));
        assertEquals("paths must be a non-empty list of strings when provided",
                message(() -> factory.codeReview(null, List.of(), null, null, null, null)));
        assertEquals("paths[] must not be blank",
                message(() -> factory.codeReview(null, List.of(" "), null, null, null, null)));
        assertEquals("language must be <= 40 characters",
                message(() -> factory.codeReview("x = 1", null, null, "l".repeat(41), null, null)));
        assertEquals("language must not be blank",
                message(() -> factory.codeReview("x = 1", null, null, " ", null, null)));
    }

    @Test
    @DisplayName("Focus must be one of the known review areas")
    void focusValidation() {
        assertEquals("performance", factory.codeReview("x = 1", null, null, null, "performance", null).focus());
        assertNull(factory.codeReview("x = 1", null, null, null, null, null).focus());
        assertEquals("focus must be one of: architecture, logic, maintainability, performance, security, tests",
                message(() -> factory.codeReview("x = 1", null, null, null, "style", null)));
        assertEquals("focus must not be blank",
                message(() -> factory.codeReview("x = 1", null, null, null, "  ", null)));
    }

    @Test
    @DisplayName("Explicit project root must be an existing directory")
    void explicitRoot() {
        assertEquals(repo.toAbsolutePath().normalize(),
                factory.resolveProjectRoot(repo.toString(), List.of()));
        assertTrue(message(() -> factory.resolveProjectRoot(repo.resolve("nope").toString(), List.of()))
                .startsWith("project_root is not a directory"));
    }

    @Test
    @DisplayName("Paths under a dangerous root are refused")
    void dangerousRoot() {
        var atFsRoot = new ReviewRequestFactory(new FileContextLoader(), 1000, () -> Path.of("/"));

        assertEquals("paths resolve to an unsafe project root; provide paths under a real repository directory",
                message(() -> atFsRoot.codeReview(null, List.of("etc/hostname"), null, null, null, null)));
    }

    @Test
    @DisplayName("Paths that yield no readable text are rejected when there is no inline text")
    void unreadablePaths() throws Exception {
        Files.write(repo.resolve("image.png"), new byte[]{1, 2});

        assertEquals("None of the given paths produced readable text files",
                message(() -> factory.codeReview(null, List.of("image.png"), repo.toString(), null, null, null)));
    }
}
