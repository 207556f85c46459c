package com.lad.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lad.LadApplication;
import com.lad.core.health.HealthCheckService;
import com.lad.core.health.HealthStatus;
import com.lad.core.model.AggregateResult;
import com.lad.core.model.ErrorKind;
import com.lad.core.model.ReviewKind;
import com.lad.core.model.ReviewRequest;
import com.lad.core.model.ReviewerOutcome;
import com.lad.core.model.ReviewerRole;
import com.lad.core.review.DualReviewCoordinator;
import com.lad.core.review.ReviewReportFormatter;
import com.lad.dispatch.request.ReviewRequestFactory;
import com.lad.dispatch.request.ReviewValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Exercises the lad command tree through picocli directly, without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private ReviewRequestFactory requestFactory;
    private DualReviewCoordinator coordinator;
    private HealthCheckService healthCheckService;

    private final ReviewRequest request = ReviewRequest.design("A proposal long enough", List.of(), null, null,
            Path.of("/tmp/project"));

    @BeforeEach
    void setUp() {
        requestFactory = mock(ReviewRequestFactory.class);
        coordinator = mock(DualReviewCoordinator.class);
        healthCheckService = mock(HealthCheckService.class);
    }

    private CommandLine.IFactory createFactory() {
        ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
        ReviewReportFormatter formatter = new ReviewReportFormatter();
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == DesignReviewCommand.class) {
                    return (K) new DesignReviewCommand(requestFactory, coordinator, formatter, mapper);
                }
                if (cls == CodeReviewCommand.class) {
                    return (K) new CodeReviewCommand(requestFactory, coordinator, formatter, mapper);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthCheckService);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new LadCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static AggregateResult merged() {
        return new AggregateResult("REV-TEST0001", ReviewKind.DESIGN,
                ReviewerOutcome.succeeded(ReviewerRole.PRIMARY, "m/a", "## Summary\nPrimary view", List.of(), null),
                ReviewerOutcome.succeeded(ReviewerRole.SECONDARY, "m/b", "## Summary\nSecondary view", List.of(), null),
                "Both agree.", null, null);
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("design-review"));
            assertTrue(result.output().contains("code-review"));
            assertTrue(result.output().contains("health"));
            assertTrue(result.output().contains("serve"));
        }

        @Test
        @DisplayName("--version shows version")
        void version() {
            CliResult result = execute("--version");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Lad Reviewer 0.1.0"));
        }

        @Test
        @DisplayName("code-review --help shows its options")
        void codeReviewHelp() {
            CliResult result = execute("code-review", "--help");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--language"));
            assertTrue(result.output().contains("--path"));
            assertTrue(result.output().contains("--focus"));
        }
    }

    @Nested
    @DisplayName("Review commands")
    class ReviewTests {

        @Test
        @DisplayName("design-review prints both reviewers and the summary")
        void designReviewMarkdown() {
            when(requestFactory.designReview(eq("A proposal long enough"), isNull(), isNull(), eq("no downtime"), isNull()))
                    .thenReturn(request);
            when(coordinator.review(request)).thenReturn(merged());

            CliResult result = execute("design-review", "--proposal", "A proposal long enough",
                    "--constraints", "no downtime");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("## Primary Reviewer"));
            assertTrue(result.output().contains("Secondary view"));
            assertTrue(result.output().contains("## Synthesized Summary\n\nBoth agree."));
        }

        @Test
        @DisplayName("--json prints the aggregate result")
        void jsonOutput() {
            when(requestFactory.designReview(any(), any(), any(), any(), any())).thenReturn(request);
            when(coordinator.review(request)).thenReturn(merged());

            CliResult result = execute("design-review", "--proposal", "A proposal long enough", "--json");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("\"requestId\" : \"REV-TEST0001\""));
            assertFalse(result.output().contains("## Primary Reviewer"));
        }

        @Test
        @DisplayName("code-review reads the snippet from a file and passes paths through")
        void codeReviewFromFile(@TempDir Path dir) throws Exception {
            Path snippet = Files.writeString(dir.resolve("snippet.py"), "print('hi')");
            when(requestFactory.codeReview(eq("print('hi')"), eq(List.of("src", "tests")), isNull(), eq("python"), eq("security"), isNull()))
                    .thenReturn(request);
            when(coordinator.review(request)).thenReturn(merged());

            CliResult result = execute("code-review", "--code-file", snippet.toString(),
                    "-p", "src", "-p", "tests", "-l", "python", "--focus", "security");

            assertEquals(0, result.exitCode());
            verify(coordinator).review(request);
        }

        @Test
        @DisplayName("Rejected input exits with 2 and never starts a review")
        void invalidInput() {
            when(requestFactory.codeReview(any(), any(), any(), any(), any(), any()))
                    .thenThrow(new ReviewValidationException("Either code or paths must be provided"));

            CliResult result = execute("code-review");

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Invalid input: Either code or paths must be provided"));
            verifyNoInteractions(coordinator);
        }

        @Test
        @DisplayName("No summary exits with 1")
        void noSummary() {
            when(requestFactory.designReview(any(), any(), any(), any(), any())).thenReturn(request);
            when(coordinator.review(request)).thenReturn(new AggregateResult("REV-TEST0002", ReviewKind.DESIGN,
                    ReviewerOutcome.failed(ReviewerRole.PRIMARY, "m/a", ErrorKind.TRANSPORT_ERROR, "HTTP 500", List.of(), null),
                    null, null, ErrorKind.NO_INPUT_FOR_SYNTHESIS, "No reviewer produced a review."));

            CliResult result = execute("design-review", "--proposal", "A proposal long enough");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("HTTP 500"));
        }
    }

    @Nested
    @DisplayName("Health command")
    class HealthTests {

        @Test
        @DisplayName("Healthy components exit with 0")
        void healthy() {
            when(healthCheckService.checkAll(any())).thenReturn(List.of(
                    new HealthStatus("credentials", HealthStatus.Status.UP, "OpenRouter API key configured", Map.of()),
                    new HealthStatus("project-index", HealthStatus.Status.DEGRADED, "Reviews will run without tools", Map.of())));

            CliResult result = execute("health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("credentials: OpenRouter API key configured"));
            assertTrue(result.output().contains("Overall: ready to review"));
        }

        @Test
        @DisplayName("A DOWN component exits with 1")
        void down() {
            when(healthCheckService.checkAll(any())).thenReturn(List.of(
                    new HealthStatus("credentials", HealthStatus.Status.DOWN, "OPENROUTER_API_KEY is not set", Map.of())));

            CliResult result = execute("health", "--project-root", "/tmp");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("OPENROUTER_API_KEY is not set"));
            verify(healthCheckService).checkAll(Path.of("/tmp"));
        }
    }

    @Nested
    @DisplayName("Serve mode")
    class ServeTests {

        @Test
        @DisplayName("serve after other arguments is rejected with 2")
        void serveNotFirst() {
            CliResult result = execute("serve");

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("'serve' must be the first argument"));
        }

        @Test
        @DisplayName("Runner leaves serve mode to the web server")
        void runnerSkipsServeMode() {
            var runner = new CliRunner(new LadCommand(), createFactory());

            runner.run("serve");

            assertEquals(0, runner.getExitCode());
            verifyNoInteractions(healthCheckService, coordinator, requestFactory);
        }

        @Test
        @DisplayName("Runner reports the command's exit code")
        void runnerReportsExitCode() {
            when(healthCheckService.checkAll(any())).thenReturn(List.of(
                    new HealthStatus("credentials", HealthStatus.Status.DOWN, "OPENROUTER_API_KEY is not set", Map.of())));
            var runner = new CliRunner(new LadCommand(), createFactory());

            runner.run("health");

            assertEquals(1, runner.getExitCode());
        }

        @Test
        @DisplayName("Only a leading serve selects serve mode")
        void serveModeDetection() {
            assertTrue(LadApplication.isServeMode("serve"));
            assertTrue(LadApplication.isServeMode("serve", "--help"));
            assertFalse(LadApplication.isServeMode("code-review", "--code", "serve"));
            assertFalse(LadApplication.isServeMode());
        }
    }
}
