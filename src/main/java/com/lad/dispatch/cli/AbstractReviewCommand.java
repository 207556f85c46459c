package com.lad.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lad.core.model.AggregateResult;
import com.lad.core.model.ReviewRequest;
import com.lad.core.review.DualReviewCoordinator;
import com.lad.core.review.ReviewReportFormatter;
import com.lad.dispatch.request.ReviewRequestFactory;
import com.lad.dispatch.request.ReviewValidationException;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Shared options and flow for the two review commands.
 * <p>
 * Exit codes: 0 when a summary was produced, 1 when no reviewer produced text,
 * 2 when the input was rejected.
 */
public abstract class AbstractReviewCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_NO_REVIEW = 1;
    static final int EXIT_INVALID_INPUT = 2;

    @Option(names = {"--path", "-p"},
            description = "File or directory to embed (absolute or relative to the project root). Repeatable.")
    List<String> paths;

    @Option(names = "--project-root", description = "Project root for path resolution and the project index")
    String projectRoot;

    @Option(names = "--context", description = "Additional context for the reviewers")
    String context;

    @Option(names = "--json", description = "Print the aggregate result as JSON instead of Markdown")
    boolean json;

    protected final ReviewRequestFactory requestFactory;
    private final DualReviewCoordinator coordinator;
    private final ReviewReportFormatter formatter;
    private final ObjectMapper objectMapper;

    protected AbstractReviewCommand(ReviewRequestFactory requestFactory,
                                    DualReviewCoordinator coordinator,
                                    ReviewReportFormatter formatter,
                                    ObjectMapper objectMapper) {
        this.requestFactory = requestFactory;
        this.coordinator = coordinator;
        this.formatter = formatter;
        this.objectMapper = objectMapper;
    }

    protected abstract ReviewRequest buildRequest() throws IOException;

    @Override
    public Integer call() {
        ReviewRequest request;
        try {
            request = buildRequest();
        } catch (ReviewValidationException e) {
            ConsoleOutput.error("Invalid input: " + e.getMessage());
            return EXIT_INVALID_INPUT;
        } catch (IOException e) {
            ConsoleOutput.error("Could not read input: " + e.getMessage());
            return EXIT_INVALID_INPUT;
        }

        if (!json) {
            ConsoleOutput.printBanner();
            ConsoleOutput.info("Running " + request.kind().label() + " ("
                    + request.embeddedFiles().size() + " embedded file(s), project root "
                    + request.projectRoot() + ")");
        }

        AggregateResult result = coordinator.review(request);

        if (json) {
            try {
                System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
            } catch (JsonProcessingException e) {
                ConsoleOutput.error("Could not serialize result: " + e.getOriginalMessage());
                return EXIT_NO_REVIEW;
            }
        } else {
            ConsoleOutput.reviewer(result.primary());
            if (result.secondary() != null) {
                ConsoleOutput.reviewer(result.secondary());
            }
            System.out.println("──────────────────────────────────");
            System.out.println(formatter.render(result));
        }
        return result.summary() != null ? EXIT_OK : EXIT_NO_REVIEW;
    }

    /**
     * Inline value when given, else the file's content, else {@code null}.
     */
    static String inlineOrFile(String inline, Path file) throws IOException {
        if (inline != null) {
            return inline;
        }
        return file != null ? Files.readString(file) : null;
    }
}
