package com.lad.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lad.core.model.ReviewRequest;
import com.lad.core.review.DualReviewCoordinator;
import com.lad.core.review.ReviewReportFormatter;
import com.lad.dispatch.request.ReviewRequestFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;

/**
 * CLI command: lad code-review --code-file Foo.java --language java
 */
@Command(name = "code-review", mixinStandardHelpOptions = true,
        description = "Review code with both reviewers")
@Component
public class CodeReviewCommand extends AbstractReviewCommand {

    @Option(names = "--code", description = "Code snippet")
    String code;

    @Option(names = "--code-file", description = "Read the code snippet from a file")
    Path codeFile;

    @Option(names = {"--language", "-l"}, description = "Language of the snippet, used for the code fence")
    String language;

    @Option(names = "--focus",
            description = "Focus area: security, performance, logic, architecture, maintainability or tests")
    String focus;

    public CodeReviewCommand(ReviewRequestFactory requestFactory,
                             DualReviewCoordinator coordinator,
                             ReviewReportFormatter formatter,
                             ObjectMapper objectMapper) {
        super(requestFactory, coordinator, formatter, objectMapper);
    }

    @Override
    protected ReviewRequest buildRequest() throws IOException {
        return requestFactory.codeReview(inlineOrFile(code, codeFile), paths, projectRoot, language, focus, context);
    }
}
