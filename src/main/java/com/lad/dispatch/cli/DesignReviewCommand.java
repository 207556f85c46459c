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
 * CLI command: lad design-review --proposal "..." [--path docs/]
 */
@Command(name = "design-review", mixinStandardHelpOptions = true,
        description = "Review a system design proposal with both reviewers")
@Component
public class DesignReviewCommand extends AbstractReviewCommand {

    @Option(names = "--proposal", description = "Proposal text")
    String proposal;

    @Option(names = "--proposal-file", description = "Read the proposal from a file")
    Path proposalFile;

    @Option(names = "--constraints", description = "Constraints the design must satisfy")
    String constraints;

    public DesignReviewCommand(ReviewRequestFactory requestFactory,
                               DualReviewCoordinator coordinator,
                               ReviewReportFormatter formatter,
                               ObjectMapper objectMapper) {
        super(requestFactory, coordinator, formatter, objectMapper);
    }

    @Override
    protected ReviewRequest buildRequest() throws IOException {
        return requestFactory.designReview(inlineOrFile(proposal, proposalFile), paths, projectRoot,
                constraints, context);
    }
}
