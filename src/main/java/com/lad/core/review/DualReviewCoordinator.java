package com.lad.core.review;

import com.lad.core.concurrency.ReviewExecutors;
import com.lad.core.config.LadProperties;
import com.lad.core.logging.MdcContext;
import com.lad.core.model.AggregateResult;
import com.lad.core.model.ErrorKind;
import com.lad.core.model.ReviewRequest;
import com.lad.core.model.ReviewerOutcome;
import com.lad.core.model.ReviewerRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Runs the Primary and Secondary reviewers concurrently and aggregates their outcomes.
 * <p>
 * Each branch is joined independently: a slow or failing reviewer never blocks or
 * cancels the other. Both branches share the global admission gate through
 * {@link ReviewerInvocation}.
 */
@Service
public class DualReviewCoordinator {

    private static final Logger log = LoggerFactory.getLogger(DualReviewCoordinator.class);

    private final ReviewerInvocation invocation;
    private final Synthesizer synthesizer;
    private final LadProperties properties;
    private final ExecutorService reviewerExecutor;

    public DualReviewCoordinator(ReviewerInvocation invocation,
                                 Synthesizer synthesizer,
                                 LadProperties properties,
                                 @Qualifier(ReviewExecutors.REVIEWER) ExecutorService reviewerExecutor) {
        this.invocation = invocation;
        this.synthesizer = synthesizer;
        this.properties = properties;
        this.reviewerExecutor = reviewerExecutor;
    }

    public AggregateResult review(ReviewRequest request) {
        String requestId = "REV-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase(Locale.ROOT);
        MdcContext.setRequest(requestId, request.kind().name().toLowerCase(Locale.ROOT));
        try {
            String primaryModel = properties.getReviewers().getPrimaryModel();
            String secondaryModel = properties.getReviewers().getSecondaryModel();
            boolean secondaryEnabled = !LadProperties.isDisabledModel(secondaryModel);

            log.info("Starting {} [{}] with Primary={}, Secondary={}", request.kind().label(), requestId,
                    primaryModel, secondaryEnabled ? secondaryModel : "disabled");
            long start = System.currentTimeMillis();

            CompletableFuture<ReviewerOutcome> primaryBranch = start(ReviewerRole.PRIMARY, primaryModel, request);
            CompletableFuture<ReviewerOutcome> secondaryBranch = secondaryEnabled
                    ? start(ReviewerRole.SECONDARY, secondaryModel, request)
                    : null;

            ReviewerOutcome primary = join(primaryBranch, ReviewerRole.PRIMARY, primaryModel);
            ReviewerOutcome secondary = secondaryBranch != null
                    ? join(secondaryBranch, ReviewerRole.SECONDARY, secondaryModel)
                    : null;

            SynthesisResult synthesis = synthesizer.summarize(request.kind(), primary, secondary);
            log.info("Review {} complete → primary={}, secondary={}, summary={} ({}s)", requestId,
                    primary.status(), secondary != null ? secondary.status() : "disabled",
                    synthesis.succeeded() ? "ok" : synthesis.error(),
                    String.format("%.1f", (System.currentTimeMillis() - start) / 1000.0));

            return new AggregateResult(requestId, request.kind(), primary, secondary,
                    synthesis.summary(), synthesis.error(), synthesis.errorDetail());
        } finally {
            MdcContext.clear();
        }
    }

    private CompletableFuture<ReviewerOutcome> start(ReviewerRole role, String modelId, ReviewRequest request) {
        Map<String, String> mdc = MdcContext.snapshot();
        return CompletableFuture.supplyAsync(() -> {
            MdcContext.restore(mdc);
            try {
                return invocation.review(role, modelId, request);
            } finally {
                MdcContext.clear();
            }
        }, reviewerExecutor);
    }

    private ReviewerOutcome join(CompletableFuture<ReviewerOutcome> branch, ReviewerRole role, String modelId) {
        try {
            return branch.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("{} reviewer branch failed", role.displayName(), cause);
            return ReviewerOutcome.failed(role, modelId, ErrorKind.TRANSPORT_ERROR,
                    cause.getMessage() != null ? cause.getMessage() : cause.toString(), List.of(), null);
        }
    }
}
