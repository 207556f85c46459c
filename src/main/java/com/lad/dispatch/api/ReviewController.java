package com.lad.dispatch.api;

import com.lad.core.model.AggregateResult;
import com.lad.core.model.ReviewRequest;
import com.lad.core.review.DualReviewCoordinator;
import com.lad.core.review.ReviewReportFormatter;
import com.lad.dispatch.request.ReviewRequestFactory;
import com.lad.dispatch.request.ReviewValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for dual reviews. Each call blocks until both reviewers and the
 * synthesis have finished or timed out.
 */
@RestController
@RequestMapping("/api/v1/reviews")
public class ReviewController {

    private static final Logger log = LoggerFactory.getLogger(ReviewController.class);

    private final ReviewRequestFactory requestFactory;
    private final DualReviewCoordinator coordinator;
    private final ReviewReportFormatter formatter;

    public ReviewController(ReviewRequestFactory requestFactory,
                            DualReviewCoordinator coordinator,
                            ReviewReportFormatter formatter) {
        this.requestFactory = requestFactory;
        this.coordinator = coordinator;
        this.formatter = formatter;
    }

    /**
     * POST /api/v1/reviews/design: review a system design proposal.
     */
    @PostMapping("/design")
    public ResponseEntity<ReviewResponse> designReview(@RequestBody DesignReviewBody body) {
        ReviewRequest request = requestFactory.designReview(body.proposal(), body.paths(), body.projectRoot(),
                body.constraints(), body.context());
        return ResponseEntity.ok(run(request));
    }

    /**
     * POST /api/v1/reviews/code reviews a code snippet and/or files.
     */
    @PostMapping("/code")
    public ResponseEntity<ReviewResponse> codeReview(@RequestBody CodeReviewBody body) {
        ReviewRequest request = requestFactory.codeReview(body.code(), body.paths(), body.projectRoot(),
                body.language(), body.focus(), body.context());
        return ResponseEntity.ok(run(request));
    }

    private ReviewResponse run(ReviewRequest request) {
        AggregateResult result = coordinator.review(request);
        return new ReviewResponse(result, formatter.render(result));
    }

    @ExceptionHandler(ReviewValidationException.class)
    public ResponseEntity<Map<String, String>> invalidInput(ReviewValidationException e) {
        log.info("Rejected review request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
