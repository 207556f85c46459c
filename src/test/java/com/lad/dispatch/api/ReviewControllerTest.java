package com.lad.dispatch.api;

import com.lad.core.model.AggregateResult;
import com.lad.core.model.ReviewKind;
import com.lad.core.model.ReviewRequest;
import com.lad.core.model.ReviewerOutcome;
import com.lad.core.model.ReviewerRole;
import com.lad.core.review.DualReviewCoordinator;
import com.lad.core.review.ReviewReportFormatter;
import com.lad.dispatch.request.ReviewRequestFactory;
import com.lad.dispatch.request.ReviewValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Path;
import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ReviewController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ReviewControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ReviewRequestFactory requestFactory;

    @MockitoBean
    private DualReviewCoordinator coordinator;

    @MockitoBean
    private ReviewReportFormatter formatter;

    private final ReviewRequest designRequest = ReviewRequest.design("Use a single writer per shard", List.of(),
            null, null, Path.of("/tmp/project"));

    private static AggregateResult result(ReviewKind kind) {
        return new AggregateResult("REV-ABCD1234", kind,
                ReviewerOutcome.succeeded(ReviewerRole.PRIMARY, "m/a", "## Summary\nok", List.of(), null),
                ReviewerOutcome.disabled(ReviewerRole.SECONDARY, "0"),
                "ok", null, null);
    }

    // ── POST /api/v1/reviews/design ─────────────────────────────────

    @Test
    @DisplayName("POST /reviews/design returns the aggregate result and Markdown")
    void designReview() throws Exception {
        when(requestFactory.designReview(eq("Use a single writer per shard"), eq(List.of("docs")),
                eq("/tmp/project"), isNull(), isNull())).thenReturn(designRequest);
        AggregateResult aggregate = result(ReviewKind.DESIGN);
        when(coordinator.review(designRequest)).thenReturn(aggregate);
        when(formatter.render(aggregate)).thenReturn("## Primary Reviewer\n\nok");

        mockMvc.perform(post("/api/v1/reviews/design")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"proposal":"Use a single writer per shard","paths":["docs"],"project_root":"/tmp/project"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result.requestId").value("REV-ABCD1234"))
                .andExpect(jsonPath("$.result.kind").value("DESIGN"))
                .andExpect(jsonPath("$.result.primary.status").value("SUCCEEDED"))
                .andExpect(jsonPath("$.result.secondary.status").value("DISABLED"))
                .andExpect(jsonPath("$.result.summary").value("ok"))
                .andExpect(jsonPath("$.markdown", startsWith("## Primary Reviewer")));
    }

    @Test
    @DisplayName("Validation failure is a 400 with an error message")
    void designValidationError() throws Exception {
        when(requestFactory.designReview(any(), any(), any(), any(), any()))
                .thenThrow(new ReviewValidationException("Either proposal or paths must be provided"));

        mockMvc.perform(post("/api/v1/reviews/design")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Either proposal or paths must be provided"));

        verify(coordinator, never()).review(any());
    }

    // ── POST /api/v1/reviews/code ───────────────────────────────────

    @Test
    @DisplayName("POST /reviews/code passes language, focus and context through")
    void codeReview() throws Exception {
        ReviewRequest codeRequest = ReviewRequest.code("fn main() {}", List.of(), "rust", "hot path", Path.of("/tmp"));
        when(requestFactory.codeReview(eq("fn main() {}"), isNull(), isNull(), eq("rust"), eq("performance"), eq("hot path")))
                .thenReturn(codeRequest);
        AggregateResult aggregate = result(ReviewKind.CODE);
        when(coordinator.review(codeRequest)).thenReturn(aggregate);
        when(formatter.render(aggregate)).thenReturn("report");

        mockMvc.perform(post("/api/v1/reviews/code")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"code":"fn main() {}","language":"rust","focus":"performance","context":"hot path"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result.kind").value("CODE"))
                .andExpect(jsonPath("$.markdown").value("report"));
    }
}
