package com.lad.core.review;

import com.lad.core.config.LadProperties;
import com.lad.core.model.AggregateResult;
import com.lad.core.model.ErrorKind;
import com.lad.core.model.ReviewKind;
import com.lad.core.model.ReviewRequest;
import com.lad.core.model.ReviewerOutcome;
import com.lad.core.model.ReviewerRole;
import com.lad.core.model.ReviewerStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class DualReviewCoordinatorTest {

    private ReviewerInvocation invocation;
    private Synthesizer synthesizer;
    private LadProperties properties;
    private ExecutorService executor;
    private DualReviewCoordinator coordinator;

    private final ReviewRequest request = ReviewRequest.code("int x = 1;", List.of(), "java", null, Path.of("/tmp"));

    @BeforeEach
    void setUp() {
        invocation = mock(ReviewerInvocation.class);
        synthesizer = mock(Synthesizer.class);
        properties = new LadProperties();
        properties.getReviewers().setPrimaryModel("m/primary");
        properties.getReviewers().setSecondaryModel("m/secondary");
        executor = Executors.newCachedThreadPool();
        coordinator = new DualReviewCoordinator(invocation, synthesizer, properties, executor);
        when(synthesizer.summarize(any(), any(), any())).thenReturn(SynthesisResult.of("summary"));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Both reviewers run concurrently and are aggregated")
    void runsBothConcurrently() {
        CountDownLatch bothStarted = new CountDownLatch(2);
        when(invocation.review(any(), anyString(), eq(request))).thenAnswer(inv -> {
            bothStarted.countDown();
            // each branch waits until the other has started
            assertTrue(bothStarted.await(5, TimeUnit.SECONDS));
            ReviewerRole role = inv.getArgument(0);
            return ReviewerOutcome.succeeded(role, inv.getArgument(1), role + " text", List.of(), null);
        });

        AggregateResult result = coordinator.review(request);

        assertTrue(result.requestId().matches("REV-[0-9A-F]{8}"));
        assertEquals(ReviewKind.CODE, result.kind());
        assertEquals(ReviewerStatus.SUCCEEDED, result.primary().status());
        assertEquals("m/primary", result.primary().modelId());
        assertEquals(ReviewerStatus.SUCCEEDED, result.secondary().status());
        assertEquals("m/secondary", result.secondary().modelId());
        assertEquals("summary", result.summary());
        assertNull(result.summaryError());
    }

    @Test
    @DisplayName("Disabled Secondary is absent from the result and never invoked")
    void secondaryDisabled() {
        properties.getReviewers().setSecondaryModel("0");
        when(invocation.review(eq(ReviewerRole.PRIMARY), anyString(), any()))
                .thenReturn(ReviewerOutcome.succeeded(ReviewerRole.PRIMARY, "m/primary", "text", List.of(), null));

        AggregateResult result = coordinator.review(request);

        assertNull(result.secondary());
        verify(invocation, never()).review(eq(ReviewerRole.SECONDARY), anyString(), any());
        verify(synthesizer).summarize(eq(ReviewKind.CODE), any(), isNull());
    }

    @Test
    @DisplayName("A branch that throws becomes a FAILED outcome and the other branch survives")
    void branchFailureIsContained() {
        when(invocation.review(eq(ReviewerRole.PRIMARY), anyString(), any()))
                .thenThrow(new IllegalStateException("boom"));
        when(invocation.review(eq(ReviewerRole.SECONDARY), anyString(), any()))
                .thenReturn(ReviewerOutcome.succeeded(ReviewerRole.SECONDARY, "m/secondary", "text", List.of(), null));

        AggregateResult result = coordinator.review(request);

        assertEquals(ReviewerStatus.FAILED, result.primary().status());
        assertEquals(ErrorKind.TRANSPORT_ERROR, result.primary().error());
        assertEquals("boom", result.primary().errorDetail());
        assertEquals(ReviewerStatus.SUCCEEDED, result.secondary().status());
    }

    @Test
    @DisplayName("Timed-out Primary does not hold back the Secondary result")
    void primaryTimeoutSecondarySucceeds() {
        ReviewerOutcome timedOut = ReviewerOutcome.timedOut(ReviewerRole.PRIMARY, "m/primary", "late", List.of(), null);
        ReviewerOutcome succeeded = ReviewerOutcome.succeeded(ReviewerRole.SECONDARY, "m/secondary", "text", List.of(), null);
        when(invocation.review(eq(ReviewerRole.PRIMARY), anyString(), any())).thenReturn(timedOut);
        when(invocation.review(eq(ReviewerRole.SECONDARY), anyString(), any())).thenReturn(succeeded);

        AggregateResult result = coordinator.review(request);

        assertEquals(ReviewerStatus.TIMED_OUT, result.primary().status());
        assertEquals(ReviewerStatus.SUCCEEDED, result.secondary().status());
        verify(synthesizer).summarize(ReviewKind.CODE, timedOut, succeeded);
    }

    @Test
    @DisplayName("Synthesis failure is surfaced alongside both outcomes")
    void synthesisFailureSurfaced() {
        when(invocation.review(any(), anyString(), any())).thenAnswer(inv ->
                ReviewerOutcome.timedOut(inv.getArgument(0), inv.getArgument(1), "late", List.of(), null));
        when(synthesizer.summarize(any(), any(), any()))
                .thenReturn(SynthesisResult.failed(ErrorKind.NO_INPUT_FOR_SYNTHESIS, "nothing"));

        AggregateResult result = coordinator.review(request);

        assertNull(result.summary());
        assertEquals(ErrorKind.NO_INPUT_FOR_SYNTHESIS, result.summaryError());
        assertEquals(ReviewerStatus.TIMED_OUT, result.primary().status());
        assertEquals(ReviewerStatus.TIMED_OUT, result.secondary().status());
    }

    @Test
    @DisplayName("Request MDC is cleared when the review returns")
    void mdcCleared() {
        when(invocation.review(any(), anyString(), any())).thenAnswer(inv ->
                ReviewerOutcome.succeeded(inv.getArgument(0), inv.getArgument(1), "t", List.of(), null));

        coordinator.review(request);

        assertNull(MDC.get("requestId"));
    }
}
