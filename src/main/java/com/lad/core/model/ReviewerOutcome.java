package com.lad.core.model;

import java.util.List;

/**
 * Result of one reviewer invocation. {@code finalText} is present only for
 * {@link ReviewerStatus#SUCCEEDED}; {@code error} only for TIMED_OUT and FAILED.
 * {@code toolCalls} may be non-empty for any non-disabled status.
 */
public record ReviewerOutcome(
        ReviewerRole role,
        String modelId,
        ReviewerStatus status,
        String finalText,
        List<ToolCall> toolCalls,
        ErrorKind error,
        String errorDetail,
        String indexNote
) {
    public ReviewerOutcome {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static ReviewerOutcome succeeded(ReviewerRole role, String modelId, String text,
                                            List<ToolCall> toolCalls, String indexNote) {
        return new ReviewerOutcome(role, modelId, ReviewerStatus.SUCCEEDED, text, toolCalls, null, null, indexNote);
    }

    public static ReviewerOutcome timedOut(ReviewerRole role, String modelId, String detail,
                                           List<ToolCall> toolCalls, String indexNote) {
        return new ReviewerOutcome(role, modelId, ReviewerStatus.TIMED_OUT, null, toolCalls,
                ErrorKind.TIMED_OUT, detail, indexNote);
    }

    public static ReviewerOutcome failed(ReviewerRole role, String modelId, ErrorKind error, String detail,
                                         List<ToolCall> toolCalls, String indexNote) {
        return new ReviewerOutcome(role, modelId, ReviewerStatus.FAILED, null, toolCalls, error, detail, indexNote);
    }

    public static ReviewerOutcome disabled(ReviewerRole role, String modelId) {
        return new ReviewerOutcome(role, modelId, ReviewerStatus.DISABLED, null, List.of(), null, null, null);
    }

    public boolean hasText() {
        return status == ReviewerStatus.SUCCEEDED && finalText != null && !finalText.isBlank();
    }
}
