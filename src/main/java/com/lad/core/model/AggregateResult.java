package com.lad.core.model;

/**
 * Combined result of a dual review. {@code secondary} is {@code null} exactly when the
 * Secondary reviewer is disabled by configuration.
 */
public record AggregateResult(
        String requestId,
        ReviewKind kind,
        ReviewerOutcome primary,
        ReviewerOutcome secondary,
        String summary,
        ErrorKind summaryError,
        String summaryErrorDetail
) {}
