package com.lad.core.model;

/**
 * Failure families surfaced in {@link ReviewerOutcome} and {@link AggregateResult}.
 */
public enum ErrorKind {
    METADATA_UNAVAILABLE,
    BUDGET_EXHAUSTED,
    TRANSPORT_ERROR,
    TIMED_OUT,
    NO_INPUT_FOR_SYNTHESIS
}
