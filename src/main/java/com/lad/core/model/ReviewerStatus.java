package com.lad.core.model;

/**
 * Terminal status of a single reviewer invocation.
 */
public enum ReviewerStatus {
    SUCCEEDED,
    TIMED_OUT,
    FAILED,
    /** Reviewer switched off by configuration; no network call was made. */
    DISABLED
}
