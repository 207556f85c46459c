package com.lad.dispatch.api;

import com.lad.core.model.AggregateResult;

/**
 * Outbound JSON for a completed review: the structured result and its Markdown rendering.
 */
public record ReviewResponse(AggregateResult result, String markdown) {}
