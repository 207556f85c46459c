package com.lad.core.review;

/**
 * System and user prompt for one reviewer, after redaction and truncation.
 */
public record ReviewPrompt(String system, String user, boolean truncated) {}
