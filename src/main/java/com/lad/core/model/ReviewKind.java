package com.lad.core.model;

/**
 * The two review operations exposed to callers.
 */
public enum ReviewKind {
    DESIGN("design review"),
    CODE("code review");

    private final String label;

    ReviewKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
