package com.lad.core.model;

public enum ReviewerRole {
    PRIMARY("Primary"),
    SECONDARY("Secondary");

    private final String displayName;

    ReviewerRole(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
