package com.lad.core.model;

/**
 * Input-size budget derived from a model's context window.
 */
public record Budget(
        int availableInputTokens,
        int maxInputChars,
        int reservedOutputTokens,
        int reservedOverheadTokens
) {
    public boolean isExhausted() {
        return availableInputTokens <= 0 || maxInputChars <= 0;
    }
}
