package com.lad.core.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Immutable input to one dual review.
 * <p>
 * {@code inlineText} is the proposal (design review) or the code (code review).
 * Either it or {@code embeddedFiles} is non-empty; transports validate that before
 * building the request. {@code focus} is one of {@link #FOCUS_AREAS} or null (code review only).
 */
public record ReviewRequest(
        ReviewKind kind,
        String inlineText,
        List<EmbeddedFile> embeddedFiles,
        String constraints,
        String context,
        String language,
        String focus,
        Path projectRoot
) {
    public static final Set<String> FOCUS_AREAS =
            Set.of("security", "performance", "logic", "architecture", "maintainability", "tests");

    public ReviewRequest {
        embeddedFiles = embeddedFiles == null ? List.of() : List.copyOf(embeddedFiles);
    }

    public static ReviewRequest design(String proposal, List<EmbeddedFile> files,
                                       String constraints, String context, Path projectRoot) {
        return new ReviewRequest(ReviewKind.DESIGN, proposal, files, constraints, context, null, null, projectRoot);
    }

    public static ReviewRequest code(String code, List<EmbeddedFile> files,
                                     String language, String context, Path projectRoot) {
        return code(code, files, language, null, context, projectRoot);
    }

    public static ReviewRequest code(String code, List<EmbeddedFile> files, String language,
                                     String focus, String context, Path projectRoot) {
        return new ReviewRequest(ReviewKind.CODE, code, files, null, context, language, focus, projectRoot);
    }

    public boolean hasInlineText() {
        return inlineText != null && !inlineText.isBlank();
    }
}
