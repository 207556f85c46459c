package com.lad.core.review;

import com.lad.core.model.EmbeddedFile;
import com.lad.core.model.ReviewKind;
import com.lad.core.model.ReviewRequest;
import com.lad.core.security.SecretRedactor;
import org.springframework.stereotype.Component;

/**
 * Builds reviewer prompts per review kind.
 * <p>
 * All caller-supplied text is redacted before it is placed in a prompt. The user prompt is
 * cut to the reviewer's character budget and, when cut, ends with a truncation note.
 */
@Component
public class PromptBuilder {

    static final String TRUNCATION_NOTE = "\n\n[NOTE: Input truncated to fit model context window.]\n";

    private static final String SECTIONS = """
            Return Markdown with sections:
            ## Summary
            ## Key Findings
            ## Recommendations
            ## Questions / Unknowns
            """;

    private static final String TOOLS_NOTE =
            "You MAY call tools to inspect repository context and project memories when needed.";
    private static final String NO_TOOLS_NOTE =
            "You do NOT have access to any tools or repository context beyond the user-provided text.";
    private static final String PREFLIGHT =
            "PRE-FLIGHT (mandatory): Immediately call `activate_project` with `project=\".\"` before any other tool. "
            + "Then call `read_project_overview` to load baseline project context.\n";

    public ReviewPrompt build(ReviewRequest request, boolean toolsEnabled, int maxInputChars) {
        String system = systemPrompt(request.kind(), toolsEnabled);
        String user = userPrompt(request);
        if (user.length() <= maxInputChars) {
            return new ReviewPrompt(system, user, false);
        }
        return new ReviewPrompt(system, truncate(user, maxInputChars), true);
    }

    String systemPrompt(ReviewKind kind, boolean toolsEnabled) {
        String role = switch (kind) {
            case DESIGN -> "You are an expert software architect and reviewer.\nProvide a thorough but concise critique.\n";
            case CODE -> "You are an expert code reviewer focused on correctness, security, and maintainability.\n";
        };
        return role
                + (toolsEnabled ? TOOLS_NOTE : NO_TOOLS_NOTE) + "\n"
                + (toolsEnabled ? PREFLIGHT : "") + "\n"
                + SECTIONS;
    }

    String userPrompt(ReviewRequest request) {
        var out = new StringBuilder();
        if (request.kind() == ReviewKind.DESIGN) {
            out.append("# System Design Review Request\n");
            if (request.hasInlineText()) {
                out.append("\n## Proposal\n").append(SecretRedactor.redact(request.inlineText()));
            }
            appendSection(out, "Constraints", request.constraints());
            appendSection(out, "Context", request.context());
        } else {
            String language = request.language() == null || request.language().isBlank() ? "unknown" : request.language();
            out.append("# Code Review Request\n");
            out.append("\n## Language\n").append(language).append('\n');
            out.append("\n## Focus\n").append(request.focus() != null ? request.focus() : "general").append('\n');
            if (request.hasInlineText()) {
                String fence = "unknown".equals(language) ? "" : language;
                out.append("\n## Code\n```").append(fence).append('\n')
                        .append(SecretRedactor.redact(request.inlineText()))
                        .append("\n```\n");
            }
            appendSection(out, "Context", request.context());
        }

        if (!request.embeddedFiles().isEmpty()) {
            out.append("\n\n## Files (from disk)\n### Embedded\n");
            for (EmbeddedFile file : request.embeddedFiles()) {
                out.append("- `").append(file.path()).append("`\n");
            }
            out.append("\n### Embedded Content\n");
            for (EmbeddedFile file : request.embeddedFiles()) {
                out.append("--- BEGIN FILE: ").append(file.path()).append(" ---\n")
                        .append(SecretRedactor.redact(file.content()))
                        .append("\n--- END FILE: ").append(file.path()).append(" ---\n");
            }
        }
        return out.toString();
    }

    private static void appendSection(StringBuilder out, String title, String body) {
        if (body != null && !body.isBlank()) {
            out.append("\n\n## ").append(title).append('\n').append(SecretRedactor.redact(body));
        }
    }

    /**
     * Cuts {@code text} so that, with the truncation note appended, it fits in {@code maxChars}.
     */
    static String truncate(String text, int maxChars) {
        if (text.length() <= maxChars) {
            return text;
        }
        if (maxChars <= TRUNCATION_NOTE.length()) {
            return text.substring(0, Math.max(0, maxChars));
        }
        return text.substring(0, maxChars - TRUNCATION_NOTE.length()) + TRUNCATION_NOTE;
    }
}
