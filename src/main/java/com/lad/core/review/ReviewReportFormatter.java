package com.lad.core.review;

import com.lad.core.model.AggregateResult;
import com.lad.core.model.ReviewerOutcome;
import com.lad.core.model.ReviewerStatus;
import com.lad.core.model.ToolCall;
import com.lad.core.security.SecretRedactor;
import com.lad.core.tools.ProjectToolset;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Renders an {@link AggregateResult} as Markdown for human callers.
 * <p>
 * Each reviewer section is normalized to carry the four required headings and ends with a
 * disclosure footer. The rendered document is redacted once more before it leaves.
 */
@Component
public class ReviewReportFormatter {

    static final List<String> REQUIRED_SECTIONS = List.of(
            "Summary", "Key Findings", "Recommendations", "Questions / Unknowns");

    public String render(AggregateResult result) {
        var out = new StringBuilder();
        out.append("## Primary Reviewer\n\n").append(section(result.primary())).append("\n\n");
        if (result.secondary() != null) {
            out.append("## Secondary Reviewer\n\n").append(section(result.secondary())).append("\n\n");
        }
        out.append("## Synthesized Summary\n\n").append(summary(result)).append('\n');
        return SecretRedactor.redact(out.toString().strip());
    }

    private String section(ReviewerOutcome outcome) {
        String body = switch (outcome.status()) {
            case SUCCEEDED -> normalize(outcome.finalText());
            case TIMED_OUT -> "### Error\n*Reviewer timed out: " + outcome.errorDetail() + "*";
            case FAILED -> "### Error\n*Reviewer failed (" + outcome.error() + "): " + outcome.errorDetail() + "*";
            case DISABLED -> "*Reviewer disabled by configuration.*";
        };
        return body + "\n\n" + footer(outcome);
    }

    private static String summary(AggregateResult result) {
        if (result.summary() != null && !result.summary().isBlank()) {
            return result.summary().strip();
        }
        return "*No synthesized summary (" + result.summaryError() + "): " + result.summaryErrorDetail() + "*";
    }

    /**
     * Ensures the required headings exist, appending placeholders for any that are missing.
     */
    static String normalize(String markdown) {
        String normalized = markdown == null ? "" : markdown.strip();
        if (normalized.isEmpty()) {
            normalized = "## Summary\n*(No content provided by reviewer)*\n";
        }
        var sb = new StringBuilder(normalized);
        for (String section : REQUIRED_SECTIONS) {
            Pattern heading = Pattern.compile("^#{2,3}\\s+" + Pattern.quote(section) + "\\s*$", Pattern.MULTILINE);
            if (!heading.matcher(normalized).find()) {
                sb.append("\n\n## ").append(section).append("\n*(No ").append(section).append(" provided by reviewer)*\n");
            }
        }
        return sb.toString().strip();
    }

    static String footer(ReviewerOutcome outcome) {
        List<String> lines = new ArrayList<>();
        lines.add("---");
        lines.add("*Model: `" + outcome.modelId() + "`*");
        lines.add("*Status: " + outcome.status() + "*");

        List<ToolCall> calls = outcome.toolCalls();
        if (calls.isEmpty()) {
            lines.add("*Project tools used: no*");
        } else {
            lines.add("*Project tools used: yes*");
            Set<String> tools = new LinkedHashSet<>();
            Set<String> memories = new LinkedHashSet<>();
            Set<String> paths = new LinkedHashSet<>();
            for (ToolCall call : calls) {
                tools.add(call.name());
                if (ProjectToolset.READ_MEMORY.equals(call.name()) && call.arguments().get("name") != null) {
                    memories.add(String.valueOf(call.arguments().get("name")));
                } else if (ProjectToolset.READ_PROJECT_OVERVIEW.equals(call.name())) {
                    memories.add("project_overview");
                } else if (call.arguments().get("path") != null) {
                    paths.add(String.valueOf(call.arguments().get("path")));
                }
            }
            lines.add("*Tools invoked (" + calls.size() + "): " + code(tools) + "*");
            if (!memories.isEmpty()) {
                lines.add("*Memories used: " + code(memories) + "*");
            }
            if (!paths.isEmpty()) {
                lines.add("*Repo paths used: " + code(paths) + "*");
            }
        }
        if (outcome.indexNote() != null && outcome.status() != ReviewerStatus.DISABLED) {
            lines.add("*Project index note: " + outcome.indexNote() + "*");
        }
        return String.join("\n", lines);
    }

    private static String code(Set<String> values) {
        return String.join(", ", values.stream().map(v -> "`" + v + "`").toList());
    }
}
