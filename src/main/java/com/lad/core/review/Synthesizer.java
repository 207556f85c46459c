package com.lad.core.review;

import com.lad.core.budget.BudgetCalculator;
import com.lad.core.concurrency.AdmissionTimeoutException;
import com.lad.core.concurrency.ReviewExecutors;
import com.lad.core.config.LadProperties;
import com.lad.core.llm.ChatCompletionService;
import com.lad.core.logging.MdcContext;
import com.lad.core.metrics.ReviewMetrics;
import com.lad.core.model.ErrorKind;
import com.lad.core.model.ReviewKind;
import com.lad.core.model.ReviewerOutcome;
import com.lad.core.model.ReviewerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Produces the combined summary of a dual review.
 * <p>
 * With two review texts, one model call merges them. With one, the summary is that text
 * behind a note naming the missing reviewer. With none, there is nothing to summarize.
 */
@Service
public class Synthesizer {

    private static final Logger log = LoggerFactory.getLogger(Synthesizer.class);

    private static final String SYSTEM_PROMPT = """
            You merge two independent %s reports into one concise summary.
            Keep points both reviewers agree on, call out where they disagree and which side has \
            stronger evidence, and order recommendations by severity.
            Do not invent findings that neither reviewer made.
            Return Markdown.
            """;

    private final ChatCompletionService chat;
    private final LadProperties properties;
    private final ExecutorService executor;
    private final ReviewMetrics metrics;
    private final int maxCharsPerReview;

    public Synthesizer(ChatCompletionService chat,
                       LadProperties properties,
                       @Qualifier(ReviewExecutors.INVOCATION) ExecutorService executor,
                       ReviewMetrics metrics,
                       BudgetCalculator budgetCalculator) {
        this.chat = chat;
        this.properties = properties;
        this.executor = executor;
        this.metrics = metrics;
        int ceiling = budgetCalculator.absoluteMaxInputChars();
        this.maxCharsPerReview = ceiling > 0 ? ceiling / 2 : Integer.MAX_VALUE;
    }

    /**
     * @param secondary {@code null} when the Secondary reviewer is disabled
     */
    public SynthesisResult summarize(ReviewKind kind, ReviewerOutcome primary, ReviewerOutcome secondary) {
        boolean primaryText = primary != null && primary.hasText();
        boolean secondaryText = secondary != null && secondary.hasText();

        if (!primaryText && !secondaryText) {
            metrics.recordSynthesis("no_input");
            return SynthesisResult.failed(ErrorKind.NO_INPUT_FOR_SYNTHESIS,
                    "No reviewer produced a review. " + describe("Primary", primary) + " " + describe("Secondary", secondary));
        }
        if (!secondaryText) {
            metrics.recordSynthesis("single");
            return SynthesisResult.of("Only the Primary review is available. " + describe("Secondary", secondary)
                    + "\n\n" + primary.finalText().strip());
        }
        if (!primaryText) {
            metrics.recordSynthesis("single");
            return SynthesisResult.of("Only the Secondary review is available. " + describe("Primary", primary)
                    + "\n\n" + secondary.finalText().strip());
        }
        return merge(kind, primary.finalText(), secondary.finalText());
    }

    private SynthesisResult merge(ReviewKind kind, String primaryText, String secondaryText) {
        String modelId = properties.resolveSynthesisModel();
        if (modelId == null) {
            metrics.recordSynthesis("failed");
            return SynthesisResult.failed(ErrorKind.TRANSPORT_ERROR, "No synthesis model is configured");
        }

        int timeoutSeconds = properties.getSynthesis().getTimeoutSeconds();
        Instant deadline = Instant.now().plusSeconds(timeoutSeconds);
        List<Message> messages = List.of(
                new SystemMessage(SYSTEM_PROMPT.formatted(kind.label())),
                new UserMessage("## Primary Review\n\n" + cap(primaryText)
                        + "\n\n## Secondary Review\n\n" + cap(secondaryText)));
        int maxTokens = properties.getBudget().getFixedOutputTokens();

        Map<String, String> mdc = MdcContext.snapshot();
        Future<AssistantMessage> call = executor.submit(() -> {
            MdcContext.restore(mdc);
            try {
                return chat.complete(modelId, messages, List.of(), maxTokens, deadline);
            } finally {
                MdcContext.clear();
            }
        });

        long start = System.currentTimeMillis();
        try {
            long waitMillis = Math.max(0L, Duration.between(Instant.now(), deadline).toMillis());
            AssistantMessage reply = call.get(waitMillis, TimeUnit.MILLISECONDS);
            String text = reply.getText();
            if (text == null || text.isBlank()) {
                metrics.recordSynthesis("failed");
                return SynthesisResult.failed(ErrorKind.TRANSPORT_ERROR, "Synthesis model returned an empty summary");
            }
            metrics.recordSynthesis("merged");
            log.info("Synthesis complete → {} ({}s)", modelId,
                    String.format("%.1f", (System.currentTimeMillis() - start) / 1000.0));
            return SynthesisResult.of(text.strip());
        } catch (TimeoutException e) {
            call.cancel(true);
            metrics.recordSynthesis("timed_out");
            log.warn("Synthesis timed out after {}s", timeoutSeconds);
            return SynthesisResult.failed(ErrorKind.TIMED_OUT, "Synthesis timed out after " + timeoutSeconds + "s");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof AdmissionTimeoutException) {
                metrics.recordSynthesis("timed_out");
                return SynthesisResult.failed(ErrorKind.TIMED_OUT, cause.getMessage());
            }
            metrics.recordSynthesis("failed");
            log.warn("Synthesis failed: {}", cause.getMessage());
            return SynthesisResult.failed(ErrorKind.TRANSPORT_ERROR,
                    cause.getMessage() != null ? cause.getMessage() : cause.toString());
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            metrics.recordSynthesis("timed_out");
            return SynthesisResult.failed(ErrorKind.TIMED_OUT, "Synthesis interrupted");
        }
    }

    private String cap(String text) {
        String stripped = text.strip();
        return stripped.length() <= maxCharsPerReview
                ? stripped
                : PromptBuilder.truncate(stripped, maxCharsPerReview);
    }

    static String describe(String name, ReviewerOutcome outcome) {
        if (outcome == null || outcome.status() == ReviewerStatus.DISABLED) {
            return name + " reviewer is disabled.";
        }
        return switch (outcome.status()) {
            case TIMED_OUT -> name + " reviewer timed out.";
            case FAILED -> name + " reviewer failed (" + outcome.error() + "): " + outcome.errorDetail();
            default -> name + " reviewer returned no text.";
        };
    }
}
