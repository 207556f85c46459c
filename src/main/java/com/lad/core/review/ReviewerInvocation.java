package com.lad.core.review;

import com.lad.core.budget.BudgetCalculator;
import com.lad.core.concurrency.AdmissionGate;
import com.lad.core.concurrency.AdmissionTimeoutException;
import com.lad.core.concurrency.ReviewExecutors;
import com.lad.core.config.LadProperties;
import com.lad.core.llm.ChatCompletionService;
import com.lad.core.llm.MetadataTimeoutException;
import com.lad.core.llm.ModelCapabilityCache;
import com.lad.core.llm.ModelMetadataException;
import com.lad.core.llm.TransportException;
import com.lad.core.logging.MdcContext;
import com.lad.core.metrics.ReviewMetrics;
import com.lad.core.model.Budget;
import com.lad.core.model.ErrorKind;
import com.lad.core.model.ModelMetadata;
import com.lad.core.model.ReviewRequest;
import com.lad.core.model.ReviewerOutcome;
import com.lad.core.model.ReviewerRole;
import com.lad.core.model.ToolCall;
import com.lad.core.tools.ProjectToolset;
import com.lad.core.tools.ToolCallBridge;
import com.lad.core.tools.ToolLimits;
import com.lad.index.ProjectIndexLocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one reviewer under a wall-clock deadline and reports a {@link ReviewerOutcome}.
 * <p>
 * The exchange itself runs on a per-invocation worker so the deadline can cut it off
 * mid-turn. On timeout the worker is cancelled and the tool calls completed so far are
 * kept in the outcome.
 */
@Service
public class ReviewerInvocation {

    private static final Logger log = LoggerFactory.getLogger(ReviewerInvocation.class);

    static final String TOOLS_UNAVAILABLE_NOTE =
            "\n\n*(Tool calls were requested, but no tools were available.)*\n";

    private final ChatCompletionService chat;
    private final ModelCapabilityCache capabilityCache;
    private final BudgetCalculator budgetCalculator;
    private final ProjectIndexLocator indexLocator;
    private final PromptBuilder promptBuilder;
    private final AdmissionGate admissionGate;
    private final ExecutorService invocationExecutor;
    private final ExecutorService toolExecutor;
    private final LadProperties properties;
    private final ReviewMetrics metrics;

    public ReviewerInvocation(ChatCompletionService chat,
                              ModelCapabilityCache capabilityCache,
                              BudgetCalculator budgetCalculator,
                              ProjectIndexLocator indexLocator,
                              PromptBuilder promptBuilder,
                              AdmissionGate admissionGate,
                              @Qualifier(ReviewExecutors.INVOCATION) ExecutorService invocationExecutor,
                              @Qualifier(ReviewExecutors.TOOL) ExecutorService toolExecutor,
                              LadProperties properties,
                              ReviewMetrics metrics) {
        this.chat = chat;
        this.capabilityCache = capabilityCache;
        this.budgetCalculator = budgetCalculator;
        this.indexLocator = indexLocator;
        this.promptBuilder = promptBuilder;
        this.admissionGate = admissionGate;
        this.invocationExecutor = invocationExecutor;
        this.toolExecutor = toolExecutor;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Resolves capabilities, budget and project index for {@code modelId}, then runs the
     * reviewer. A disabled model returns immediately without any network call.
     */
    public ReviewerOutcome review(ReviewerRole role, String modelId, ReviewRequest request) {
        if (LadProperties.isDisabledModel(modelId)) {
            log.info("{} reviewer disabled by configuration", role.displayName());
            return ReviewerOutcome.disabled(role, modelId);
        }

        Instant deadline = Instant.now().plus(properties.getReviewers().timeout());
        MdcContext.setReviewer(role.name().toLowerCase(Locale.ROOT), modelId);
        long start = System.currentTimeMillis();
        try {
            ReviewerOutcome outcome = prepareAndRun(role, modelId, request, deadline);
            long elapsed = System.currentTimeMillis() - start;
            metrics.recordReviewer(role.name(), outcome.status().name(), elapsed);
            log.info("{} reviewer finished → {} ({}s, {} tool call(s))", role.displayName(), outcome.status(),
                    String.format("%.1f", elapsed / 1000.0), outcome.toolCalls().size());
            return outcome;
        } finally {
            MdcContext.clearReviewer();
        }
    }

    private ReviewerOutcome prepareAndRun(ReviewerRole role, String modelId, ReviewRequest request, Instant deadline) {
        ModelMetadata metadata;
        try {
            metadata = capabilityCache.resolve(modelId, deadline);
        } catch (MetadataTimeoutException e) {
            log.warn("{} reviewer timed out resolving metadata for {}", role.displayName(), modelId);
            return ReviewerOutcome.timedOut(role, modelId,
                    "Reviewer timed out after " + properties.getReviewers().getTimeoutSeconds()
                            + "s while resolving model metadata", List.of(), null);
        } catch (ModelMetadataException e) {
            log.warn("Metadata unavailable for {}: {}", modelId, e.getMessage());
            return ReviewerOutcome.failed(role, modelId, ErrorKind.METADATA_UNAVAILABLE, e.getMessage(), List.of(), null);
        }

        var budgetConfig = properties.getBudget();
        Budget budget = budgetCalculator.compute(metadata,
                budgetConfig.getFixedOutputTokens(), budgetConfig.getContextOverheadTokens());

        ProjectToolset toolset = null;
        String indexNote = null;
        if (!metadata.supportsToolCalling()) {
            indexNote = "Model does not support tool calling.";
        } else if (properties.getTools().getMaxToolCalls() <= 0) {
            indexNote = "Tool calls are disabled by configuration.";
        } else {
            var lookup = indexLocator.locate(request.projectRoot());
            if (lookup.isAvailable()) {
                toolset = new ProjectToolset(lookup.index());
            } else {
                indexNote = lookup.unavailableReason();
            }
        }

        ReviewPrompt prompt = budget.isExhausted()
                ? new ReviewPrompt("", "", false)
                : promptBuilder.build(request, toolset != null, budget.maxInputChars());
        if (prompt.truncated()) {
            log.info("User prompt truncated to {} chars", budget.maxInputChars());
        }
        return run(new ReviewerPlan(role, modelId, prompt, budget, toolset, indexNote), deadline);
    }

    /**
     * Runs one bounded exchange for a prepared plan.
     */
    public ReviewerOutcome run(ReviewerPlan plan, Instant deadline) {
        if (plan.budget().isExhausted()) {
            String detail = "No input budget left after reserving %d output and %d overhead tokens"
                    .formatted(plan.budget().reservedOutputTokens(), plan.budget().reservedOverheadTokens());
            log.warn("{} for {}", detail, plan.modelId());
            return ReviewerOutcome.failed(plan.role(), plan.modelId(), ErrorKind.BUDGET_EXHAUSTED, detail,
                    List.of(), plan.indexNote());
        }

        ToolCallBridge bridge = plan.toolsEnabled()
                ? new ToolCallBridge(chat, plan.toolset(), ToolLimits.from(properties), toolExecutor, admissionGate, metrics)
                : null;
        Map<String, String> mdc = MdcContext.snapshot();
        Future<String> worker = invocationExecutor.submit(() -> {
            MdcContext.restore(mdc);
            try {
                return exchange(plan, bridge, deadline);
            } finally {
                MdcContext.clear();
            }
        });

        long waitMillis = Math.max(0L, Duration.between(Instant.now(), deadline).toMillis());
        try {
            String text = worker.get(waitMillis, TimeUnit.MILLISECONDS);
            return ReviewerOutcome.succeeded(plan.role(), plan.modelId(), text, transcriptOf(bridge), plan.indexNote());
        } catch (TimeoutException e) {
            worker.cancel(true);
            if (bridge != null) bridge.markTimedOut();
            log.warn("{} reviewer timed out after {}s", plan.role().displayName(),
                    properties.getReviewers().getTimeoutSeconds());
            return ReviewerOutcome.timedOut(plan.role(), plan.modelId(),
                    "Reviewer timed out after " + properties.getReviewers().getTimeoutSeconds() + "s",
                    transcriptOf(bridge), plan.indexNote());
        } catch (ExecutionException e) {
            return fromFailure(plan, bridge, e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            worker.cancel(true);
            if (bridge != null) bridge.markTimedOut();
            Thread.currentThread().interrupt();
            return ReviewerOutcome.timedOut(plan.role(), plan.modelId(), "Reviewer interrupted",
                    transcriptOf(bridge), plan.indexNote());
        }
    }

    private ReviewerOutcome fromFailure(ReviewerPlan plan, ToolCallBridge bridge, Throwable cause) {
        if (cause instanceof AdmissionTimeoutException) {
            return ReviewerOutcome.timedOut(plan.role(), plan.modelId(), cause.getMessage(),
                    transcriptOf(bridge), plan.indexNote());
        }
        if (!(cause instanceof TransportException)) {
            log.error("{} reviewer failed unexpectedly", plan.role().displayName(), cause);
        }
        return ReviewerOutcome.failed(plan.role(), plan.modelId(), ErrorKind.TRANSPORT_ERROR,
                cause.getMessage() != null ? cause.getMessage() : cause.toString(),
                transcriptOf(bridge), plan.indexNote());
    }

    private String exchange(ReviewerPlan plan, ToolCallBridge bridge, Instant deadline) throws InterruptedException {
        List<Message> conversation = new ArrayList<>();
        conversation.add(new SystemMessage(plan.prompt().system()));
        conversation.add(new UserMessage(plan.prompt().user()));

        List<ToolCallback> tools = bridge != null ? plan.toolset().callbacks() : List.of();
        int maxOutputTokens = plan.budget().reservedOutputTokens();
        AssistantMessage first = chat.complete(plan.modelId(), conversation, tools, maxOutputTokens, deadline);

        String text;
        if (bridge != null) {
            text = bridge.drive(plan.modelId(), maxOutputTokens, conversation, first, deadline);
        } else {
            text = first.getText() != null ? first.getText() : "";
            if (first.hasToolCalls()) {
                text = text + TOOLS_UNAVAILABLE_NOTE;
            }
        }
        if (text.isBlank()) {
            throw new TransportException("Model " + plan.modelId() + " returned an empty review");
        }
        return text;
    }

    private static List<ToolCall> transcriptOf(ToolCallBridge bridge) {
        return bridge != null ? bridge.transcript() : List.of();
    }
}
