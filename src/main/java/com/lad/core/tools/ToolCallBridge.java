package com.lad.core.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lad.core.concurrency.AdmissionGate;
import com.lad.core.concurrency.AdmissionTimeoutException;
import com.lad.core.llm.ChatCompletionService;
import com.lad.core.llm.TransportException;
import com.lad.core.logging.MdcContext;
import com.lad.core.metrics.ReviewMetrics;
import com.lad.core.model.ToolCall;
import com.lad.core.security.SecretRedactor;
import com.lad.index.ProjectIndexException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives one reviewer's multi-turn tool-calling exchange as an explicit state machine.
 * <pre>
 * AWAITING_PREFLIGHT --activation ok--> ACTIVE --call ceiling--> EXHAUSTED
 *        |                                 |                         |
 *        +------------ final text ---------+-------------------------+--> COMPLETED
 * any non-terminal --deadline--> TIMED_OUT, --transport error--> FAILED
 * </pre>
 * Every tool call the model requests consumes one unit of the call ceiling. Every
 * tool-call id in an assistant turn receives exactly one tool response.
 * <p>
 * One instance serves one invocation. The exchange runs on a single worker thread;
 * {@link #state()} and {@link #transcript()} may be read from other threads.
 */
public class ToolCallBridge {

    private static final Logger log = LoggerFactory.getLogger(ToolCallBridge.class);

    static final int MAX_FINALIZE_TURNS = 2;

    public static final String FINALIZE_INSTRUCTION =
            "You have reached the maximum tool call budget. Provide your final review now without further tool calls.";

    static final String BUDGET_EXHAUSTED_MARKER =
            "[TOOL OUTPUT BUDGET EXHAUSTED: no further tool output can be returned. Continue with the context you already have.]";

    private final ChatCompletionService chat;
    private final ProjectToolset toolset;
    private final ToolLimits limits;
    private final ExecutorService toolExecutor;
    private final AdmissionGate admissionGate;
    private final ReviewMetrics metrics;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private final List<ToolCall> transcript = new CopyOnWriteArrayList<>();
    private volatile BridgeState state = BridgeState.AWAITING_PREFLIGHT;
    private int requestedCalls;
    private int emittedChars;

    public ToolCallBridge(ChatCompletionService chat, ProjectToolset toolset, ToolLimits limits,
                          ExecutorService toolExecutor, AdmissionGate admissionGate, ReviewMetrics metrics) {
        this.chat = chat;
        this.toolset = toolset;
        this.limits = limits;
        this.toolExecutor = toolExecutor;
        this.admissionGate = admissionGate;
        this.metrics = metrics;
    }

    /**
     * Continues the exchange from a model response until a final answer is produced.
     *
     * @param modelId         model to address
     * @param maxOutputTokens completion cap for every turn
     * @param conversation    mutable conversation; assistant turns and tool responses are appended
     * @param response        latest assistant message, possibly carrying tool calls
     * @param deadline        invocation deadline
     * @return the final review text
     */
    public String drive(String modelId, int maxOutputTokens, List<Message> conversation,
                        AssistantMessage response, Instant deadline) throws InterruptedException {
        AssistantMessage current = response;
        int finalizeTurns = 0;
        try {
            while (current.hasToolCalls()) {
                conversation.add(current);
                conversation.add(answer(current.getToolCalls(), deadline));

                if (state == BridgeState.EXHAUSTED) {
                    if (finalizeTurns >= MAX_FINALIZE_TURNS) {
                        log.warn("Model kept requesting tools after {} finalize turns; using latest text", finalizeTurns);
                        break;
                    }
                    finalizeTurns++;
                    conversation.add(new SystemMessage(FINALIZE_INSTRUCTION));
                    current = chat.complete(modelId, conversation, List.of(), maxOutputTokens, deadline);
                } else {
                    current = chat.complete(modelId, conversation, toolset.callbacks(), maxOutputTokens, deadline);
                }
            }
        } catch (AdmissionTimeoutException | InterruptedException e) {
            moveTo(BridgeState.TIMED_OUT);
            throw e;
        } catch (TransportException e) {
            moveTo(BridgeState.FAILED);
            throw e;
        }
        moveTo(BridgeState.COMPLETED);
        metrics.recordToolCallsPerReview(transcript.size());
        String text = current.getText();
        return text != null ? text : "";
    }

    private ToolResponseMessage answer(List<AssistantMessage.ToolCall> calls, Instant deadline)
            throws InterruptedException {
        var responses = new ArrayList<ToolResponseMessage.ToolResponse>(calls.size());
        for (AssistantMessage.ToolCall call : calls) {
            responses.add(new ToolResponseMessage.ToolResponse(call.id(), call.name(), respond(call, deadline)));
        }
        return new ToolResponseMessage(responses);
    }

    private String respond(AssistantMessage.ToolCall call, Instant deadline) throws InterruptedException {
        if (state == BridgeState.EXHAUSTED) {
            metrics.recordToolCall(call.name(), "refused");
            return errorJson("Tool call budget exhausted. Do not request more tools; provide your final review now.");
        }

        requestedCalls++;
        String reply;
        if (state == BridgeState.AWAITING_PREFLIGHT && !ProjectToolset.isActivation(call.name())) {
            metrics.recordToolCall(call.name(), "rejected");
            log.debug("Rejected '{}' before activation", call.name());
            reply = errorJson("activate_project must be called first. Call activate_project with project='.' "
                    + "before using any other tool.");
        } else {
            reply = executeAndRecord(call, deadline);
        }

        if (requestedCalls >= limits.maxToolCalls()) {
            log.info("Tool call ceiling of {} reached", limits.maxToolCalls());
            moveTo(BridgeState.EXHAUSTED);
        }
        return reply;
    }

    private String executeAndRecord(AssistantMessage.ToolCall call, Instant deadline) throws InterruptedException {
        String name = call.name();
        long start = System.nanoTime();

        Map<String, Object> args;
        Dispatch dispatch;
        try {
            args = ProjectToolset.parseArguments(call.arguments());
            dispatch = emittedChars >= limits.maxTotalChars() ? null : dispatch(name, args, deadline);
        } catch (ProjectIndexException e) {
            args = Map.of("raw", call.arguments() == null ? "" : call.arguments());
            dispatch = new Dispatch(errorJson(e.getMessage()), false);
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        if (dispatch == null) {
            metrics.recordToolCall(name, "budget_exhausted");
            transcript.add(new ToolCall(name, args, BUDGET_EXHAUSTED_MARKER, true, elapsed));
            return BUDGET_EXHAUSTED_MARKER;
        }

        String text = SecretRedactor.redact(dispatch.text());
        int allowed = Math.max(0, Math.min(limits.maxResultChars(), limits.maxTotalChars() - emittedChars));
        boolean truncated = text.length() > allowed;
        String result = truncated
                ? text.substring(0, allowed) + "\n[TRUNCATED: tool output capped at " + allowed + " characters]"
                : text;
        emittedChars += Math.min(text.length(), allowed);

        transcript.add(new ToolCall(name, args, result, truncated, elapsed));
        metrics.recordToolCall(name, dispatch.succeeded() ? "ok" : "error");
        log.debug("Tool '{}' finished in {}ms ({} chars{})", name, elapsed.toMillis(), result.length(),
                truncated ? ", truncated" : "");

        if (ProjectToolset.isActivation(name) && dispatch.succeeded() && state == BridgeState.AWAITING_PREFLIGHT) {
            moveTo(BridgeState.ACTIVE);
            log.info("Project activated via {}", toolset.index().describe());
        }
        return result;
    }

    private Dispatch dispatch(String name, Map<String, Object> args, Instant deadline) throws InterruptedException {
        Instant byTimeout = Instant.now().plus(limits.toolTimeout());
        Instant callDeadline = byTimeout.isBefore(deadline) ? byTimeout : deadline;
        Map<String, String> mdc = MdcContext.snapshot();

        Future<String> future = toolExecutor.submit(() -> {
            MdcContext.restore(mdc);
            try {
                return admissionGate.withPermit(callDeadline, () -> toolset.execute(name, args));
            } finally {
                MdcContext.clear();
            }
        });

        long waitMillis = Math.max(1L, Duration.between(Instant.now(), callDeadline).toMillis());
        try {
            return new Dispatch(future.get(waitMillis, TimeUnit.MILLISECONDS), true);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Tool '{}' timed out after {}ms", name, waitMillis);
            return new Dispatch(errorJson("Tool call '" + name + "' timed out"), false);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof AdmissionTimeoutException) {
                return new Dispatch(errorJson("Tool call '" + name + "' timed out waiting for capacity"), false);
            }
            if (!(cause instanceof ProjectIndexException)) {
                log.warn("Tool '{}' failed unexpectedly: {}", name, cause.toString());
            }
            return new Dispatch(errorJson(cause.getMessage() != null ? cause.getMessage() : cause.toString()), false);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private String errorJson(String message) {
        return objectMapper.createObjectNode().put("error", message).toString();
    }

    public BridgeState state() {
        return state;
    }

    /**
     * Called by the owner when the invocation deadline fires.
     */
    public void markTimedOut() {
        moveTo(BridgeState.TIMED_OUT);
    }

    // Terminal states are final; a worker still unwinding after a timeout cannot overwrite it.
    private synchronized void moveTo(BridgeState next) {
        if (!state.isTerminal()) {
            state = next;
        }
    }

    /**
     * Snapshot of the executed tool calls so far, in order.
     */
    public List<ToolCall> transcript() {
        return List.copyOf(transcript);
    }

    private record Dispatch(String text, boolean succeeded) {}
}
