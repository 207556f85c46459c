package com.lad.core.llm;

import com.lad.core.concurrency.AdmissionGate;
import com.lad.core.concurrency.AdmissionTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Wraps Spring AI's {@link ChatClient} for reviewer and synthesis turns.
 * <p>
 * Each call runs under the shared {@link AdmissionGate}. Tool execution inside Spring AI
 * is switched off: tool requests come back to the caller as part of the
 * {@link AssistantMessage} so the caller can drive the exchange itself.
 */
@Service
public class ChatCompletionService {

    private static final Logger log = LoggerFactory.getLogger(ChatCompletionService.class);

    private final ChatClient chatClient;
    private final AdmissionGate admissionGate;

    public ChatCompletionService(ChatClient.Builder builder, AdmissionGate admissionGate) {
        this.chatClient = builder.build();
        this.admissionGate = admissionGate;
    }

    /**
     * Sends one chat turn.
     *
     * @param modelId         model to address
     * @param messages        full conversation so far
     * @param tools           tools to offer; empty for a tool-less turn
     * @param maxOutputTokens completion cap sent as {@code max_tokens}
     * @param deadline        bound on waiting for an admission permit
     * @return the assistant message, possibly carrying tool calls
     * @throws TransportException        if the call fails or yields no message
     * @throws AdmissionTimeoutException if no permit became available before the deadline
     */
    public AssistantMessage complete(String modelId, List<Message> messages, List<ToolCallback> tools,
                                     int maxOutputTokens, Instant deadline) throws InterruptedException {
        var options = ToolCallingChatOptions.builder()
                .model(modelId)
                .maxTokens(maxOutputTokens)
                .toolCallbacks(tools)
                .internalToolExecutionEnabled(false)
                .build();

        long start = System.currentTimeMillis();
        ChatResponse response = admissionGate.withPermit(deadline, () -> send(modelId, messages, options));
        long elapsed = System.currentTimeMillis() - start;

        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new TransportException("Model " + modelId + " returned an empty response");
        }
        AssistantMessage output = response.getResult().getOutput();
        log.info("Model call complete → {} ({}s, {} tool call(s))", modelId,
                String.format("%.1f", elapsed / 1000.0),
                output.hasToolCalls() ? output.getToolCalls().size() : 0);
        return output;
    }

    private ChatResponse send(String modelId, List<Message> messages, ToolCallingChatOptions options) {
        try {
            return chatClient.prompt()
                    .messages(messages)
                    .options(options)
                    .call()
                    .chatResponse();
        } catch (RuntimeException e) {
            log.warn("Model call to {} failed: {}", modelId, e.getMessage());
            throw new TransportException("Model call to " + modelId + " failed: " + e.getMessage(), e);
        }
    }
}
