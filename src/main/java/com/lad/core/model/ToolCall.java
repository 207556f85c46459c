package com.lad.core.model;

import java.time.Duration;
import java.util.Map;

/**
 * One executed tool call, as recorded in a reviewer's transcript.
 *
 * @param name      tool name as shown to the model
 * @param arguments parsed arguments
 * @param result    text returned to the model, after capping
 * @param truncated whether the result was shortened or replaced by a budget marker
 * @param elapsed   wall-clock time spent on the call
 */
public record ToolCall(
        String name,
        Map<String, Object> arguments,
        String result,
        boolean truncated,
        Duration elapsed
) {
    public ToolCall {
        arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
    }
}
