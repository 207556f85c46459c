package com.lad.core.tools;

import com.lad.core.config.LadProperties;

import java.time.Duration;

/**
 * Per-invocation ceilings for the tool-calling exchange.
 *
 * @param maxToolCalls   tool calls the model may request in total
 * @param toolTimeout    wall-clock bound on a single tool dispatch
 * @param maxResultChars per-call result cap before truncation
 * @param maxTotalChars  cumulative cap across all results of one invocation
 */
public record ToolLimits(int maxToolCalls, Duration toolTimeout, int maxResultChars, int maxTotalChars) {

    public static ToolLimits from(LadProperties properties) {
        var tools = properties.getTools();
        return new ToolLimits(tools.getMaxToolCalls(),
                Duration.ofSeconds(tools.getToolTimeoutSeconds()),
                tools.getMaxToolResultChars(),
                tools.getMaxTotalChars());
    }
}
