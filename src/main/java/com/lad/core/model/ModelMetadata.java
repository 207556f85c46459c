package com.lad.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Capabilities of one model as advertised by the model-serving API.
 *
 * @param id                   model identifier, e.g. {@code moonshotai/kimi-k2.5}
 * @param contextWindowTokens  effective context window (the smaller of the model and top-provider values)
 * @param supportsToolCalling  whether {@code "tools"} is among the supported parameters
 * @param maxCompletionTokens  provider completion limit, or {@code null} when not advertised
 * @param supportedParameters  raw parameter names from the listing
 * @param fetchedAt            when the listing containing this entry was fetched
 */
public record ModelMetadata(
        String id,
        int contextWindowTokens,
        boolean supportsToolCalling,
        Integer maxCompletionTokens,
        List<String> supportedParameters,
        Instant fetchedAt
) {
    public ModelMetadata {
        supportedParameters = supportedParameters == null ? List.of() : List.copyOf(supportedParameters);
    }

    /**
     * Output reservation for a request: the configured fixed value, capped by the
     * provider's completion limit when one is advertised.
     */
    public int effectiveOutputTokens(int fixedOutputTokens) {
        if (maxCompletionTokens != null && maxCompletionTokens > 0) {
            return Math.min(fixedOutputTokens, maxCompletionTokens);
        }
        return fixedOutputTokens;
    }
}
