package com.lad.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/reviews/code.
 *
 * @param code        code snippet; nullable when paths are given
 * @param paths       files or directories to embed
 * @param projectRoot project root; nullable
 * @param language    snippet language, used for the code fence; nullable
 * @param focus       review focus area; nullable
 * @param context     additional context; nullable
 */
public record CodeReviewBody(
    String code,
    List<String> paths,
    @JsonProperty("project_root") String projectRoot,
    String language,
    String focus,
    String context
) {}
