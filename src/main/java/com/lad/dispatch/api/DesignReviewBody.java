package com.lad.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/reviews/design.
 *
 * @param proposal    design proposal text; nullable when paths are given
 * @param paths       files or directories to embed, absolute or relative to the project root
 * @param projectRoot project root; nullable, inferred from absolute paths or the server's working directory
 * @param constraints constraints the design must satisfy; nullable
 * @param context     additional context; nullable
 */
public record DesignReviewBody(
    String proposal,
    List<String> paths,
    @JsonProperty("project_root") String projectRoot,
    String constraints,
    String context
) {}
