package com.lad.core.review;

import com.lad.core.model.Budget;
import com.lad.core.model.ReviewerRole;
import com.lad.core.tools.ProjectToolset;

/**
 * Everything one reviewer needs to run: model, prompt, budget and, when tool calling is
 * possible, the toolset. {@code indexNote} explains why no toolset was attached.
 */
public record ReviewerPlan(
        ReviewerRole role,
        String modelId,
        ReviewPrompt prompt,
        Budget budget,
        ProjectToolset toolset,
        String indexNote
) {
    public boolean toolsEnabled() {
        return toolset != null;
    }
}
