package com.lad.core.health;

import com.lad.core.config.LadProperties;
import com.lad.core.llm.ModelCapabilityCache;
import com.lad.core.llm.ModelMetadataException;
import com.lad.core.model.ModelMetadata;
import com.lad.index.ProjectIndexLocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final LadProperties properties;
    private final ModelCapabilityCache capabilityCache;
    private final ProjectIndexLocator indexLocator;

    public HealthCheckService(LadProperties properties,
                              ModelCapabilityCache capabilityCache,
                              ProjectIndexLocator indexLocator) {
        this.properties = properties;
        this.capabilityCache = capabilityCache;
        this.indexLocator = indexLocator;
    }

    /**
     * @param projectRoot directory to probe for a project index; may be {@code null}
     */
    public List<HealthStatus> checkAll(Path projectRoot) {
        var results = new ArrayList<HealthStatus>();
        results.add(checkCredentials());
        results.add(checkModel("primary", properties.getReviewers().getPrimaryModel()));
        results.add(checkModel("secondary", properties.getReviewers().getSecondaryModel()));
        results.add(checkProjectIndex(projectRoot));
        return results;
    }

    private HealthStatus checkCredentials() {
        if (properties.getOpenrouter().hasApiKey()) {
            return HealthStatus.up("credentials", "OpenRouter API key configured");
        }
        return HealthStatus.down("credentials", "OPENROUTER_API_KEY is not set");
    }

    private HealthStatus checkModel(String component, String modelId) {
        if (LadProperties.isDisabledModel(modelId)) {
            return HealthStatus.up(component, "Reviewer disabled by configuration");
        }
        try {
            ModelMetadata metadata = capabilityCache.resolve(modelId);
            return new HealthStatus(component, HealthStatus.Status.UP,
                    modelId + " (context " + metadata.contextWindowTokens() + " tokens, tools "
                            + (metadata.supportsToolCalling() ? "yes" : "no") + ")",
                    Map.of("model", modelId,
                            "contextWindowTokens", String.valueOf(metadata.contextWindowTokens()),
                            "supportsToolCalling", String.valueOf(metadata.supportsToolCalling())));
        } catch (ModelMetadataException e) {
            log.warn("Model health check failed for {}: {}", modelId, e.getMessage());
            return new HealthStatus(component, HealthStatus.Status.DOWN,
                    "Metadata unavailable: " + e.getMessage(), Map.of("model", modelId));
        }
    }

    private HealthStatus checkProjectIndex(Path projectRoot) {
        var lookup = indexLocator.locate(projectRoot);
        if (lookup.isAvailable()) {
            return HealthStatus.up("project-index", "Project index available (" + lookup.index().describe() + ")");
        }
        return HealthStatus.degraded("project-index", "Reviews will run without tools: " + lookup.unavailableReason());
    }
}
