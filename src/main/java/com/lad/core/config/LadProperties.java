package com.lad.core.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Reviewer engine configuration, bound from {@code lad.*}.
 * <p>
 * Example:
 * <pre>
 * lad:
 *   reviewers:
 *     primary-model: moonshotai/kimi-k2.5
 *     secondary-model: "0"     # disables the Secondary reviewer
 *   tools:
 *     max-tool-calls: 32
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "lad")
public class LadProperties {

    private static final Logger log = LoggerFactory.getLogger(LadProperties.class);

    private OpenRouter openrouter = new OpenRouter();
    private Reviewers reviewers = new Reviewers();
    private BudgetConfig budget = new BudgetConfig();
    private MetadataConfig metadata = new MetadataConfig();
    private ToolsConfig tools = new ToolsConfig();
    private SynthesisConfig synthesis = new SynthesisConfig();

    @PostConstruct
    void validate() {
        if (!openrouter.hasApiKey()) {
            throw new IllegalStateException(
                    "OPENROUTER_API_KEY is not set. Provide lad.openrouter.api-key or the OPENROUTER_API_KEY env var.");
        }
        requirePositive("lad.reviewers.timeout-seconds", reviewers.timeoutSeconds);
        requirePositive("lad.reviewers.max-concurrent-requests", reviewers.maxConcurrentRequests);
        requirePositive("lad.budget.fixed-output-tokens", budget.fixedOutputTokens);
        requirePositive("lad.budget.chars-per-token", budget.charsPerToken);
        if (budget.contextOverheadTokens < 0) {
            throw new IllegalStateException("lad.budget.context-overhead-tokens must be >= 0");
        }
        requirePositive("lad.metadata.ttl-seconds", metadata.ttlSeconds);
        if (metadata.graceSeconds < 0) {
            throw new IllegalStateException("lad.metadata.grace-seconds must be >= 0");
        }
        if (tools.maxToolCalls < 0) {
            throw new IllegalStateException("lad.tools.max-tool-calls must be >= 0");
        }
        requirePositive("lad.tools.tool-timeout-seconds", tools.toolTimeoutSeconds);
        requirePositive("lad.tools.max-tool-result-chars", tools.maxToolResultChars);
        requirePositive("lad.tools.max-total-chars", tools.maxTotalChars);
        requirePositive("lad.tools.max-dir-entries", tools.maxDirEntries);
        requirePositive("lad.tools.max-search-results", tools.maxSearchResults);
        requirePositive("lad.synthesis.timeout-seconds", synthesis.timeoutSeconds);

        log.info("Reviewers: primary={} secondary={} (timeout {}s, {} concurrent requests)",
                reviewers.primaryModel,
                isDisabledModel(reviewers.secondaryModel) ? "disabled" : reviewers.secondaryModel,
                reviewers.timeoutSeconds, reviewers.maxConcurrentRequests);
    }

    private static void requirePositive(String key, int value) {
        if (value <= 0) {
            throw new IllegalStateException(key + " must be > 0 (was " + value + ")");
        }
    }

    /**
     * True when the configured model id is the sentinel that switches a reviewer off.
     */
    public static boolean isDisabledModel(String modelId) {
        if (modelId == null) return false;
        String normalized = modelId.trim().toLowerCase(Locale.ROOT);
        return "0".equals(normalized) || "disabled".equals(normalized);
    }

    /**
     * Model used for the synthesis call: the explicit setting, else Primary, else Secondary.
     * Returns {@code null} when every candidate is disabled.
     */
    public String resolveSynthesisModel() {
        if (synthesis.model != null && !synthesis.model.isBlank() && !isDisabledModel(synthesis.model)) {
            return synthesis.model.trim();
        }
        if (!isDisabledModel(reviewers.primaryModel)) return reviewers.primaryModel;
        if (!isDisabledModel(reviewers.secondaryModel)) return reviewers.secondaryModel;
        return null;
    }

    public OpenRouter getOpenrouter() { return openrouter; }
    public void setOpenrouter(OpenRouter openrouter) { this.openrouter = openrouter; }
    public Reviewers getReviewers() { return reviewers; }
    public void setReviewers(Reviewers reviewers) { this.reviewers = reviewers; }
    public BudgetConfig getBudget() { return budget; }
    public void setBudget(BudgetConfig budget) { this.budget = budget; }
    public MetadataConfig getMetadata() { return metadata; }
    public void setMetadata(MetadataConfig metadata) { this.metadata = metadata; }
    public ToolsConfig getTools() { return tools; }
    public void setTools(ToolsConfig tools) { this.tools = tools; }
    public SynthesisConfig getSynthesis() { return synthesis; }
    public void setSynthesis(SynthesisConfig synthesis) { this.synthesis = synthesis; }

    public static class OpenRouter {
        private String apiKey = "";
        private String modelsUrl = "https://openrouter.ai/api/v1/models";
        private String httpReferer = "";
        private String xTitle = "";

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getModelsUrl() { return modelsUrl; }
        public void setModelsUrl(String modelsUrl) { this.modelsUrl = modelsUrl; }
        public String getHttpReferer() { return httpReferer; }
        public void setHttpReferer(String httpReferer) { this.httpReferer = httpReferer; }
        public String getXTitle() { return xTitle; }
        public void setXTitle(String xTitle) { this.xTitle = xTitle; }
    }

    public static class Reviewers {
        private String primaryModel = "moonshotai/kimi-k2.5";
        private String secondaryModel = "z-ai/glm-5";
        private int timeoutSeconds = 300;
        private int maxConcurrentRequests = 4;

        public Duration timeout() {
            return Duration.ofSeconds(timeoutSeconds);
        }

        public String getPrimaryModel() { return primaryModel; }
        public void setPrimaryModel(String primaryModel) { this.primaryModel = primaryModel; }
        public String getSecondaryModel() { return secondaryModel; }
        public void setSecondaryModel(String secondaryModel) { this.secondaryModel = secondaryModel; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public int getMaxConcurrentRequests() { return maxConcurrentRequests; }
        public void setMaxConcurrentRequests(int maxConcurrentRequests) { this.maxConcurrentRequests = maxConcurrentRequests; }
    }

    public static class BudgetConfig {
        private int fixedOutputTokens = 8192;
        private int contextOverheadTokens = 2000;
        private int charsPerToken = 3;
        /** Absolute ceiling on prompt characters; {@code <= 0} disables the ceiling. */
        private int maxInputChars = 100_000;

        public int getFixedOutputTokens() { return fixedOutputTokens; }
        public void setFixedOutputTokens(int fixedOutputTokens) { this.fixedOutputTokens = fixedOutputTokens; }
        public int getContextOverheadTokens() { return contextOverheadTokens; }
        public void setContextOverheadTokens(int contextOverheadTokens) { this.contextOverheadTokens = contextOverheadTokens; }
        public int getCharsPerToken() { return charsPerToken; }
        public void setCharsPerToken(int charsPerToken) { this.charsPerToken = charsPerToken; }
        public int getMaxInputChars() { return maxInputChars; }
        public void setMaxInputChars(int maxInputChars) { this.maxInputChars = maxInputChars; }
    }

    public static class MetadataConfig {
        private int ttlSeconds = 3600;
        private int graceSeconds = 3600;
        private int fetchTimeoutSeconds = 30;

        public int getTtlSeconds() { return ttlSeconds; }
        public void setTtlSeconds(int ttlSeconds) { this.ttlSeconds = ttlSeconds; }
        public int getGraceSeconds() { return graceSeconds; }
        public void setGraceSeconds(int graceSeconds) { this.graceSeconds = graceSeconds; }
        public int getFetchTimeoutSeconds() { return fetchTimeoutSeconds; }
        public void setFetchTimeoutSeconds(int fetchTimeoutSeconds) { this.fetchTimeoutSeconds = fetchTimeoutSeconds; }
    }

    public static class ToolsConfig {
        private int maxToolCalls = 32;
        private int toolTimeoutSeconds = 30;
        private int maxToolResultChars = 12_000;
        private int maxTotalChars = 50_000;
        private int maxDirEntries = 100;
        private int maxSearchResults = 20;

        public int getMaxToolCalls() { return maxToolCalls; }
        public void setMaxToolCalls(int maxToolCalls) { this.maxToolCalls = maxToolCalls; }
        public int getToolTimeoutSeconds() { return toolTimeoutSeconds; }
        public void setToolTimeoutSeconds(int toolTimeoutSeconds) { this.toolTimeoutSeconds = toolTimeoutSeconds; }
        public int getMaxToolResultChars() { return maxToolResultChars; }
        public void setMaxToolResultChars(int maxToolResultChars) { this.maxToolResultChars = maxToolResultChars; }
        public int getMaxTotalChars() { return maxTotalChars; }
        public void setMaxTotalChars(int maxTotalChars) { this.maxTotalChars = maxTotalChars; }
        public int getMaxDirEntries() { return maxDirEntries; }
        public void setMaxDirEntries(int maxDirEntries) { this.maxDirEntries = maxDirEntries; }
        public int getMaxSearchResults() { return maxSearchResults; }
        public void setMaxSearchResults(int maxSearchResults) { this.maxSearchResults = maxSearchResults; }
    }

    public static class SynthesisConfig {
        private String model = "";
        private int timeoutSeconds = 120;

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }
}
