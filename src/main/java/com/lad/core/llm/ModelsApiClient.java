package com.lad.core.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lad.core.config.LadProperties;
import com.lad.core.model.ModelMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for the model listing endpoint ({@code GET /api/v1/models}).
 *
 * <p>The listing is a JSON object with a {@code data} array. Each entry carries
 * {@code id}, {@code context_length}, {@code supported_parameters} and an optional
 * {@code top_provider} object with its own {@code context_length} and
 * {@code max_completion_tokens}.
 */
@Component
public class ModelsApiClient {

    private static final Logger log = LoggerFactory.getLogger(ModelsApiClient.class);

    private final LadProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public ModelsApiClient(LadProperties properties) {
        this.properties = properties;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Fetches the full model listing.
     *
     * @return every model in the listing keyed by id
     * @throws ModelMetadataException if the request fails or the body is not a listing
     */
    public Map<String, ModelMetadata> fetchAll() {
        var openrouter = properties.getOpenrouter();
        String url = openrouter.getModelsUrl();
        try {
            var builder = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofSeconds(properties.getMetadata().getFetchTimeoutSeconds()))
                    .header("Authorization", "Bearer " + openrouter.getApiKey())
                    .header("Accept", "application/json")
                    .GET();
            if (openrouter.getHttpReferer() != null && !openrouter.getHttpReferer().isBlank()) {
                builder.header("HTTP-Referer", openrouter.getHttpReferer());
            }
            if (openrouter.getXTitle() != null && !openrouter.getXTitle().isBlank()) {
                builder.header("X-Title", openrouter.getXTitle());
            }

            var response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw new ModelMetadataException("Models API GET %s failed (HTTP %d)"
                        .formatted(url, response.statusCode()));
            }
            Map<String, ModelMetadata> models = parse(response.body(), Instant.now());
            log.info("Fetched model listing: {} model(s)", models.size());
            return models;
        } catch (IOException e) {
            throw new ModelMetadataException("Models API request failed: GET " + url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelMetadataException("Models API request interrupted: GET " + url, e);
        }
    }

    Map<String, ModelMetadata> parse(String body, Instant fetchedAt) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new ModelMetadataException("Models API returned invalid JSON", e);
        }
        JsonNode data = root.path("data");
        if (!data.isArray()) {
            throw new ModelMetadataException("Models API response has no 'data' array");
        }

        var models = new LinkedHashMap<String, ModelMetadata>();
        for (JsonNode item : data) {
            String id = item.path("id").asText("");
            if (id.isBlank()) continue;

            Integer contextLength = positiveInt(item.get("context_length"));
            JsonNode topProvider = item.path("top_provider");
            Integer providerContext = positiveInt(topProvider.get("context_length"));
            Integer maxCompletion = positiveInt(topProvider.get("max_completion_tokens"));

            Integer effective = contextLength;
            if (effective == null) {
                effective = providerContext;
            } else if (providerContext != null) {
                effective = Math.min(effective, providerContext);
            }
            if (effective == null) {
                log.debug("Skipping model '{}' without a context length", id);
                continue;
            }

            List<String> params = new ArrayList<>();
            for (JsonNode p : item.path("supported_parameters")) {
                params.add(p.asText());
            }
            models.put(id, new ModelMetadata(id, effective, params.contains("tools"), maxCompletion,
                    params, fetchedAt));
        }
        return models;
    }

    private static Integer positiveInt(JsonNode node) {
        if (node == null || node.isNull() || !node.canConvertToInt()) return null;
        int value = node.asInt();
        return value > 0 ? value : null;
    }
}
