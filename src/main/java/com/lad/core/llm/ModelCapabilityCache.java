package com.lad.core.llm;

import com.lad.core.concurrency.ReviewExecutors;
import com.lad.core.config.LadProperties;
import com.lad.core.metrics.ReviewMetrics;
import com.lad.core.model.ModelMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * In-memory, time-bounded cache of model capabilities.
 * <p>
 * A miss or an expired entry triggers one fetch of the model listing; every model in the
 * listing is stored. Concurrent callers for the same model share a single in-flight fetch.
 * The fetch runs on its own executor and is never cancelled by a caller giving up, so its
 * result still lands in the cache for the next caller.
 * <p>
 * When a fetch fails, an expired entry is still served while it is within the grace window.
 * A successful listing that no longer contains a model evicts it; no grace applies then.
 */
@Component
public class ModelCapabilityCache {

    private static final Logger log = LoggerFactory.getLogger(ModelCapabilityCache.class);

    private final ModelsApiClient client;
    private final Executor fetchExecutor;
    private final Duration ttl;
    private final Duration grace;
    private final Duration fetchTimeout;
    private final Clock clock;
    private final ReviewMetrics metrics;

    private final Map<String, ModelMetadata> entries = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<ModelMetadata>> inFlight = new ConcurrentHashMap<>();

    @Autowired
    public ModelCapabilityCache(ModelsApiClient client,
                                LadProperties properties,
                                @Qualifier(ReviewExecutors.METADATA) Executor fetchExecutor,
                                ReviewMetrics metrics) {
        this(client, fetchExecutor,
                Duration.ofSeconds(properties.getMetadata().getTtlSeconds()),
                Duration.ofSeconds(properties.getMetadata().getGraceSeconds()),
                Duration.ofSeconds(properties.getMetadata().getFetchTimeoutSeconds()),
                Clock.systemUTC(), metrics);
    }

    /**
     * Package-private constructor for testing with a controllable clock and executor.
     */
    ModelCapabilityCache(ModelsApiClient client, Executor fetchExecutor, Duration ttl, Duration grace,
                         Duration fetchTimeout, Clock clock, ReviewMetrics metrics) {
        this.client = client;
        this.fetchExecutor = fetchExecutor;
        this.ttl = ttl;
        this.grace = grace;
        this.fetchTimeout = fetchTimeout;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Returns capabilities for {@code modelId}, fetching the listing when the entry is
     * missing or older than the TTL.
     *
     * @throws ModelMetadataException if no fresh or grace-window entry can be produced
     */
    public ModelMetadata resolve(String modelId) {
        return resolve(modelId, null);
    }

    /**
     * Same as {@link #resolve(String)}, but never waits past {@code deadline}.
     *
     * @throws MetadataTimeoutException if the deadline passes before the listing arrives
     */
    public ModelMetadata resolve(String modelId, Instant deadline) {
        ModelMetadata cached = entries.get(modelId);
        if (cached != null && isFresh(cached)) {
            return cached;
        }

        CompletableFuture<ModelMetadata> future = joinOrStartFetch(modelId);
        long waitMillis = fetchTimeout.toMillis();
        boolean deadlineBound = false;
        if (deadline != null) {
            long remaining = Math.max(0L, Duration.between(Instant.now(), deadline).toMillis());
            if (remaining < waitMillis) {
                waitMillis = remaining;
                deadlineBound = true;
            }
        }
        try {
            return future.get(waitMillis, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return fallback(modelId, cached, cause);
        } catch (TimeoutException e) {
            if (deadlineBound) {
                throw new MetadataTimeoutException(
                        "Deadline passed while fetching metadata for '" + modelId + "'");
            }
            return fallback(modelId, cached, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelMetadataException("Interrupted while resolving metadata for " + modelId, e);
        }
    }

    private CompletableFuture<ModelMetadata> joinOrStartFetch(String modelId) {
        CompletableFuture<ModelMetadata> mine = new CompletableFuture<>();
        CompletableFuture<ModelMetadata> existing = inFlight.putIfAbsent(modelId, mine);
        if (existing != null) {
            return existing;
        }

        // Another caller may have finished a fetch between our freshness check and putIfAbsent.
        ModelMetadata current = entries.get(modelId);
        if (current != null && isFresh(current)) {
            mine.complete(current);
            inFlight.remove(modelId, mine);
            return mine;
        }

        fetchExecutor.execute(() -> fetch(modelId, mine));
        return mine;
    }

    private void fetch(String modelId, CompletableFuture<ModelMetadata> target) {
        try {
            Map<String, ModelMetadata> listing = client.fetchAll();
            entries.keySet().retainAll(listing.keySet());
            entries.putAll(listing);
            metrics.recordMetadataFetch("success");
            ModelMetadata metadata = listing.get(modelId);
            if (metadata == null) {
                target.completeExceptionally(new ModelNotListedException(modelId));
            } else {
                target.complete(metadata);
            }
        } catch (RuntimeException e) {
            metrics.recordMetadataFetch("failure");
            log.warn("Model listing fetch failed for '{}': {}", modelId, e.getMessage());
            target.completeExceptionally(e);
        } finally {
            inFlight.remove(modelId, target);
        }
    }

    private ModelMetadata fallback(String modelId, ModelMetadata stale, Throwable cause) {
        if (stale != null && !(cause instanceof ModelNotListedException) && isWithinGrace(stale)) {
            log.warn("Serving cached metadata for '{}' fetched at {} ({})",
                    modelId, stale.fetchedAt(), cause.getMessage());
            return stale;
        }
        if (cause instanceof ModelMetadataException mme) {
            throw mme;
        }
        throw new ModelMetadataException("Metadata unavailable for '" + modelId + "': " + cause.getMessage(), cause);
    }

    private boolean isFresh(ModelMetadata metadata) {
        return clock.instant().isBefore(metadata.fetchedAt().plus(ttl));
    }

    private boolean isWithinGrace(ModelMetadata metadata) {
        return clock.instant().isBefore(metadata.fetchedAt().plus(ttl).plus(grace));
    }

    /**
     * Snapshot of the cached entries, for health reporting.
     */
    public Map<String, ModelMetadata> cachedEntries() {
        return Map.copyOf(entries);
    }

    /**
     * The listing was fetched successfully but does not contain the model.
     */
    private static final class ModelNotListedException extends ModelMetadataException {

        ModelNotListedException(String modelId) {
            super("Model '" + modelId + "' not found in model listing");
        }
    }
}
