package com.lad.core.llm;

import com.lad.core.metrics.ReviewMetrics;
import com.lad.core.model.ModelMetadata;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ModelCapabilityCacheTest {

    private static final Duration TTL = Duration.ofSeconds(3600);
    private static final Duration GRACE = Duration.ofSeconds(600);

    private ModelsApiClient client;
    private MutableClock clock;
    private ExecutorService fetchExecutor;
    private SimpleMeterRegistry registry;
    private ModelCapabilityCache cache;

    @BeforeEach
    void setUp() {
        client = mock(ModelsApiClient.class);
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        fetchExecutor = Executors.newCachedThreadPool();
        registry = new SimpleMeterRegistry();
        cache = new ModelCapabilityCache(client, fetchExecutor, TTL, GRACE, Duration.ofSeconds(5), clock,
                new ReviewMetrics(registry));
    }

    @AfterEach
    void tearDown() {
        fetchExecutor.shutdownNow();
    }

    private ModelMetadata metadata(String id, int context) {
        return new ModelMetadata(id, context, true, null, List.of("tools"), clock.instant());
    }

    @Test
    @DisplayName("Fresh entry is served without a second fetch")
    void freshEntryServedFromCache() {
        when(client.fetchAll()).thenAnswer(inv -> Map.of("m/a", metadata("m/a", 32000)));

        assertEquals(32000, cache.resolve("m/a").contextWindowTokens());
        clock.advance(Duration.ofSeconds(3599));
        assertEquals(32000, cache.resolve("m/a").contextWindowTokens());

        verify(client, times(1)).fetchAll();
    }

    @Test
    @DisplayName("Whole listing is stored, so other models hit the cache")
    void listingPopulatesAllModels() {
        when(client.fetchAll()).thenAnswer(inv -> Map.of(
                "m/a", metadata("m/a", 32000),
                "m/b", metadata("m/b", 128000)));

        cache.resolve("m/a");
        assertEquals(128000, cache.resolve("m/b").contextWindowTokens());

        verify(client, times(1)).fetchAll();
        assertEquals(2, cache.cachedEntries().size());
    }

    @Test
    @DisplayName("Expired entry triggers a refetch")
    void expiredEntryRefetched() {
        when(client.fetchAll())
                .thenAnswer(inv -> Map.of("m/a", metadata("m/a", 32000)))
                .thenAnswer(inv -> Map.of("m/a", metadata("m/a", 64000)));

        cache.resolve("m/a");
        clock.advance(TTL.plusSeconds(1));

        assertEquals(64000, cache.resolve("m/a").contextWindowTokens());
        verify(client, times(2)).fetchAll();
    }

    @Test
    @DisplayName("Concurrent callers for one model share a single fetch")
    void concurrentCallersShareOneFetch() throws Exception {
        var release = new CountDownLatch(1);
        when(client.fetchAll()).thenAnswer(inv -> {
            release.await(5, TimeUnit.SECONDS);
            return Map.of("m/a", metadata("m/a", 32000));
        });

        ExecutorService callers = Executors.newFixedThreadPool(8);
        try {
            List<Future<ModelMetadata>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(callers.submit(() -> cache.resolve("m/a")));
            }
            Thread.sleep(200);
            release.countDown();

            for (Future<ModelMetadata> result : results) {
                assertEquals(32000, result.get(5, TimeUnit.SECONDS).contextWindowTokens());
            }
        } finally {
            callers.shutdownNow();
        }
        verify(client, times(1)).fetchAll();
    }

    @Test
    @DisplayName("After TTL expiry concurrent callers share exactly one refetch")
    void concurrentCallersShareOneRefetch() throws Exception {
        var release = new CountDownLatch(1);
        when(client.fetchAll())
                .thenAnswer(inv -> Map.of("m/a", metadata("m/a", 32000)))
                .thenAnswer(inv -> {
                    release.await(5, TimeUnit.SECONDS);
                    return Map.of("m/a", metadata("m/a", 64000));
                });
        cache.resolve("m/a");
        clock.advance(TTL.plusSeconds(1));

        ExecutorService callers = Executors.newFixedThreadPool(8);
        try {
            var start = new CountDownLatch(1);
            List<Future<ModelMetadata>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(callers.submit(() -> {
                    start.await();
                    return cache.resolve("m/a");
                }));
            }
            start.countDown();
            Thread.sleep(200);
            release.countDown();

            for (Future<ModelMetadata> result : results) {
                assertEquals(64000, result.get(5, TimeUnit.SECONDS).contextWindowTokens());
            }
        } finally {
            callers.shutdownNow();
        }
        verify(client, times(2)).fetchAll();
    }

    @Test
    @DisplayName("Model dropped from a successful listing is evicted and gets no grace")
    void droppedModelGetsNoGrace() {
        when(client.fetchAll())
                .thenAnswer(inv -> Map.of("m/a", metadata("m/a", 32000)))
                .thenAnswer(inv -> Map.of("m/b", metadata("m/b", 64000)));

        cache.resolve("m/a");
        clock.advance(TTL.plusSeconds(100));

        var e = assertThrows(ModelMetadataException.class, () -> cache.resolve("m/a"));
        assertTrue(e.getMessage().contains("not found"));
        assertFalse(cache.cachedEntries().containsKey("m/a"));
        assertTrue(cache.cachedEntries().containsKey("m/b"));
        verify(client, times(2)).fetchAll();
    }

    @Test
    @DisplayName("Caller deadline shorter than the fetch timeout bounds the wait")
    void deadlineBoundsWait() {
        when(client.fetchAll()).thenAnswer(inv -> {
            Thread.sleep(3000);
            return Map.of("m/a", metadata("m/a", 32000));
        });

        long start = System.currentTimeMillis();
        assertThrows(MetadataTimeoutException.class,
                () -> cache.resolve("m/a", Instant.now().plusMillis(300)));

        assertTrue(System.currentTimeMillis() - start < 2000);
    }

    @Test
    @DisplayName("Elapsed deadline still serves a fresh cached entry")
    void elapsedDeadlineServesFreshEntry() {
        when(client.fetchAll()).thenAnswer(inv -> Map.of("m/a", metadata("m/a", 32000)));
        cache.resolve("m/a");

        assertEquals(32000, cache.resolve("m/a", Instant.now().minusSeconds(1)).contextWindowTokens());
    }

    @Test
    @DisplayName("Failed refetch serves the stale entry within the grace window")
    void staleEntryServedWithinGrace() {
        when(client.fetchAll())
                .thenAnswer(inv -> Map.of("m/a", metadata("m/a", 32000)))
                .thenThrow(new ModelMetadataException("HTTP 503"));

        cache.resolve("m/a");
        clock.advance(TTL.plusSeconds(60));

        assertEquals(32000, cache.resolve("m/a").contextWindowTokens());
        assertEquals(1.0, registry.counter("lad.metadata.fetches", "result", "failure").count());
    }

    @Test
    @DisplayName("Failed refetch beyond the grace window is MetadataUnavailable")
    void staleEntryRejectedBeyondGrace() {
        when(client.fetchAll())
                .thenAnswer(inv -> Map.of("m/a", metadata("m/a", 32000)))
                .thenThrow(new ModelMetadataException("HTTP 503"));

        cache.resolve("m/a");
        clock.advance(TTL.plus(GRACE).plusSeconds(1));

        assertThrows(ModelMetadataException.class, () -> cache.resolve("m/a"));
    }

    @Test
    @DisplayName("Model missing from the listing is MetadataUnavailable")
    void missingModelFails() {
        when(client.fetchAll()).thenAnswer(inv -> Map.of("m/a", metadata("m/a", 32000)));

        var e = assertThrows(ModelMetadataException.class, () -> cache.resolve("m/unknown"));
        assertTrue(e.getMessage().contains("not found"));
    }

    @Test
    @DisplayName("First fetch failure with nothing cached is MetadataUnavailable")
    void firstFetchFailureFails() {
        when(client.fetchAll()).thenThrow(new ModelMetadataException("connection refused"));

        var e = assertThrows(ModelMetadataException.class, () -> cache.resolve("m/a"));
        assertEquals("connection refused", e.getMessage());
    }

    static final class MutableClock extends Clock {

        private volatile Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
