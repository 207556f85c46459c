package com.lad.core.health;

import com.lad.core.config.LadProperties;
import com.lad.core.llm.ModelCapabilityCache;
import com.lad.core.llm.ModelMetadataException;
import com.lad.core.model.ModelMetadata;
import com.lad.index.ProjectIndex;
import com.lad.index.ProjectIndexLocator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class HealthCheckServiceTest {

    private LadProperties properties;
    private ModelCapabilityCache cache;
    private ProjectIndexLocator locator;
    private HealthCheckService service;

    @BeforeEach
    void setUp() {
        properties = new LadProperties();
        properties.getOpenrouter().setApiKey("key");
        properties.getReviewers().setPrimaryModel("m/a");
        properties.getReviewers().setSecondaryModel("0");
        cache = mock(ModelCapabilityCache.class);
        locator = mock(ProjectIndexLocator.class);
        service = new HealthCheckService(properties, cache, locator);
    }

    @Test
    @DisplayName("Healthy setup reports every component in order")
    void allUp() throws Exception {
        when(cache.resolve("m/a")).thenReturn(new ModelMetadata("m/a", 32000, true, null, List.of("tools"), Instant.now()));
        ProjectIndex index = mock(ProjectIndex.class);
        when(index.describe()).thenReturn("filesystem");
        when(locator.locate(any())).thenReturn(ProjectIndexLocator.IndexLookup.found(index));

        List<HealthStatus> results = service.checkAll(Path.of("/tmp/project"));

        assertEquals(List.of("credentials", "primary", "secondary", "project-index"),
                results.stream().map(HealthStatus::component).toList());
        assertTrue(results.stream().allMatch(r -> r.status() == HealthStatus.Status.UP));
        assertEquals("m/a (context 32000 tokens, tools yes)", results.get(1).detail());
        assertEquals("Reviewer disabled by configuration", results.get(2).detail());
        assertEquals("Project index available (filesystem)", results.get(3).detail());
        verify(cache, never()).resolve("0");
    }

    @Test
    @DisplayName("Metadata failure is DOWN and a missing index is DEGRADED")
    void failures() throws Exception {
        properties.getOpenrouter().setApiKey("");
        when(cache.resolve("m/a")).thenThrow(new ModelMetadataException("Model not found: m/a"));
        when(locator.locate(any())).thenReturn(ProjectIndexLocator.IndexLookup.unavailable("No project root was provided."));

        List<HealthStatus> results = service.checkAll(null);

        assertEquals(HealthStatus.Status.DOWN, results.get(0).status());
        assertEquals(HealthStatus.Status.DOWN, results.get(1).status());
        assertEquals("Metadata unavailable: Model not found: m/a", results.get(1).detail());
        assertEquals(HealthStatus.Status.DEGRADED, results.get(3).status());
        assertEquals("Reviews will run without tools: No project root was provided.", results.get(3).detail());
    }
}
