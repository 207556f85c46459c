package com.lad.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for reviewer execution.
 */
@Service
public class ReviewMetrics {

    private final MeterRegistry registry;

    public ReviewMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordReviewer(String role, String status, long ms) {
        Timer.builder("lad.reviewer.duration")
                .tag("role", role)
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordToolCall(String tool, String outcome) {
        Counter.builder("lad.tool.calls")
                .tag("tool", tool)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordToolCallsPerReview(int count) {
        DistributionSummary.builder("lad.tool.calls.per.review")
                .register(registry)
                .record(count);
    }

    public void recordSynthesis(String outcome) {
        Counter.builder("lad.synthesis.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordMetadataFetch(String result) {
        Counter.builder("lad.metadata.fetches")
                .tag("result", result)
                .register(registry)
                .increment();
    }
}
