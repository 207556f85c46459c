package com.lad.core.concurrency;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executors used by the review engine. Each concern gets its own pool so a slow tool
 * dispatch or metadata fetch never starves reviewer turns. All pools are created once
 * and shut down with the application context.
 */
@Configuration
public class ReviewExecutors {

    public static final String REVIEWER = "reviewerExecutor";
    public static final String INVOCATION = "invocationExecutor";
    public static final String TOOL = "toolExecutor";
    public static final String METADATA = "metadataExecutor";

    @Bean(name = REVIEWER, destroyMethod = "shutdownNow")
    public ExecutorService reviewerExecutor() {
        return Executors.newCachedThreadPool(named("lad-reviewer"));
    }

    @Bean(name = INVOCATION, destroyMethod = "shutdownNow")
    public ExecutorService invocationExecutor() {
        return Executors.newCachedThreadPool(named("lad-invocation"));
    }

    @Bean(name = TOOL, destroyMethod = "shutdownNow")
    public ExecutorService toolExecutor() {
        return Executors.newCachedThreadPool(named("lad-tool"));
    }

    @Bean(name = METADATA, destroyMethod = "shutdownNow")
    public ExecutorService metadataExecutor() {
        return Executors.newFixedThreadPool(2, named("lad-metadata"));
    }

    static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
