package com.lad.core.concurrency;

import com.lad.core.config.LadProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Process-wide cap on outbound work: reviewer model calls, tool dispatches and synthesis
 * calls all pass through the same fair semaphore. A caller waits for a permit no longer
 * than its own deadline.
 */
@Component
public class AdmissionGate {

    private static final Logger log = LoggerFactory.getLogger(AdmissionGate.class);

    private final Semaphore permits;
    private final int capacity;

    @Autowired
    public AdmissionGate(LadProperties properties) {
        this(properties.getReviewers().getMaxConcurrentRequests());
    }

    public AdmissionGate(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        this.permits = new Semaphore(capacity, true);
    }

    /**
     * Runs {@code action} while holding one permit.
     *
     * @throws AdmissionTimeoutException if no permit became available before {@code deadline}
     * @throws InterruptedException      if the calling thread was interrupted while waiting
     */
    public <T> T withPermit(Instant deadline, Supplier<T> action) throws InterruptedException {
        long waitMillis = Math.max(0L, Duration.between(Instant.now(), deadline).toMillis());
        if (!permits.tryAcquire(waitMillis, TimeUnit.MILLISECONDS)) {
            log.debug("Admission wait expired after {}ms ({} of {} permits free)",
                    waitMillis, permits.availablePermits(), capacity);
            throw new AdmissionTimeoutException("Deadline reached while waiting for an admission permit");
        }
        try {
            return action.get();
        } finally {
            permits.release();
        }
    }

    public int availablePermits() {
        return permits.availablePermits();
    }

    public int capacity() {
        return capacity;
    }
}
