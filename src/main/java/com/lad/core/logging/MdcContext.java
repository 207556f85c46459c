package com.lad.core.logging;

import org.slf4j.MDC;

import java.util.Map;

/**
 * Utility for managing review-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRequest(String requestId, String reviewKind) {
        MDC.put("requestId", requestId);
        MDC.put("reviewKind", reviewKind);
    }

    public static void setReviewer(String reviewer, String model) {
        MDC.put("reviewer", reviewer);
        MDC.put("model", model);
    }

    /**
     * Copies the current context so it can be re-applied on another thread.
     */
    public static Map<String, String> snapshot() {
        Map<String, String> copy = MDC.getCopyOfContextMap();
        return copy != null ? copy : Map.of();
    }

    public static void restore(Map<String, String> snapshot) {
        snapshot.forEach(MDC::put);
    }

    public static void clearReviewer() {
        MDC.remove("reviewer");
        MDC.remove("model");
    }

    public static void clear() {
        MDC.remove("requestId");
        MDC.remove("reviewKind");
        MDC.remove("reviewer");
        MDC.remove("model");
    }
}
