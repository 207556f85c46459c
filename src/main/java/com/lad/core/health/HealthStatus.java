package com.lad.core.health;

import java.util.List;
import java.util.Map;

/**
 * Result of one readiness check. DEGRADED means reviews still run, with reduced capability
 * (for example without project tools); only DOWN makes the service unhealthy.
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public enum Status { UP, DOWN, DEGRADED }

    public HealthStatus {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    static HealthStatus up(String component, String detail) {
        return new HealthStatus(component, Status.UP, detail, Map.of());
    }

    static HealthStatus down(String component, String detail) {
        return new HealthStatus(component, Status.DOWN, detail, Map.of());
    }

    static HealthStatus degraded(String component, String detail) {
        return new HealthStatus(component, Status.DEGRADED, detail, Map.of());
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }

    public static boolean anyDown(List<HealthStatus> checks) {
        return checks.stream().anyMatch(HealthStatus::isDown);
    }
}
