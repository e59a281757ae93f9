package fr.lapetina.steering.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Usage statistics of one instance, as seen by the load balancer.
 *
 * Immutable snapshot; the live values are owned by the load balancer manager.
 * {@code lastUsed} is null until the instance has been selected once.
 */
public record InstanceStats(
        long activeConnections,
        long totalRequests,
        long failedRequests,
        Duration responseTime,
        Instant lastUsed
) {

    public static final InstanceStats EMPTY = new InstanceStats(0, 0, 0, Duration.ZERO, null);

    public InstanceStats {
        Objects.requireNonNull(responseTime, "responseTime");
    }

    public InstanceStats withActiveConnections(long value) {
        return new InstanceStats(value, totalRequests, failedRequests, responseTime, lastUsed);
    }

    public InstanceStats withFailedRequests(long value) {
        return new InstanceStats(activeConnections, totalRequests, value, responseTime, lastUsed);
    }

    public InstanceStats withResponseTime(Duration value) {
        return new InstanceStats(activeConnections, totalRequests, failedRequests, value, lastUsed);
    }

    /**
     * Records one selection at the given instant.
     */
    public InstanceStats selectedAt(Instant when) {
        return new InstanceStats(activeConnections, totalRequests + 1, failedRequests, responseTime, when);
    }
}
