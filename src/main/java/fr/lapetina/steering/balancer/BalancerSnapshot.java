package fr.lapetina.steering.balancer;

import fr.lapetina.steering.domain.model.InstanceStats;

import java.util.Map;

/**
 * Read-only view of the load balancer: active algorithm, per-algorithm statistics
 * and per-instance usage.
 */
public record BalancerSnapshot(
        String algorithm,
        boolean healthCheckEnabled,
        boolean statsEnabled,
        Map<String, Map<String, Object>> strategies,
        Map<String, InstanceStats> instances
) {
}
