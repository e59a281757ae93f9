package fr.lapetina.steering.domain.strategy;

import fr.lapetina.steering.domain.model.ServiceInstance;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Strategy interface for picking one instance out of a candidate list.
 *
 * Implementations must be thread-safe: the load balancer manager calls them from
 * any caller thread. The candidate list belongs to the caller and is never modified.
 */
public interface LoadBalancingStrategy {

    /**
     * Returns the name of this strategy for configuration and statistics.
     */
    String getName();

    /**
     * Selects an instance.
     *
     * @param candidates Instances eligible for this call, already filtered for health
     * @param routingKey Key for hash-based strategies, ignored by the others; null hashes as ""
     * @return Selected instance, or empty if there is no candidate
     */
    Optional<ServiceInstance> select(List<ServiceInstance> candidates, String routingKey);

    /**
     * Returns strategy-specific statistics for introspection.
     */
    default Map<String, Object> getStats() {
        return Map.of("algorithm", getName());
    }

    /**
     * Resets any internal state.
     */
    default void reset() {
        // Default no-op
    }
}
