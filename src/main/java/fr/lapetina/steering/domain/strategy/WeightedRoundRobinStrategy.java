package fr.lapetina.steering.domain.strategy;

import fr.lapetina.steering.domain.model.ServiceInstance;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Weighted round-robin load balancing strategy.
 *
 * Distributes requests according to static instance weights. An instance with weight 2
 * receives twice as many requests as an instance with weight 1.
 *
 * Each instance owns {@code weight} consecutive slots out of the total weight. A rotating
 * cursor, taken modulo the total, is mapped to its owner by walking the cumulative weights,
 * so the distribution is exact over every full cycle.
 */
public final class WeightedRoundRobinStrategy implements LoadBalancingStrategy {

    private final Map<String, Integer> weights;
    private final AtomicLong cursor = new AtomicLong(0);

    public WeightedRoundRobinStrategy(Map<String, Integer> weights) {
        this.weights = weights == null ? Map.of() : Map.copyOf(weights);
    }

    public WeightedRoundRobinStrategy() {
        this(Map.of());
    }

    @Override
    public String getName() {
        return Algorithm.WEIGHTED_ROUND_ROBIN.configName();
    }

    @Override
    public Optional<ServiceInstance> select(List<ServiceInstance> candidates, String routingKey) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        long total = 0;
        for (ServiceInstance instance : candidates) {
            total += Weights.weightOf(weights, instance);
        }

        long slot = Math.floorMod(cursor.getAndIncrement(), total);
        for (ServiceInstance instance : candidates) {
            slot -= Weights.weightOf(weights, instance);
            if (slot < 0) {
                return Optional.of(instance);
            }
        }
        return Optional.of(candidates.get(candidates.size() - 1));
    }

    @Override
    public Map<String, Object> getStats() {
        return Map.of(
                "algorithm", getName(),
                "weights", weights,
                "cursor", cursor.get()
        );
    }

    @Override
    public void reset() {
        cursor.set(0);
    }
}
