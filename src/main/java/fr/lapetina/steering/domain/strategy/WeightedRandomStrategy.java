package fr.lapetina.steering.domain.strategy;

import fr.lapetina.steering.domain.model.ServiceInstance;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Weighted random load balancing strategy.
 *
 * Draws a number in [0, total weight) and walks the cumulative weights until the
 * running sum exceeds the draw. An instance with weight 3 is picked three times as
 * often as one with weight 1, on average.
 */
public final class WeightedRandomStrategy implements LoadBalancingStrategy {

    private final Map<String, Integer> weights;

    public WeightedRandomStrategy(Map<String, Integer> weights) {
        this.weights = weights == null ? Map.of() : Map.copyOf(weights);
    }

    public WeightedRandomStrategy() {
        this(Map.of());
    }

    @Override
    public String getName() {
        return Algorithm.WEIGHTED_RANDOM.configName();
    }

    @Override
    public Optional<ServiceInstance> select(List<ServiceInstance> candidates, String routingKey) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        long totalWeight = 0;
        for (ServiceInstance candidate : candidates) {
            totalWeight += Weights.weightOf(weights, candidate);
        }

        long draw = ThreadLocalRandom.current().nextLong(totalWeight);
        long cumulative = 0;

        for (ServiceInstance candidate : candidates) {
            cumulative += Weights.weightOf(weights, candidate);
            if (draw < cumulative) {
                return Optional.of(candidate);
            }
        }

        return Optional.of(candidates.get(candidates.size() - 1));
    }

    @Override
    public Map<String, Object> getStats() {
        return Map.of(
                "algorithm", getName(),
                "weights", weights
        );
    }
}
