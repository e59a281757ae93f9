package fr.lapetina.steering.domain.strategy;

import fr.lapetina.steering.domain.model.ServiceInstance;

import java.util.Map;

/**
 * Static per-instance weights. Missing and non-positive weights count as 1.
 */
final class Weights {

    private Weights() {
        // Utility class
    }

    static int weightOf(Map<String, Integer> weights, ServiceInstance instance) {
        Integer weight = weights.get(instance.getId());
        return weight == null || weight <= 0 ? 1 : weight;
    }
}
