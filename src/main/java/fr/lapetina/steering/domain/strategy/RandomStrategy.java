package fr.lapetina.steering.domain.strategy;

import fr.lapetina.steering.domain.model.ServiceInstance;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Random load balancing strategy.
 *
 * Uniformly picks one of the candidates. Simple but effective for
 * homogeneous pools with similar capacities.
 *
 * Thread-safe via ThreadLocalRandom.
 */
public final class RandomStrategy implements LoadBalancingStrategy {

    @Override
    public String getName() {
        return Algorithm.RANDOM.configName();
    }

    @Override
    public Optional<ServiceInstance> select(List<ServiceInstance> candidates, String routingKey) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        int index = ThreadLocalRandom.current().nextInt(candidates.size());
        return Optional.of(candidates.get(index));
    }
}
