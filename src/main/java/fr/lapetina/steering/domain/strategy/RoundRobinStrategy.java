package fr.lapetina.steering.domain.strategy;

import fr.lapetina.steering.domain.model.ServiceInstance;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Simple round-robin load balancing strategy.
 *
 * Cycles through the candidates in the order the caller supplies them, so callers
 * must keep that order stable for the rotation to be fair.
 *
 * Thread-safe via atomic counter.
 */
public final class RoundRobinStrategy implements LoadBalancingStrategy {

    private final AtomicLong counter = new AtomicLong(0);

    @Override
    public String getName() {
        return Algorithm.ROUND_ROBIN.configName();
    }

    @Override
    public Optional<ServiceInstance> select(List<ServiceInstance> candidates, String routingKey) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        int index = (int) Math.floorMod(counter.getAndIncrement(), (long) candidates.size());
        return Optional.of(candidates.get(index));
    }

    @Override
    public Map<String, Object> getStats() {
        return Map.of(
                "algorithm", getName(),
                "counter", counter.get()
        );
    }

    @Override
    public void reset() {
        counter.set(0);
    }
}
