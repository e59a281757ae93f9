package fr.lapetina.steering.domain.strategy;

import fr.lapetina.steering.domain.model.ServiceInstance;

import java.util.List;
import java.util.Optional;

/**
 * Source-key hashing load balancing strategy.
 *
 * Maps a routing key, typically the caller's address, to {@code crc32(key) mod n}.
 * Stateless and cheap, but any change in the candidate count remaps most keys;
 * use {@link ConsistentHashStrategy} when that matters.
 */
public final class SourceHashStrategy implements LoadBalancingStrategy {

    @Override
    public String getName() {
        return Algorithm.SOURCE_HASH.configName();
    }

    @Override
    public Optional<ServiceInstance> select(List<ServiceInstance> candidates, String routingKey) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        int index = (int) (Crc32.hash(routingKey) % candidates.size());
        return Optional.of(candidates.get(index));
    }
}
