package fr.lapetina.steering.domain.strategy;

import fr.lapetina.steering.domain.model.ServiceInstance;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Least connections load balancing strategy.
 *
 * Selects the candidate with the fewest active connections recorded by the load balancer.
 * Ties go to the candidate seen first; instances without statistics count as zero.
 */
public final class LeastConnectionsStrategy implements LoadBalancingStrategy {

    private final ConnectionCountSource connectionCounts;

    public LeastConnectionsStrategy(ConnectionCountSource connectionCounts) {
        this.connectionCounts = Objects.requireNonNull(connectionCounts, "connectionCounts");
    }

    @Override
    public String getName() {
        return Algorithm.LEAST_CONNECTIONS.configName();
    }

    @Override
    public Optional<ServiceInstance> select(List<ServiceInstance> candidates, String routingKey) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        List<String> ids = new ArrayList<>(candidates.size());
        for (ServiceInstance candidate : candidates) {
            ids.add(candidate.getId());
        }
        Map<String, Long> active = connectionCounts.activeConnections(ids);

        ServiceInstance selected = null;
        long minConnections = Long.MAX_VALUE;

        for (ServiceInstance candidate : candidates) {
            long connections = active.getOrDefault(candidate.getId(), 0L);
            if (connections < minConnections) {
                minConnections = connections;
                selected = candidate;
            }
        }

        return Optional.ofNullable(selected);
    }
}
