package fr.lapetina.steering.domain.strategy;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Factory for the built-in load balancing strategies.
 *
 * Strategies that need collaborators get them from the arguments: static weights for the
 * weighted strategies, the connection count source for least connections.
 */
public final class StrategyFactory {

    private StrategyFactory() {
        // Utility class
    }

    /**
     * Creates one strategy.
     */
    public static LoadBalancingStrategy create(
            Algorithm algorithm,
            Map<String, Integer> weights,
            ConnectionCountSource connectionCounts
    ) {
        Objects.requireNonNull(algorithm, "algorithm");
        return switch (algorithm) {
            case ROUND_ROBIN -> new RoundRobinStrategy();
            case WEIGHTED_ROUND_ROBIN -> new WeightedRoundRobinStrategy(weights);
            case LEAST_CONNECTIONS -> new LeastConnectionsStrategy(connectionCounts);
            case RANDOM -> new RandomStrategy();
            case WEIGHTED_RANDOM -> new WeightedRandomStrategy(weights);
            case CONSISTENT_HASH -> new ConsistentHashStrategy();
            case SOURCE_HASH -> new SourceHashStrategy();
        };
    }

    /**
     * Creates a strategy by configuration name.
     *
     * @return Strategy instance, or empty if the name is unknown
     */
    public static Optional<LoadBalancingStrategy> create(
            String name,
            Map<String, Integer> weights,
            ConnectionCountSource connectionCounts
    ) {
        return Algorithm.fromName(name).map(algorithm -> create(algorithm, weights, connectionCounts));
    }

    /**
     * Creates one instance of every built-in strategy.
     */
    public static Map<Algorithm, LoadBalancingStrategy> createAll(
            Map<String, Integer> weights,
            ConnectionCountSource connectionCounts
    ) {
        Map<Algorithm, LoadBalancingStrategy> strategies = new EnumMap<>(Algorithm.class);
        for (Algorithm algorithm : Algorithm.values()) {
            strategies.put(algorithm, create(algorithm, weights, connectionCounts));
        }
        return strategies;
    }
}
