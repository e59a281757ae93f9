package fr.lapetina.steering.balancer;

import fr.lapetina.steering.domain.model.InstanceStats;
import fr.lapetina.steering.domain.model.ServiceInstance;
import fr.lapetina.steering.domain.strategy.Algorithm;
import fr.lapetina.steering.domain.strategy.LoadBalancingStrategy;
import fr.lapetina.steering.domain.strategy.StrategyFactory;
import fr.lapetina.steering.exception.InvalidAlgorithmException;
import fr.lapetina.steering.exception.NoHealthyInstancesException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Entry point for instance selection.
 *
 * Filters the candidates, resolves the active strategy (configured globally, overridable per
 * call), delegates the pick and records the selection against the winner. Owns the shared
 * per-instance statistics that least connections reads.
 */
public final class LoadBalancerManager {

    private static final Logger log = LoggerFactory.getLogger(LoadBalancerManager.class);

    private final Map<Algorithm, LoadBalancingStrategy> strategies;
    private final Map<Algorithm, AtomicLong> selections = new EnumMap<>(Algorithm.class);
    private final InstanceStatsStore stats = new InstanceStatsStore();
    private final AtomicReference<String> algorithm;
    private final InstanceFilter filter;
    private final boolean healthCheckEnabled;
    private final boolean statsEnabled;
    private final Map<String, Integer> weights;
    private final Clock clock;

    private LoadBalancerManager(Builder builder) {
        this.algorithm = new AtomicReference<>(builder.algorithm);
        this.healthCheckEnabled = builder.healthCheckEnabled;
        this.statsEnabled = builder.statsEnabled;
        this.weights = Map.copyOf(builder.weights);
        this.filter = builder.filter != null ? builder.filter : new HealthyInstanceFilter(healthCheckEnabled);
        this.clock = Objects.requireNonNull(builder.clock, "clock");
        this.strategies = StrategyFactory.createAll(weights, stats);
        for (Algorithm each : Algorithm.values()) {
            selections.put(each, new AtomicLong());
        }
        log.info("LoadBalancerManager initialized: algorithm={}, healthCheck={}, stats={}, weights={}",
                builder.algorithm, healthCheckEnabled, statsEnabled, weights.size());
    }

    /**
     * Selects an instance with the active algorithm.
     *
     * @throws NoHealthyInstancesException if no candidate survives the filter
     * @throws InvalidAlgorithmException if the active algorithm is unknown
     */
    public ServiceInstance select(List<ServiceInstance> candidates, String routingKey) {
        return select(candidates, routingKey, null);
    }

    /**
     * Selects an instance, using {@code algorithmOverride} instead of the active algorithm when non-null.
     */
    public ServiceInstance select(List<ServiceInstance> candidates, String routingKey, String algorithmOverride) {
        if (candidates == null || candidates.isEmpty()) {
            throw new NoHealthyInstancesException();
        }

        List<ServiceInstance> eligible = filter.filter(candidates);
        if (eligible.isEmpty()) {
            log.debug("No eligible instance: candidates={}", candidates.size());
            throw new NoHealthyInstancesException();
        }

        String name = algorithmOverride != null ? algorithmOverride : algorithm.get();
        Algorithm resolved = Algorithm.fromName(name).orElseThrow(() -> new InvalidAlgorithmException(name));

        ServiceInstance selected = strategies.get(resolved)
                .select(eligible, routingKey)
                .orElseThrow(NoHealthyInstancesException::new);

        selections.get(resolved).incrementAndGet();
        if (statsEnabled) {
            stats.recordSelection(selected.getId(), clock.instant());
        }

        log.debug("Instance selected: algorithm={}, instance={}, eligible={}",
                resolved.configName(), selected.getId(), eligible.size());
        return selected;
    }

    /**
     * Switches the active algorithm at runtime.
     *
     * @throws InvalidAlgorithmException if the name is unknown; the active algorithm is then unchanged
     */
    public void setAlgorithm(String name) {
        Algorithm resolved = Algorithm.fromName(name).orElseThrow(() -> new InvalidAlgorithmException(name));
        String previous = algorithm.getAndSet(resolved.configName());
        log.info("Load balancing algorithm changed from {} to {}", previous, resolved.configName());
    }

    public String getAlgorithm() {
        return algorithm.get();
    }

    /**
     * Records externally measured usage: active connections, failed requests and response time.
     * Request totals and last use are maintained by {@link #select}. No-op when stats are disabled.
     */
    public void updateStats(String instanceId, InstanceStats measured) {
        if (!statsEnabled) {
            return;
        }
        stats.merge(instanceId, measured);
    }

    /**
     * Atomically applies {@code change} to the statistics of one instance.
     * No-op when stats are disabled.
     */
    public void updateStats(String instanceId, UnaryOperator<InstanceStats> change) {
        if (!statsEnabled) {
            return;
        }
        stats.update(instanceId, change);
    }

    public InstanceStats getInstanceStats(String instanceId) {
        return stats.get(instanceId);
    }

    public Map<String, InstanceStats> getAllInstanceStats() {
        return stats.all();
    }

    /**
     * Per-algorithm statistics, keyed by configuration name.
     */
    public Map<String, Map<String, Object>> getStrategyStats() {
        Map<String, Map<String, Object>> result = new LinkedHashMap<>();
        for (Map.Entry<Algorithm, LoadBalancingStrategy> entry : strategies.entrySet()) {
            Map<String, Object> strategyStats = new HashMap<>(entry.getValue().getStats());
            strategyStats.put("selections", selections.get(entry.getKey()).get());
            result.put(entry.getKey().configName(), strategyStats);
        }
        return result;
    }

    public BalancerSnapshot snapshot() {
        return new BalancerSnapshot(
                algorithm.get(),
                healthCheckEnabled,
                statsEnabled,
                getStrategyStats(),
                getAllInstanceStats()
        );
    }

    /**
     * Clears statistics and strategy state. For testing/admin use.
     */
    public void reset() {
        stats.clear();
        strategies.values().forEach(LoadBalancingStrategy::reset);
        selections.values().forEach(counter -> counter.set(0));
        log.info("Load balancer state reset");
    }

    public boolean isHealthCheckEnabled() {
        return healthCheckEnabled;
    }

    public boolean isStatsEnabled() {
        return statsEnabled;
    }

    public Map<String, Integer> getWeights() {
        return weights;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String algorithm = Algorithm.ROUND_ROBIN.configName();
        private boolean healthCheckEnabled = true;
        private boolean statsEnabled = true;
        private final Map<String, Integer> weights = new HashMap<>();
        private InstanceFilter filter;
        private Clock clock = Clock.systemUTC();

        public Builder algorithm(String algorithm) {
            this.algorithm = algorithm;
            return this;
        }

        public Builder algorithm(Algorithm algorithm) {
            this.algorithm = algorithm.configName();
            return this;
        }

        public Builder healthCheckEnabled(boolean healthCheckEnabled) {
            this.healthCheckEnabled = healthCheckEnabled;
            return this;
        }

        public Builder statsEnabled(boolean statsEnabled) {
            this.statsEnabled = statsEnabled;
            return this;
        }

        public Builder weight(String instanceId, int weight) {
            this.weights.put(instanceId, weight);
            return this;
        }

        public Builder weights(Map<String, Integer> weights) {
            if (weights != null) {
                this.weights.putAll(weights);
            }
            return this;
        }

        /**
         * Replaces the default health filter.
         */
        public Builder filter(InstanceFilter filter) {
            this.filter = filter;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public LoadBalancerManager build() {
            return new LoadBalancerManager(this);
        }
    }
}
