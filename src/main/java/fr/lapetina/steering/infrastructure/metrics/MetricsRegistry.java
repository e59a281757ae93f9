package fr.lapetina.steering.infrastructure.metrics;

import fr.lapetina.steering.breaker.State;
import fr.lapetina.steering.domain.model.ErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Breaker transition counters by breaker and edge
 * - Breakers-per-state gauges
 * - Error counters by service and type
 * - Selection counters by algorithm and instance
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> transitionCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> selectionCounters = new ConcurrentHashMap<>();

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("steering");
    }

    /**
     * Counts one breaker state transition.
     */
    public void recordStateTransition(String breaker, State from, State to) {
        String key = breaker + ":" + from.name() + ":" + to.name();
        transitionCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_breaker_transitions_total")
                        .description("Circuit breaker state transitions")
                        .tag("breaker", breaker)
                        .tag("from", from.label())
                        .tag("to", to.label())
                        .register(registry)
        ).increment();
    }

    /**
     * Registers one gauge per state reporting how many breakers are in it.
     */
    public void registerBreakerStates(Supplier<Map<State, Long>> countsByState) {
        for (State state : State.values()) {
            Gauge.builder(prefix + "_breakers", countsByState,
                            s -> s.get().getOrDefault(state, 0L).doubleValue())
                    .description("Number of circuit breakers per state")
                    .tag("state", state.label())
                    .strongReference(true)
                    .register(registry);
        }
    }

    /**
     * Increments the error counter of a service.
     */
    public void incrementErrorCount(String service, ErrorType errorType) {
        String key = service + ":" + errorType.name();
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Rejections and selection errors")
                        .tag("service", service)
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Increments the selection counter of an instance.
     */
    public void incrementSelectionCount(String algorithm, String instanceId) {
        String key = algorithm + ":" + instanceId;
        selectionCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_selections_total")
                        .description("Instances selected by the load balancer")
                        .tag("algorithm", algorithm)
                        .tag("instance", instanceId)
                        .register(registry)
        ).increment();
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
