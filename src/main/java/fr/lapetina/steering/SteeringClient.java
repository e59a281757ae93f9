package fr.lapetina.steering;

import fr.lapetina.steering.balancer.LoadBalancerManager;
import fr.lapetina.steering.breaker.BulkheadCircuitBreaker;
import fr.lapetina.steering.breaker.CheckedCall;
import fr.lapetina.steering.breaker.CircuitBreaker;
import fr.lapetina.steering.breaker.CircuitBreakerManager;
import fr.lapetina.steering.domain.model.ServiceInstance;
import fr.lapetina.steering.exception.SteeringException;
import fr.lapetina.steering.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.steering.infrastructure.registry.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Outbound call path: breaker admission, instance lookup, selection, then the work itself.
 *
 * <p>One breaker guards each service name. The breaker only sees the outcome of the work:
 * a service without eligible instances fails its call, and that failure counts against
 * the service's breaker like any other.
 */
public final class SteeringClient {

    private static final Logger log = LoggerFactory.getLogger(SteeringClient.class);

    private final ServiceRegistry registry;
    private final LoadBalancerManager loadBalancer;
    private final CircuitBreakerManager breakers;
    private final MetricsRegistry metrics;
    private final boolean breakersEnabled;
    private final int bulkheadMaxConcurrent;
    private final Clock clock;
    private final Map<String, BulkheadCircuitBreaker> bulkheads = new ConcurrentHashMap<>();

    private SteeringClient(Builder builder) {
        this.registry = Objects.requireNonNull(builder.registry, "registry");
        this.loadBalancer = Objects.requireNonNull(builder.loadBalancer, "loadBalancer");
        this.breakers = Objects.requireNonNull(builder.breakers, "breakers");
        this.metrics = builder.metrics;
        this.breakersEnabled = builder.breakersEnabled;
        this.bulkheadMaxConcurrent = builder.bulkheadMaxConcurrent;
        this.clock = Objects.requireNonNull(builder.clock, "clock");
        if (bulkheadMaxConcurrent < 0) {
            throw new IllegalArgumentException("bulkheadMaxConcurrent must be >= 0");
        }
    }

    /**
     * Picks an instance of a service without running any work through its breaker.
     *
     * @throws fr.lapetina.steering.exception.NoHealthyInstancesException if no instance is eligible
     */
    public ServiceInstance discover(String serviceName, String routingKey) {
        Objects.requireNonNull(serviceName, "serviceName");
        try {
            return selectInstance(serviceName, routingKey);
        } catch (SteeringException e) {
            recordError(serviceName, e);
            throw e;
        }
    }

    /**
     * Runs {@code work} against an instance of {@code serviceName}, guarded by the service's breaker.
     * Whatever the work throws is rethrown unchanged.
     */
    public <T, E extends Exception> T call(String serviceName, String routingKey, InstanceCall<T, E> work) throws E {
        Objects.requireNonNull(serviceName, "serviceName");
        Objects.requireNonNull(work, "work");
        CheckedCall<T, E> guarded = () -> invoke(serviceName, routingKey, work);
        try {
            if (!breakersEnabled) {
                return guarded.call();
            }
            if (bulkheadMaxConcurrent > 0) {
                return bulkheadFor(serviceName).execute(guarded);
            }
            return breakers.getBreaker(serviceName).execute(guarded);
        } catch (SteeringException e) {
            recordError(serviceName, e);
            throw e;
        }
    }

    private <T, E extends Exception> T invoke(String serviceName, String routingKey, InstanceCall<T, E> work) throws E {
        ServiceInstance instance = selectInstance(serviceName, routingKey);
        String id = instance.getId();
        loadBalancer.updateStats(id, s -> s.withActiveConnections(s.activeConnections() + 1));
        Instant start = clock.instant();
        boolean success = false;
        try {
            T result = work.call(instance);
            success = true;
            return result;
        } finally {
            Duration elapsed = Duration.between(start, clock.instant());
            boolean failed = !success;
            loadBalancer.updateStats(id, s -> s
                    .withActiveConnections(Math.max(0, s.activeConnections() - 1))
                    .withFailedRequests(failed ? s.failedRequests() + 1 : s.failedRequests())
                    .withResponseTime(elapsed));
            if (failed) {
                log.debug("Call failed: service={}, instance={}, elapsedMs={}", serviceName, id, elapsed.toMillis());
            }
        }
    }

    private ServiceInstance selectInstance(String serviceName, String routingKey) {
        List<ServiceInstance> candidates = registry.listInstances(serviceName);
        ServiceInstance selected = loadBalancer.select(candidates, routingKey);
        if (metrics != null) {
            metrics.incrementSelectionCount(loadBalancer.getAlgorithm(), selected.getId());
        }
        return selected;
    }

    private BulkheadCircuitBreaker bulkheadFor(String serviceName) {
        CircuitBreaker current = breakers.getBreaker(serviceName);
        return bulkheads.compute(serviceName, (name, existing) ->
                existing != null && existing.getDelegate() == current
                        ? existing
                        : new BulkheadCircuitBreaker(current, bulkheadMaxConcurrent));
    }

    private void recordError(String serviceName, SteeringException e) {
        log.debug("Call rejected: service={}, type={}, message={}", serviceName, e.getErrorType(), e.getMessage());
        if (metrics != null) {
            metrics.incrementErrorCount(serviceName, e.getErrorType());
        }
    }

    /**
     * Breaker guarding a service, created on first use.
     */
    public CircuitBreaker breakerFor(String serviceName) {
        return breakers.getBreaker(serviceName);
    }

    public boolean isBreakersEnabled() {
        return breakersEnabled;
    }

    public int getBulkheadMaxConcurrent() {
        return bulkheadMaxConcurrent;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ServiceRegistry registry;
        private LoadBalancerManager loadBalancer;
        private CircuitBreakerManager breakers;
        private MetricsRegistry metrics;
        private boolean breakersEnabled = true;
        private int bulkheadMaxConcurrent;
        private Clock clock = Clock.systemUTC();

        public Builder registry(ServiceRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder loadBalancer(LoadBalancerManager loadBalancer) {
            this.loadBalancer = loadBalancer;
            return this;
        }

        public Builder breakers(CircuitBreakerManager breakers) {
            this.breakers = breakers;
            return this;
        }

        /**
         * Optional; metrics are skipped when absent.
         */
        public Builder metrics(MetricsRegistry metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder breakersEnabled(boolean breakersEnabled) {
            this.breakersEnabled = breakersEnabled;
            return this;
        }

        /**
         * Concurrent calls allowed per service; 0 disables the bulkhead.
         */
        public Builder bulkheadMaxConcurrent(int bulkheadMaxConcurrent) {
            this.bulkheadMaxConcurrent = bulkheadMaxConcurrent;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public SteeringClient build() {
            return new SteeringClient(this);
        }
    }
}
