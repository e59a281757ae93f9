package fr.lapetina.steering;

import fr.lapetina.steering.balancer.LoadBalancerManager;
import fr.lapetina.steering.breaker.BreakerConfig;
import fr.lapetina.steering.breaker.BulkheadCircuitBreaker;
import fr.lapetina.steering.breaker.CircuitBreaker;
import fr.lapetina.steering.breaker.CircuitBreakerManager;
import fr.lapetina.steering.breaker.ResultCodeCircuitBreaker;
import fr.lapetina.steering.breaker.TwoStepCircuitBreaker;
import fr.lapetina.steering.exception.InvalidAlgorithmException;
import fr.lapetina.steering.infrastructure.config.ConfigLoader;
import fr.lapetina.steering.infrastructure.config.SteeringConfig;
import fr.lapetina.steering.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.steering.infrastructure.registry.ServiceRegistry;
import fr.lapetina.steering.infrastructure.status.StatusReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Factory wiring breakers, load balancer, metrics and client from configuration.
 * This is the primary entry point for obtaining a configured {@link SteeringClient}.
 *
 * <p>Usage:
 * <pre>{@code
 * try (SteeringFactory factory = SteeringFactory.create("steering.yaml", registry)) {
 *     SteeringClient client = factory.getClient();
 *     String body = client.call("billing", userId, instance -> http.get(instance.hostPort()));
 * }
 * }</pre>
 */
public class SteeringFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SteeringFactory.class);

    private final ConfigLoader configLoader;
    private final SteeringConfig config;
    private final MetricsRegistry metricsRegistry;
    private final CircuitBreakerManager breakerManager;
    private final LoadBalancerManager loadBalancer;
    private final SteeringClient client;
    private final StatusReporter statusReporter;
    private final Clock clock;

    protected SteeringFactory(String configPath, ServiceRegistry registry, Clock clock) {
        log.info("Initializing SteeringFactory from config: {}", configPath);
        Objects.requireNonNull(registry, "registry");
        this.clock = Objects.requireNonNull(clock, "clock");

        // Load configuration
        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();

        // Initialize metrics
        this.metricsRegistry = config.getMetrics().isEnabled()
                ? new MetricsRegistry(config.getMetrics().getPrefix())
                : null;

        // Breakers
        BreakerConfig breakerDefaults = config.getCircuitBreaker().toBreakerConfig();
        this.breakerManager = new CircuitBreakerManager(breakerDefaults, clock);
        if (metricsRegistry != null) {
            breakerManager.addListener(metricsRegistry::recordStateTransition);
            metricsRegistry.registerBreakerStates(breakerManager::countByState);
        }

        // Load balancer
        SteeringConfig.LoadBalancerConfig lbConfig = config.getLoadBalancer();
        this.loadBalancer = LoadBalancerManager.builder()
                .algorithm(lbConfig.getAlgorithm())
                .healthCheckEnabled(lbConfig.isHealthCheckEnabled())
                .statsEnabled(lbConfig.isStatsEnabled())
                .weights(lbConfig.getWeights())
                .clock(clock)
                .build();

        this.client = SteeringClient.builder()
                .registry(registry)
                .loadBalancer(loadBalancer)
                .breakers(breakerManager)
                .metrics(metricsRegistry)
                .breakersEnabled(config.getCircuitBreaker().isEnabled())
                .bulkheadMaxConcurrent(config.getCircuitBreaker().getBulkheadMaxConcurrent())
                .clock(clock)
                .build();

        this.statusReporter = new StatusReporter(breakerManager, loadBalancer);

        // Register config change listener
        configLoader.addListener(this::onConfigChanged);

        log.info("SteeringFactory initialized: algorithm={}, breakersEnabled={}, metricsEnabled={}",
                loadBalancer.getAlgorithm(), config.getCircuitBreaker().isEnabled(), metricsRegistry != null);
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static SteeringFactory create(String configPath, ServiceRegistry registry) {
        return new SteeringFactory(configPath, registry, Clock.systemUTC());
    }

    /**
     * Creates a factory driven by the given clock. For testing.
     */
    public static SteeringFactory create(String configPath, ServiceRegistry registry, Clock clock) {
        return new SteeringFactory(configPath, registry, clock);
    }

    /**
     * Creates a factory from the default configuration (steering.yaml).
     */
    public static SteeringFactory createDefault(ServiceRegistry registry) {
        return create(ConfigLoader.DEFAULT_RESOURCE, registry);
    }

    private void onConfigChanged(SteeringConfig oldConfig, SteeringConfig newConfig) {
        if (oldConfig == null) {
            return;
        }
        String algorithm = newConfig.getLoadBalancer().getAlgorithm();
        if (!algorithm.equals(loadBalancer.getAlgorithm())) {
            try {
                loadBalancer.setAlgorithm(algorithm);
            } catch (InvalidAlgorithmException e) {
                log.warn("Ignoring reloaded algorithm {}: {}", algorithm, e.getMessage());
            }
        }
        log.info("Configuration reloaded");
    }

    /**
     * Reloads the configuration file and applies the runtime-switchable settings.
     */
    public SteeringConfig reload() {
        return configLoader.reload();
    }

    /**
     * Standalone two-step breaker using the configured defaults. Not registered in the manager.
     */
    public TwoStepCircuitBreaker newTwoStepBreaker(String name) {
        return new TwoStepCircuitBreaker(newStandaloneBreaker(name));
    }

    /**
     * Standalone result-code breaker classifying the configured status codes as failures.
     */
    public ResultCodeCircuitBreaker newResultCodeBreaker(String name) {
        return new ResultCodeCircuitBreaker(newStandaloneBreaker(name),
                config.getCircuitBreaker().getFailureStatusCodes());
    }

    /**
     * Bulkhead over the managed breaker of {@code name}.
     */
    public BulkheadCircuitBreaker newBulkheadBreaker(String name, int maxConcurrent) {
        return new BulkheadCircuitBreaker(breakerManager.getBreaker(name), maxConcurrent);
    }

    private CircuitBreaker newStandaloneBreaker(String name) {
        CircuitBreaker breaker = new CircuitBreaker(name, breakerManager.getDefaultConfig(), clock);
        if (metricsRegistry != null) {
            breaker.setStateChangeListener(metricsRegistry::recordStateTransition);
        }
        return breaker;
    }

    /**
     * Breaker and load balancer statistics as JSON.
     */
    public String statusJson() {
        return statusReporter.toJson();
    }

    public SteeringClient getClient() {
        return client;
    }

    public CircuitBreakerManager getBreakerManager() {
        return breakerManager;
    }

    public LoadBalancerManager getLoadBalancer() {
        return loadBalancer;
    }

    public Optional<MetricsRegistry> getMetricsRegistry() {
        return Optional.ofNullable(metricsRegistry);
    }

    public StatusReporter getStatusReporter() {
        return statusReporter;
    }

    public SteeringConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    @Override
    public void close() {
        log.info("Closing SteeringFactory");
        if (metricsRegistry != null) {
            metricsRegistry.close();
        }
        log.info("SteeringFactory closed");
    }
}
