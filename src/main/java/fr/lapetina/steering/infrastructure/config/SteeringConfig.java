package fr.lapetina.steering.infrastructure.config;

import fr.lapetina.steering.breaker.BreakerConfig;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration object for breakers and load balancing.
 * Designed to be populated from YAML.
 */
public class SteeringConfig {

    private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();
    private LoadBalancerConfig loadBalancer = new LoadBalancerConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public CircuitBreakerConfig getCircuitBreaker() { return circuitBreaker; }
    public void setCircuitBreaker(CircuitBreakerConfig circuitBreaker) { this.circuitBreaker = circuitBreaker; }

    public LoadBalancerConfig getLoadBalancer() { return loadBalancer; }
    public void setLoadBalancer(LoadBalancerConfig loadBalancer) { this.loadBalancer = loadBalancer; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Circuit breaker defaults, applied to every breaker created from this configuration.
     */
    public static class CircuitBreakerConfig {
        private boolean enabled = true;
        private int failureThreshold = 5;
        private int successThreshold = 3;
        private long timeoutMs = 60000;
        private int maxRequests = 1;
        private long intervalMs = 60000;
        private int minRequests = 3;
        private double failureRatio = 0.6;
        private int bulkheadMaxConcurrent = 0;
        private List<Integer> failureStatusCodes = new ArrayList<>(List.of(500, 502, 503, 504));

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public int getSuccessThreshold() { return successThreshold; }
        public void setSuccessThreshold(int successThreshold) { this.successThreshold = successThreshold; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public int getMaxRequests() { return maxRequests; }
        public void setMaxRequests(int maxRequests) { this.maxRequests = maxRequests; }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }

        public int getMinRequests() { return minRequests; }
        public void setMinRequests(int minRequests) { this.minRequests = minRequests; }

        public double getFailureRatio() { return failureRatio; }
        public void setFailureRatio(double failureRatio) { this.failureRatio = failureRatio; }

        public int getBulkheadMaxConcurrent() { return bulkheadMaxConcurrent; }
        public void setBulkheadMaxConcurrent(int bulkheadMaxConcurrent) { this.bulkheadMaxConcurrent = bulkheadMaxConcurrent; }

        public List<Integer> getFailureStatusCodes() { return failureStatusCodes; }
        public void setFailureStatusCodes(List<Integer> failureStatusCodes) { this.failureStatusCodes = failureStatusCodes; }

        /**
         * Converts this section into an immutable breaker config.
         *
         * @throws IllegalArgumentException if a value is out of range
         */
        public BreakerConfig toBreakerConfig() {
            return BreakerConfig.builder()
                    .failureThreshold(failureThreshold)
                    .successThreshold(successThreshold)
                    .timeout(Duration.ofMillis(timeoutMs))
                    .maxRequests(maxRequests)
                    .interval(Duration.ofMillis(intervalMs))
                    .minRequests(minRequests)
                    .failureRatio(failureRatio)
                    .build();
        }
    }

    /**
     * Load balancing configuration.
     */
    public static class LoadBalancerConfig {
        private String algorithm = "round-robin";
        private boolean healthCheckEnabled = true;
        private boolean statsEnabled = true;
        private Map<String, Integer> weights = new HashMap<>();

        public String getAlgorithm() { return algorithm; }
        public void setAlgorithm(String algorithm) { this.algorithm = algorithm; }

        public boolean isHealthCheckEnabled() { return healthCheckEnabled; }
        public void setHealthCheckEnabled(boolean healthCheckEnabled) { this.healthCheckEnabled = healthCheckEnabled; }

        public boolean isStatsEnabled() { return statsEnabled; }
        public void setStatsEnabled(boolean statsEnabled) { this.statsEnabled = statsEnabled; }

        public Map<String, Integer> getWeights() { return weights; }
        public void setWeights(Map<String, Integer> weights) { this.weights = weights; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "steering";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
