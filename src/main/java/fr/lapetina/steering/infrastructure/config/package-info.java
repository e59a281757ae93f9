/**
 * Configuration loading.
 *
 * <p>YAML is bound onto {@link fr.lapetina.steering.infrastructure.config.SteeringConfig} with SnakeYAML.
 * {@link fr.lapetina.steering.infrastructure.config.ConfigLoader#reload()} re-reads the source and
 * notifies {@link fr.lapetina.steering.infrastructure.config.ConfigChangeListener}s.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code circuitBreaker} - Breaker thresholds, timeouts, bulkhead size and failure status codes</li>
 *   <li>{@code loadBalancer} - Algorithm, health filtering, statistics and static weights</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 */
package fr.lapetina.steering.infrastructure.config;
