/**
 * Load balancing strategies for picking one instance out of a candidate list.
 *
 * <p>All implementations are thread-safe and never modify the caller's list.
 *
 * <h2>Available Strategies</h2>
 * <table border="1">
 *   <tr><th>Strategy</th><th>Description</th><th>Best For</th></tr>
 *   <tr><td>{@code round-robin}</td><td>Cycles through candidates in order</td><td>Homogeneous instances</td></tr>
 *   <tr><td>{@code weighted-round-robin}</td><td>Cycles through weight-expanded slots</td><td>Heterogeneous capacities</td></tr>
 *   <tr><td>{@code least-connections}</td><td>Fewest active connections</td><td>Variable response times</td></tr>
 *   <tr><td>{@code random}</td><td>Uniform random pick</td><td>Simple, low overhead</td></tr>
 *   <tr><td>{@code weighted-random}</td><td>Random pick proportional to weight</td><td>Heterogeneous capacities, no shared cursor</td></tr>
 *   <tr><td>{@code consistent-hash}</td><td>Hash ring with virtual nodes</td><td>Key affinity with minimal remapping</td></tr>
 *   <tr><td>{@code source-hash}</td><td>Key hash modulo candidate count</td><td>Cheap affinity on a stable pool</td></tr>
 * </table>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * LoadBalancingStrategy strategy = StrategyFactory.create("consistent-hash", Map.of(), ids -> Map.of()).orElseThrow();
 * Optional<ServiceInstance> instance = strategy.select(candidates, "user-42");
 * }</pre>
 *
 * @see fr.lapetina.steering.domain.strategy.LoadBalancingStrategy
 * @see fr.lapetina.steering.domain.strategy.StrategyFactory
 */
package fr.lapetina.steering.domain.strategy;
