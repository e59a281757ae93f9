/**
 * Domain model shared by the breaker and load balancer layers.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.steering.domain.model.ServiceInstance} - Immutable backend instance listed by the registry</li>
 *   <li>{@link fr.lapetina.steering.domain.model.HealthStatus} - Probe result (PASSING, WARNING, CRITICAL)</li>
 *   <li>{@link fr.lapetina.steering.domain.model.InstanceStats} - Usage snapshot kept by the load balancer</li>
 *   <li>{@link fr.lapetina.steering.domain.model.ErrorType} - Categorized rejection and selection errors</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Everything in this package is immutable and can be shared freely between threads.
 */
package fr.lapetina.steering.domain.model;
