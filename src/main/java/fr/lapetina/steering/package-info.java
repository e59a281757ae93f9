/**
 * Traffic steering for outbound calls: per-service circuit breakers in front of a
 * multi-algorithm load balancer.
 *
 * <p>{@link fr.lapetina.steering.SteeringFactory} wires the pieces from YAML configuration;
 * {@link fr.lapetina.steering.SteeringClient} runs the call path.
 */
package fr.lapetina.steering;
