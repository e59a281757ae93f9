/**
 * Instance selection: health filtering, strategy resolution and usage statistics.
 *
 * <p>{@link fr.lapetina.steering.balancer.LoadBalancerManager} is created once per process.
 * The statistics it keeps only grow and update; nothing is persisted.
 *
 * @see fr.lapetina.steering.domain.strategy
 */
package fr.lapetina.steering.balancer;
