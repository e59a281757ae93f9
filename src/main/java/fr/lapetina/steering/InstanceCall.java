package fr.lapetina.steering;

import fr.lapetina.steering.domain.model.ServiceInstance;

/**
 * Work performed against the instance chosen by the load balancer.
 *
 * @param <T> result type
 * @param <E> checked exception the work may throw
 */
@FunctionalInterface
public interface InstanceCall<T, E extends Exception> {

    T call(ServiceInstance instance) throws E;
}
