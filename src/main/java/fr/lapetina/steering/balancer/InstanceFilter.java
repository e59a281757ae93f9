package fr.lapetina.steering.balancer;

import fr.lapetina.steering.domain.model.ServiceInstance;

import java.util.List;

/**
 * Removes instances that must not receive traffic before a strategy selects among the rest.
 */
@FunctionalInterface
public interface InstanceFilter {

    /**
     * Returns the eligible instances in their original order. Never modifies the input.
     */
    List<ServiceInstance> filter(List<ServiceInstance> instances);
}
