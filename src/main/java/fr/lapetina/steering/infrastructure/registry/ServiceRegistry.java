package fr.lapetina.steering.infrastructure.registry;

import fr.lapetina.steering.domain.model.ServiceInstance;

import java.util.List;

/**
 * Source of candidate instances for a service name.
 *
 * Health is populated by an external prober; consumers only read it.
 */
@FunctionalInterface
public interface ServiceRegistry {

    /**
     * Lists the registered instances of a service, healthy or not, in a stable order.
     * Returns an empty list for an unknown service.
     */
    List<ServiceInstance> listInstances(String serviceName);
}
