package fr.lapetina.steering.domain.strategy;

import java.util.Collection;
import java.util.Map;

/**
 * Read access to the active connection counts kept by the load balancer.
 */
@FunctionalInterface
public interface ConnectionCountSource {

    /**
     * Returns a consistent view of the active connections of the given instances.
     * Instances without recorded statistics may be absent from the result.
     */
    Map<String, Long> activeConnections(Collection<String> instanceIds);
}
