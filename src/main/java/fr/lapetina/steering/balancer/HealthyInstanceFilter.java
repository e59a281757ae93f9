package fr.lapetina.steering.balancer;

import fr.lapetina.steering.domain.model.ServiceInstance;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Keeps only instances whose health status is PASSING.
 * When health checking is disabled every non-null instance is kept.
 */
public final class HealthyInstanceFilter implements InstanceFilter {

    private final boolean healthCheckEnabled;

    public HealthyInstanceFilter(boolean healthCheckEnabled) {
        this.healthCheckEnabled = healthCheckEnabled;
    }

    @Override
    public List<ServiceInstance> filter(List<ServiceInstance> instances) {
        if (instances == null || instances.isEmpty()) {
            return List.of();
        }

        List<ServiceInstance> eligible = new ArrayList<>(instances.size());
        for (ServiceInstance instance : instances) {
            if (instance != null && (!healthCheckEnabled || instance.isPassing())) {
                eligible.add(instance);
            }
        }
        return eligible;
    }

    public boolean isHealthCheckEnabled() {
        return healthCheckEnabled;
    }

    @Override
    public String toString() {
        return "HealthyInstanceFilter{healthCheckEnabled=" + healthCheckEnabled + '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return healthCheckEnabled == ((HealthyInstanceFilter) o).healthCheckEnabled;
    }

    @Override
    public int hashCode() {
        return Objects.hash(healthCheckEnabled);
    }
}
