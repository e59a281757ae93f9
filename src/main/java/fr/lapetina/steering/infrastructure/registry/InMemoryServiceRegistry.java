package fr.lapetina.steering.infrastructure.registry;

import fr.lapetina.steering.domain.model.HealthStatus;
import fr.lapetina.steering.domain.model.ServiceInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory service registry.
 *
 * Thread-safe storage of instances keyed by ID. Listings are sorted by instance ID so that
 * order-sensitive strategies see the same sequence on every call.
 */
public final class InMemoryServiceRegistry implements ServiceRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryServiceRegistry.class);

    private final Map<String, ServiceInstance> instances = new ConcurrentHashMap<>();
    private final List<Consumer<RegistryEvent>> listeners = new CopyOnWriteArrayList<>();

    /**
     * Registers a new instance or replaces an existing one with the same ID.
     */
    public void register(ServiceInstance instance) {
        ServiceInstance previous = instances.put(instance.getId(), instance);
        if (previous == null) {
            log.info("Instance registered: {}", instance);
            notifyListeners(new RegistryEvent(RegistryEvent.Type.ADDED, instance));
        } else {
            log.info("Instance updated: {}", instance);
            notifyListeners(new RegistryEvent(RegistryEvent.Type.UPDATED, instance));
        }
    }

    /**
     * Removes an instance by ID.
     */
    public Optional<ServiceInstance> deregister(String instanceId) {
        ServiceInstance removed = instances.remove(instanceId);
        if (removed != null) {
            log.info("Instance deregistered: {}", removed);
            notifyListeners(new RegistryEvent(RegistryEvent.Type.REMOVED, removed));
        }
        return Optional.ofNullable(removed);
    }

    public Optional<ServiceInstance> getInstance(String instanceId) {
        return Optional.ofNullable(instances.get(instanceId));
    }

    @Override
    public List<ServiceInstance> listInstances(String serviceName) {
        List<ServiceInstance> result = new ArrayList<>();
        for (ServiceInstance instance : instances.values()) {
            if (instance.getServiceName().equals(serviceName)) {
                result.add(instance);
            }
        }
        result.sort(Comparator.comparing(ServiceInstance::getId));
        return result;
    }

    /**
     * Names of all services with at least one instance, sorted.
     */
    public List<String> listServiceNames() {
        TreeSet<String> names = new TreeSet<>();
        for (ServiceInstance instance : instances.values()) {
            names.add(instance.getServiceName());
        }
        return new ArrayList<>(names);
    }

    /**
     * Updates the health status of an instance, as the external prober would.
     *
     * @return false if the instance is unknown
     */
    public boolean updateHealth(String instanceId, HealthStatus health) {
        ServiceInstance current = instances.get(instanceId);
        if (current == null) {
            return false;
        }
        ServiceInstance updated = current.withHealth(health);
        if (updated != current && instances.replace(instanceId, current, updated)) {
            log.info("Instance health changed: instanceId={}, {} -> {}",
                    instanceId, current.getHealth().label(), health.label());
            notifyListeners(new RegistryEvent(RegistryEvent.Type.HEALTH_CHANGED, updated));
        }
        return true;
    }

    /**
     * Adds a listener for registry events.
     */
    public void addListener(Consumer<RegistryEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<RegistryEvent> listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(RegistryEvent event) {
        for (Consumer<RegistryEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.error("Error notifying listener", e);
            }
        }
    }

    public int size() {
        return instances.size();
    }

    /**
     * Event for registry changes.
     */
    public record RegistryEvent(Type type, ServiceInstance instance) {
        public enum Type {
            ADDED,
            REMOVED,
            UPDATED,
            HEALTH_CHANGED
        }
    }
}
