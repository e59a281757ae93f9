package fr.lapetina.steering.balancer;

import fr.lapetina.steering.domain.model.InstanceStats;
import fr.lapetina.steering.domain.strategy.ConnectionCountSource;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;

/**
 * Per-instance usage statistics, keyed by instance ID.
 *
 * Entries are created on first write and never expire. Absent entries read as
 * {@link InstanceStats#EMPTY}. Guarded by one read-write lock.
 */
final class InstanceStatsStore implements ConnectionCountSource {

    private final Map<String, InstanceStats> stats = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    InstanceStats get(String instanceId) {
        lock.readLock().lock();
        try {
            return stats.getOrDefault(instanceId, InstanceStats.EMPTY);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * All recorded entries, ordered by instance ID.
     */
    Map<String, InstanceStats> all() {
        lock.readLock().lock();
        try {
            return new TreeMap<>(stats);
        } finally {
            lock.readLock().unlock();
        }
    }

    void recordSelection(String instanceId, Instant when) {
        update(instanceId, current -> current.selectedAt(when));
    }

    /**
     * Copies the externally measured fields; request totals and last use stay as recorded.
     */
    void merge(String instanceId, InstanceStats measured) {
        Objects.requireNonNull(measured, "measured");
        update(instanceId, current -> current
                .withActiveConnections(measured.activeConnections())
                .withFailedRequests(measured.failedRequests())
                .withResponseTime(measured.responseTime()));
    }

    InstanceStats update(String instanceId, UnaryOperator<InstanceStats> change) {
        Objects.requireNonNull(instanceId, "instanceId");
        lock.writeLock().lock();
        try {
            InstanceStats updated = Objects.requireNonNull(
                    change.apply(stats.getOrDefault(instanceId, InstanceStats.EMPTY)),
                    "updated stats");
            stats.put(instanceId, updated);
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Map<String, Long> activeConnections(Collection<String> instanceIds) {
        lock.readLock().lock();
        try {
            Map<String, Long> result = new HashMap<>();
            for (String id : instanceIds) {
                InstanceStats entry = stats.get(id);
                if (entry != null) {
                    result.put(id, entry.activeConnections());
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    void clear() {
        lock.writeLock().lock();
        try {
            stats.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
