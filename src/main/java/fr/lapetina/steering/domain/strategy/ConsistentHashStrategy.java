package fr.lapetina.steering.domain.strategy;

import fr.lapetina.steering.domain.model.ServiceInstance;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Consistent hashing load balancing strategy.
 *
 * Every instance is placed on a hash ring {@value #VIRTUAL_NODES} times, at the CRC-32 of
 * {@code instanceId + ":" + i}. A routing key goes to the first ring entry whose hash is
 * greater than or equal to the key's hash, wrapping to the first entry past the end.
 * Adding one instance to K moves roughly 1/(K+1) of the keys.
 *
 * The ring is rebuilt from the candidates on every selection; rebuild and lookup happen
 * under one write lock.
 */
public final class ConsistentHashStrategy implements LoadBalancingStrategy {

    public static final int VIRTUAL_NODES = 100;
    private static final String SEPARATOR = ":";

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private long[] ringHashes = new long[0];
    private Map<Long, ServiceInstance> ring = new HashMap<>();

    @Override
    public String getName() {
        return Algorithm.CONSISTENT_HASH.configName();
    }

    @Override
    public Optional<ServiceInstance> select(List<ServiceInstance> candidates, String routingKey) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        lock.writeLock().lock();
        try {
            rebuildRing(candidates);

            long hash = Crc32.hash(routingKey);
            int index = Arrays.binarySearch(ringHashes, hash);
            if (index < 0) {
                index = -index - 1;
            }
            if (index == ringHashes.length) {
                index = 0;
            }
            return Optional.of(ring.get(ringHashes[index]));
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void rebuildRing(List<ServiceInstance> candidates) {
        Map<Long, ServiceInstance> newRing = new HashMap<>(candidates.size() * VIRTUAL_NODES * 2);

        for (ServiceInstance instance : candidates) {
            for (int i = 0; i < VIRTUAL_NODES; i++) {
                // on a collision the later instance owns the point
                newRing.put(Crc32.hash(instance.getId() + SEPARATOR + i), instance);
            }
        }

        long[] hashes = new long[newRing.size()];
        int i = 0;
        for (Long hash : newRing.keySet()) {
            hashes[i++] = hash;
        }
        Arrays.sort(hashes);

        this.ring = newRing;
        this.ringHashes = hashes;
    }

    @Override
    public Map<String, Object> getStats() {
        lock.readLock().lock();
        try {
            Set<String> instances = new HashSet<>();
            for (ServiceInstance instance : ring.values()) {
                instances.add(instance.getId());
            }
            return Map.of(
                    "algorithm", getName(),
                    "virtualNodes", ringHashes.length,
                    "instances", instances.size()
            );
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void reset() {
        lock.writeLock().lock();
        try {
            ring = new HashMap<>();
            ringHashes = new long[0];
        } finally {
            lock.writeLock().unlock();
        }
    }
}
