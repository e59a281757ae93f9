package fr.lapetina.steering.breaker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registry owning one circuit breaker per dependency name.
 *
 * Breakers are created lazily on first request and live until removed. Creation is
 * check-then-create: a read-locked lookup, then a write-locked re-check so that concurrent
 * first requests for the same name construct exactly one breaker.
 *
 * State changes of every managed breaker are fanned out to the registered listeners.
 */
public final class CircuitBreakerManager {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerManager.class);

    private final Map<String, CircuitBreaker> breakers = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<StateChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final BreakerConfig defaultConfig;
    private final Clock clock;

    public CircuitBreakerManager(BreakerConfig defaultConfig, Clock clock) {
        this.defaultConfig = defaultConfig != null ? defaultConfig : BreakerConfig.defaults();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public CircuitBreakerManager(BreakerConfig defaultConfig) {
        this(defaultConfig, Clock.systemUTC());
    }

    public CircuitBreakerManager() {
        this(BreakerConfig.defaults());
    }

    /**
     * Returns the breaker for {@code name}, creating it with the default config if needed.
     */
    public CircuitBreaker getBreaker(String name) {
        return getBreaker(name, null);
    }

    /**
     * Returns the breaker for {@code name}, creating it with {@code config} if needed.
     * The config is ignored when the breaker already exists.
     */
    public CircuitBreaker getBreaker(String name, BreakerConfig config) {
        Objects.requireNonNull(name, "Breaker name is required");

        lock.readLock().lock();
        try {
            CircuitBreaker existing = breakers.get(name);
            if (existing != null) {
                return existing;
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            CircuitBreaker existing = breakers.get(name);
            if (existing != null) {
                return existing;
            }
            CircuitBreaker breaker = new CircuitBreaker(name, config != null ? config : defaultConfig, clock);
            breaker.setStateChangeListener(this::fireStateChange);
            breakers.put(name, breaker);
            log.info("Circuit breaker created: name={}, config={}", name, breaker.getConfig());
            return breaker;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<CircuitBreaker> findBreaker(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(breakers.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the names of all managed breakers, sorted.
     */
    public List<String> listBreakers() {
        lock.readLock().lock();
        try {
            List<String> names = new ArrayList<>(breakers.keySet());
            Collections.sort(names);
            return names;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Forgets a breaker. A later {@link #getBreaker(String)} creates a fresh one.
     *
     * @return true if a breaker was removed
     */
    public boolean removeBreaker(String name) {
        CircuitBreaker removed;
        lock.writeLock().lock();
        try {
            removed = breakers.remove(name);
        } finally {
            lock.writeLock().unlock();
        }
        if (removed != null) {
            removed.setStateChangeListener(null);
            log.info("Circuit breaker removed: name={}", name);
        }
        return removed != null;
    }

    /**
     * Forces one breaker back to CLOSED.
     *
     * @throws NoSuchElementException if no breaker has that name
     */
    public void reset(String name) {
        CircuitBreaker breaker = findBreaker(name)
                .orElseThrow(() -> new NoSuchElementException("Circuit breaker not found: " + name));
        breaker.reset();
    }

    public void resetAll() {
        for (CircuitBreaker breaker : snapshotBreakers()) {
            breaker.reset();
        }
    }

    /**
     * Snapshots of all breakers, keyed and ordered by name.
     */
    public Map<String, BreakerSnapshot> getStats() {
        Map<String, BreakerSnapshot> stats = new LinkedHashMap<>();
        for (CircuitBreaker breaker : snapshotBreakers()) {
            stats.put(breaker.getName(), breaker.snapshot());
        }
        return stats;
    }

    /**
     * Number of breakers in each state. Every state is present, possibly with zero.
     */
    public Map<State, Long> countByState() {
        Map<State, Long> counts = new EnumMap<>(State.class);
        for (State state : State.values()) {
            counts.put(state, 0L);
        }
        for (CircuitBreaker breaker : snapshotBreakers()) {
            counts.merge(breaker.getState(), 1L, Long::sum);
        }
        return counts;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return breakers.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public BreakerConfig getDefaultConfig() {
        return defaultConfig;
    }

    public void addListener(StateChangeListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(StateChangeListener listener) {
        listeners.remove(listener);
    }

    // Breakers are consulted outside the manager lock so that a breaker lock is never taken under it.
    private List<CircuitBreaker> snapshotBreakers() {
        lock.readLock().lock();
        try {
            List<CircuitBreaker> copy = new ArrayList<>(breakers.values());
            copy.sort((a, b) -> a.getName().compareTo(b.getName()));
            return copy;
        } finally {
            lock.readLock().unlock();
        }
    }

    private void fireStateChange(String name, State from, State to) {
        for (StateChangeListener listener : listeners) {
            try {
                listener.onStateChange(name, from, to);
            } catch (RuntimeException e) {
                log.error("Error notifying state change listener: name={}", name, e);
            }
        }
    }
}
