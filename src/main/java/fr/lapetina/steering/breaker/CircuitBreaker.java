package fr.lapetina.steering.breaker;

import fr.lapetina.steering.exception.CircuitOpenException;
import fr.lapetina.steering.exception.TooManyRequestsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * Circuit breaker guarding calls to one named dependency.
 *
 * States:
 * - CLOSED: Calls pass through. Trips to OPEN when the configured trip rule matches.
 *   If an interval is configured, counts reset every interval without changing state.
 * - OPEN: Calls are rejected with {@link CircuitOpenException}. The first time the breaker
 *   is consulted after the timeout it moves to HALF_OPEN (no background timer).
 * - HALF_OPEN: Up to maxRequests probes may be outstanding. successThreshold consecutive
 *   successes close the breaker, any failure reopens it.
 *
 * Every transition or rollover starts a new generation. An outcome reported for an admission
 * made in an older generation is discarded.
 *
 * Thread-safe: state, generation, counts and expiry are guarded by one read-write lock,
 * held only while bookkeeping, never while the wrapped call runs.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final BreakerConfig config;
    private final Clock clock;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private State state = State.CLOSED;
    private long generation;
    private Counts counts = Counts.ZERO;
    private Instant expiry;
    private volatile StateChangeListener stateChangeListener;

    public CircuitBreaker(String name, BreakerConfig config, Clock clock) {
        this.name = Objects.requireNonNull(name, "Breaker name is required");
        this.config = config != null ? config : BreakerConfig.defaults();
        this.clock = Objects.requireNonNull(clock, "clock");
        toNewGeneration(clock.instant());
    }

    public CircuitBreaker(String name, BreakerConfig config) {
        this(name, config, Clock.systemUTC());
    }

    public CircuitBreaker(String name) {
        this(name, BreakerConfig.defaults());
    }

    /**
     * Runs the call if the breaker admits it.
     * Any exception or error thrown by the call is recorded as a failure and rethrown as is.
     *
     * @throws CircuitOpenException if the breaker is open
     * @throws TooManyRequestsException if the breaker is half-open and its probe limit is reached
     */
    public <T, E extends Exception> T execute(CheckedCall<T, E> call) throws E {
        return execute(call, result -> true);
    }

    /**
     * Runs the call if the breaker admits it, classifying a returned result with {@code isSuccessful}.
     * Thrown exceptions are always failures.
     */
    public <T, E extends Exception> T execute(CheckedCall<T, E> call, Predicate<? super T> isSuccessful) throws E {
        Objects.requireNonNull(call, "call");
        long admittedIn = beforeRequest();
        boolean success = false;
        try {
            T result = call.call();
            success = isSuccessful.test(result);
            return result;
        } finally {
            afterRequest(admittedIn, success);
        }
    }

    /**
     * Runs work without a result. Same admission and classification rules as {@link #execute(CheckedCall)}.
     */
    public <E extends Exception> void call(CheckedRunnable<E> work) throws E {
        Objects.requireNonNull(work, "work");
        execute(() -> {
            work.run();
            return null;
        });
    }

    /**
     * Admission check. Returns the generation the admission belongs to.
     */
    long beforeRequest() {
        lock.writeLock().lock();
        try {
            State current = currentState(clock.instant());
            if (current == State.OPEN) {
                log.debug("Call rejected, circuit open: name={}", name);
                throw new CircuitOpenException(name);
            }
            if (current == State.HALF_OPEN && counts.outstanding() >= config.getMaxRequests()) {
                log.debug("Call rejected, half-open probe limit reached: name={}, outstanding={}",
                        name, counts.outstanding());
                throw new TooManyRequestsException(name, TooManyRequestsException.Reason.HALF_OPEN_LIMIT);
            }
            counts = counts.onRequest();
            return generation;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Records the outcome of a call admitted in {@code admittedIn}.
     */
    void afterRequest(long admittedIn, boolean success) {
        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            State current = currentState(now);
            if (generation != admittedIn) {
                log.debug("Discarding stale outcome: name={}, admittedIn={}, generation={}",
                        name, admittedIn, generation);
                return;
            }
            if (success) {
                onSuccess(current, now);
            } else {
                onFailure(current, now);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void onSuccess(State current, Instant now) {
        counts = counts.onSuccess();
        if (current == State.HALF_OPEN && counts.consecutiveSuccesses() >= config.getSuccessThreshold()) {
            setState(State.CLOSED, now);
        }
    }

    private void onFailure(State current, Instant now) {
        counts = counts.onFailure();
        if (current == State.CLOSED && config.readyToTrip(counts)) {
            log.warn("Circuit breaker tripped: name={}, consecutiveFailures={}, failures={}/{}",
                    name, counts.consecutiveFailures(), counts.totalFailures(), counts.requests());
            setState(State.OPEN, now);
        } else if (current == State.HALF_OPEN) {
            setState(State.OPEN, now);
        }
    }

    // Applies the lazy transitions. Caller holds the write lock.
    private State currentState(Instant now) {
        if (state == State.CLOSED) {
            if (expiry != null && expiry.isBefore(now)) {
                toNewGeneration(now);
            }
        } else if (state == State.OPEN) {
            if (expiry.isBefore(now)) {
                setState(State.HALF_OPEN, now);
            }
        }
        return state;
    }

    private void setState(State newState, Instant now) {
        if (state == newState) {
            return;
        }
        State previous = state;
        state = newState;
        toNewGeneration(now);

        if (newState == State.OPEN) {
            log.warn("Circuit breaker OPENED: name={}, from={}", name, previous.label());
        } else {
            log.info("Circuit breaker state changed: name={}, {} -> {}", name, previous.label(), newState.label());
        }

        StateChangeListener listener = stateChangeListener;
        if (listener != null) {
            try {
                listener.onStateChange(name, previous, newState);
            } catch (RuntimeException e) {
                log.error("Error notifying state change listener: name={}", name, e);
            }
        }
    }

    private void toNewGeneration(Instant now) {
        generation++;
        counts = Counts.ZERO;
        switch (state) {
            case CLOSED -> expiry = config.getInterval().isZero() ? null : now.plus(config.getInterval());
            case OPEN -> expiry = now.plus(config.getTimeout());
            default -> expiry = null;
        }
    }

    /**
     * Forces the breaker back to CLOSED with fresh counts. For admin use.
     */
    public void reset() {
        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            if (state == State.CLOSED) {
                toNewGeneration(now);
            } else {
                setState(State.CLOSED, now);
            }
            log.info("Circuit breaker reset: name={}", name);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void setStateChangeListener(StateChangeListener listener) {
        this.stateChangeListener = listener;
    }

    public String getName() {
        return name;
    }

    public BreakerConfig getConfig() {
        return config;
    }

    /**
     * Current state, after applying any pending timeout or window rollover.
     */
    public State getState() {
        lock.writeLock().lock();
        try {
            return currentState(clock.instant());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Counts getCounts() {
        lock.readLock().lock();
        try {
            return counts;
        } finally {
            lock.readLock().unlock();
        }
    }

    public long getGeneration() {
        lock.readLock().lock();
        try {
            return generation;
        } finally {
            lock.readLock().unlock();
        }
    }

    public BreakerSnapshot snapshot() {
        lock.writeLock().lock();
        try {
            State current = currentState(clock.instant());
            return new BreakerSnapshot(name, current, generation, counts, expiry, config);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public String toString() {
        lock.readLock().lock();
        try {
            return "CircuitBreaker{" +
                    "name='" + name + '\'' +
                    ", state=" + state.label() +
                    ", generation=" + generation +
                    ", counts=" + counts +
                    '}';
        } finally {
            lock.readLock().unlock();
        }
    }
}
