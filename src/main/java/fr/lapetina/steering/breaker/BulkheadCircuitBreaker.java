package fr.lapetina.steering.breaker;

import fr.lapetina.steering.exception.TooManyRequestsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Semaphore;

/**
 * Breaker decorator capping concurrent calls with a fixed number of permits.
 *
 * A permit is taken before the breaker is consulted. When none is free the call fails
 * immediately with {@link TooManyRequestsException} and the breaker is left untouched.
 * Calls never queue for a permit.
 */
public final class BulkheadCircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(BulkheadCircuitBreaker.class);

    private final CircuitBreaker delegate;
    private final Semaphore permits;
    private final int maxConcurrent;

    public BulkheadCircuitBreaker(CircuitBreaker delegate, int maxConcurrent) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be >= 1: " + maxConcurrent);
        }
        this.maxConcurrent = maxConcurrent;
        this.permits = new Semaphore(maxConcurrent);
    }

    /**
     * @throws TooManyRequestsException if the bulkhead is saturated or the half-open probe limit is reached
     * @throws fr.lapetina.steering.exception.CircuitOpenException if the breaker is open
     */
    public <T, E extends Exception> T execute(CheckedCall<T, E> call) throws E {
        if (!permits.tryAcquire()) {
            log.debug("Bulkhead saturated: name={}, maxConcurrent={}", delegate.getName(), maxConcurrent);
            throw new TooManyRequestsException(delegate.getName(), TooManyRequestsException.Reason.BULKHEAD_FULL);
        }
        try {
            return delegate.execute(call);
        } finally {
            permits.release();
        }
    }

    public <E extends Exception> void call(CheckedRunnable<E> work) throws E {
        Objects.requireNonNull(work, "work");
        execute(() -> {
            work.run();
            return null;
        });
    }

    public int getConcurrentRequests() {
        return maxConcurrent - permits.availablePermits();
    }

    public int getMaxConcurrentRequests() {
        return maxConcurrent;
    }

    public CircuitBreaker getDelegate() {
        return delegate;
    }

    public String getName() {
        return delegate.getName();
    }

    public State getState() {
        return delegate.getState();
    }
}
