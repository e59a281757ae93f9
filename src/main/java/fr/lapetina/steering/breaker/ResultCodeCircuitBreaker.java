package fr.lapetina.steering.breaker;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.function.ToIntFunction;

/**
 * Breaker decorator classifying outcomes by a result code, typically an HTTP status.
 *
 * A call whose code is in the failure set is recorded as a failure, yet its code is still
 * returned to the caller. An exception thrown by the call is recorded as a failure and rethrown.
 */
public final class ResultCodeCircuitBreaker {

    public static final Set<Integer> DEFAULT_FAILURE_CODES = Set.of(500, 502, 503, 504);

    private final CircuitBreaker delegate;
    private volatile Set<Integer> failureCodes;

    public ResultCodeCircuitBreaker(CircuitBreaker delegate) {
        this(delegate, DEFAULT_FAILURE_CODES);
    }

    public ResultCodeCircuitBreaker(CircuitBreaker delegate, Collection<Integer> failureCodes) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        setFailureCodes(failureCodes);
    }

    /**
     * Replaces the set of codes counted as failures.
     */
    public void setFailureCodes(Collection<Integer> codes) {
        Objects.requireNonNull(codes, "codes");
        this.failureCodes = Set.copyOf(codes);
    }

    public Set<Integer> getFailureCodes() {
        return failureCodes;
    }

    public boolean isFailureCode(int code) {
        return failureCodes.contains(code);
    }

    /**
     * Runs a call that answers with a result code.
     */
    public <E extends Exception> int executeWithCode(CheckedCall<Integer, E> call) throws E {
        Integer code = delegate.execute(call, c -> c != null && !isFailureCode(c));
        return code != null ? code : 0;
    }

    /**
     * Runs a call and classifies its result through the code extracted by {@code codeOf}.
     */
    public <T, E extends Exception> T execute(CheckedCall<T, E> call, ToIntFunction<? super T> codeOf) throws E {
        Objects.requireNonNull(codeOf, "codeOf");
        return delegate.execute(call, result -> !isFailureCode(codeOf.applyAsInt(result)));
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
