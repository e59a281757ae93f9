package fr.lapetina.steering.breaker;

import fr.lapetina.steering.exception.SteeringException;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Breaker decorator splitting admission from outcome recording.
 *
 * For callback-shaped or asynchronous work: {@link #allow()} admits the call and hands back a
 * {@link Completion} that the caller invokes whenever the outcome is known.
 */
public final class TwoStepCircuitBreaker {

    private final CircuitBreaker delegate;

    public TwoStepCircuitBreaker(CircuitBreaker delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    /**
     * Admits one call.
     *
     * @return the completion to report the outcome through
     * @throws fr.lapetina.steering.exception.CircuitOpenException if the breaker is open
     * @throws fr.lapetina.steering.exception.TooManyRequestsException if the half-open probe limit is reached
     */
    public Completion allow() {
        long admittedIn = delegate.beforeRequest();
        AtomicBoolean reported = new AtomicBoolean(false);
        return success -> {
            // only the first report counts
            if (reported.compareAndSet(false, true)) {
                delegate.afterRequest(admittedIn, success);
            }
        };
    }

    /**
     * Runs asynchronous work under the breaker. The outcome is recorded when the stage completes:
     * normal completion is a success, exceptional completion a failure.
     * A rejection yields an already failed future instead of throwing.
     */
    public <T> CompletableFuture<T> executeAsync(Supplier<? extends CompletionStage<T>> work) {
        Objects.requireNonNull(work, "work");
        Completion completion;
        try {
            completion = allow();
        } catch (SteeringException e) {
            return CompletableFuture.failedFuture(e);
        }

        CompletionStage<T> stage;
        try {
            stage = Objects.requireNonNull(work.get(), "stage");
        } catch (RuntimeException | Error e) {
            completion.failure();
            throw e;
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        stage.whenComplete((value, error) -> {
            completion.done(error == null);
            if (error != null) {
                result.completeExceptionally(error);
            } else {
                result.complete(value);
            }
        });
        return result;
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

    /**
     * Outcome callback of one admitted call.
     */
    @FunctionalInterface
    public interface Completion {

        void done(boolean success);

        default void success() {
            done(true);
        }

        default void failure() {
            done(false);
        }
    }
}
