package fr.lapetina.steering.breaker;

/**
 * A unit of work guarded by a breaker, allowed to throw a checked exception.
 *
 * @param <T> result type
 * @param <E> checked exception the work may throw
 */
@FunctionalInterface
public interface CheckedCall<T, E extends Exception> {

    T call() throws E;
}
