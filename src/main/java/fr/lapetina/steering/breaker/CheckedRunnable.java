package fr.lapetina.steering.breaker;

/**
 * A unit of work without a result, allowed to throw a checked exception.
 */
@FunctionalInterface
public interface CheckedRunnable<E extends Exception> {

    void run() throws E;
}
