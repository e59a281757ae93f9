package fr.lapetina.steering.breaker;

/**
 * Listener notified on every breaker state transition.
 *
 * Invoked synchronously while the breaker's lock is held: implementations must be
 * quick and must not call back into the same breaker.
 */
@FunctionalInterface
public interface StateChangeListener {

    void onStateChange(String name, State from, State to);
}
