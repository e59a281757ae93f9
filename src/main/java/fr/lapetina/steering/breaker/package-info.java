/**
 * Per-dependency circuit breakers.
 *
 * <p>{@link fr.lapetina.steering.breaker.CircuitBreaker} is the single state machine
 * (CLOSED, OPEN, HALF_OPEN). The other call shapes are decorators wrapping one breaker
 * instead of subclasses of it:
 *
 * <table border="1">
 *   <tr><th>Decorator</th><th>Adds</th></tr>
 *   <tr><td>{@link fr.lapetina.steering.breaker.TwoStepCircuitBreaker}</td><td>Admission and outcome reporting as two separate steps</td></tr>
 *   <tr><td>{@link fr.lapetina.steering.breaker.ResultCodeCircuitBreaker}</td><td>Failure classification by result code</td></tr>
 *   <tr><td>{@link fr.lapetina.steering.breaker.BulkheadCircuitBreaker}</td><td>Fail-fast cap on concurrent calls</td></tr>
 * </table>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * CircuitBreakerManager manager = new CircuitBreakerManager(BreakerConfig.defaults());
 * CircuitBreaker breaker = manager.getBreaker("billing");
 * Invoice invoice = breaker.execute(() -> billingClient.fetch(id));
 * }</pre>
 *
 * @see fr.lapetina.steering.breaker.CircuitBreakerManager
 */
package fr.lapetina.steering.breaker;
