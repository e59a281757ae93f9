package fr.lapetina.steering.breaker;

/**
 * Request and outcome counters of one breaker generation.
 * Reset to {@link #ZERO} at every generation rollover.
 */
public record Counts(
        long requests,
        long totalSuccesses,
        long totalFailures,
        long consecutiveSuccesses,
        long consecutiveFailures
) {

    public static final Counts ZERO = new Counts(0, 0, 0, 0, 0);

    Counts onRequest() {
        return new Counts(requests + 1, totalSuccesses, totalFailures, consecutiveSuccesses, consecutiveFailures);
    }

    Counts onSuccess() {
        return new Counts(requests, totalSuccesses + 1, totalFailures, consecutiveSuccesses + 1, 0);
    }

    Counts onFailure() {
        return new Counts(requests, totalSuccesses, totalFailures + 1, 0, consecutiveFailures + 1);
    }

    /**
     * Admitted calls whose outcome has not been recorded yet.
     */
    public long outstanding() {
        return requests - totalSuccesses - totalFailures;
    }

    public double failureRatio() {
        return requests == 0 ? 0.0 : (double) totalFailures / requests;
    }
}
