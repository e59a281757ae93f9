package fr.lapetina.steering.breaker;

/**
 * Circuit breaker states.
 *
 * CLOSED: Normal operation, calls pass through and outcomes are counted
 * HALF_OPEN: Cool-down elapsed, a limited number of probe calls are let through
 * OPEN: Too many failures, calls are rejected immediately
 */
public enum State {
    CLOSED("closed"),
    HALF_OPEN("half-open"),
    OPEN("open");

    private final String label;

    State(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
