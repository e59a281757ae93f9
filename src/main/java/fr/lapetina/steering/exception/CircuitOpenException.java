package fr.lapetina.steering.exception;

import fr.lapetina.steering.domain.model.ErrorType;

/**
 * Thrown when a call is rejected because its breaker is open.
 */
public final class CircuitOpenException extends SteeringException {

    private final String breakerName;

    public CircuitOpenException(String breakerName) {
        super(ErrorType.CIRCUIT_OPEN, "Circuit breaker is open: " + breakerName);
        this.breakerName = breakerName;
    }

    public String getBreakerName() {
        return breakerName;
    }
}
