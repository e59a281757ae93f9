package fr.lapetina.steering.exception;

import fr.lapetina.steering.domain.model.ErrorType;

/**
 * Thrown when a call is rejected for lack of capacity.
 *
 * This occurs when:
 * - A half-open breaker already has its maximum number of probes outstanding
 * - A bulkhead has no free permit
 */
public final class TooManyRequestsException extends SteeringException {

    private final String breakerName;
    private final Reason reason;

    public TooManyRequestsException(String breakerName, Reason reason) {
        super(ErrorType.TOO_MANY_REQUESTS, "Too many requests: " + reason.getMessage() + " - " + breakerName);
        this.breakerName = breakerName;
        this.reason = reason;
    }

    public String getBreakerName() {
        return breakerName;
    }

    public Reason getReason() {
        return reason;
    }

    public enum Reason {
        HALF_OPEN_LIMIT("Half-open probe limit reached"),
        BULKHEAD_FULL("Bulkhead is saturated");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
