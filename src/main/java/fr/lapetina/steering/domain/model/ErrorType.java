package fr.lapetina.steering.domain.model;

/**
 * Error taxonomy for admission and selection failures.
 * None of these are retried internally.
 */
public enum ErrorType {
    /** Breaker is open, the dependency is presumed unhealthy */
    CIRCUIT_OPEN,

    /** Half-open probe limit reached, or bulkhead saturated */
    TOO_MANY_REQUESTS,

    /** Candidate set is empty once unhealthy instances are filtered out */
    NO_HEALTHY_INSTANCES,

    /** Strategy name is unknown or not configured */
    INVALID_ALGORITHM
}
