package fr.lapetina.steering.exception;

import fr.lapetina.steering.domain.model.ErrorType;

/**
 * Thrown when a load balancing algorithm name is unknown or not configured.
 */
public final class InvalidAlgorithmException extends SteeringException {

    private final String algorithm;

    public InvalidAlgorithmException(String algorithm) {
        super(ErrorType.INVALID_ALGORITHM, "Invalid load balancing algorithm: " + algorithm);
        this.algorithm = algorithm;
    }

    public String getAlgorithm() {
        return algorithm;
    }
}
