package fr.lapetina.steering.exception;

import fr.lapetina.steering.domain.model.ErrorType;

/**
 * Thrown when no candidate instance is left to select from.
 */
public final class NoHealthyInstancesException extends SteeringException {

    public NoHealthyInstancesException() {
        super(ErrorType.NO_HEALTHY_INSTANCES, "No healthy instances available");
    }

    public NoHealthyInstancesException(String serviceName) {
        super(ErrorType.NO_HEALTHY_INSTANCES, "No healthy instances available for service: " + serviceName);
    }
}
