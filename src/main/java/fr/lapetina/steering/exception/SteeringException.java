package fr.lapetina.steering.exception;

import fr.lapetina.steering.domain.model.ErrorType;

/**
 * Base class for admission and selection errors raised by this library.
 *
 * Errors thrown by wrapped work are never converted into a SteeringException;
 * they reach the caller unchanged.
 */
public abstract class SteeringException extends RuntimeException {

    private final ErrorType errorType;

    protected SteeringException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
