package fr.lapetina.llm.verifier.infrastructure.notification;

import fr.lapetina.llm.verifier.domain.model.ErrorType;

/**
 * Thrown by a channel when a notification could not be delivered.
 * Never retried by the dispatcher.
 */
public class DeliveryException extends Exception {

    private final ErrorType errorType;

    public DeliveryException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public DeliveryException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
