package org.nostrtv.core.validation;

/**
 * Thrown when an event fails validation. The event must be discarded.
 */
public class EventValidationException extends Exception {

    private final ValidationError error;

    public EventValidationException(ValidationError error, String message) {
        super(error + ": " + message);
        this.error = error;
    }

    public ValidationError getError() {
        return error;
    }
}
