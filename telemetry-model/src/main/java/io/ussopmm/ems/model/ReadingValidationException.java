package io.ussopmm.ems.model;

/**
 * An inbound payload that can never be stored. Not retryable.
 */
public class ReadingValidationException extends RuntimeException {

    public ReadingValidationException(String message) {
        super(message);
    }

    public ReadingValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
