package io.ussopmm.ems.simulator.credential;

/**
 * No configured source produced a usable credential. Retryable.
 */
public class CredentialUnavailableException extends RuntimeException {

    public CredentialUnavailableException(String message) {
        super(message);
    }

    public CredentialUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
