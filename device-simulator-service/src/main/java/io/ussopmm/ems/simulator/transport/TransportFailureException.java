package io.ussopmm.ems.simulator.transport;

/**
 * The broker connection failed or a publish was not acknowledged. Triggers a reconnect.
 */
public class TransportFailureException extends RuntimeException {

    public TransportFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
