package io.ussopmm.ems.simulator.transport;

/**
 * The broker refused the presented credential.
 */
public class TransportAuthenticationException extends TransportFailureException {

    public TransportAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
