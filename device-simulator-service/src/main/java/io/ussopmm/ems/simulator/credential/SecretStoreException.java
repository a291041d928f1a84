package io.ussopmm.ems.simulator.credential;

public class SecretStoreException extends RuntimeException {

    public SecretStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
