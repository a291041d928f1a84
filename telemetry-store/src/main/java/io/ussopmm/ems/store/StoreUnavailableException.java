package io.ussopmm.ems.store;

/**
 * The store could not serve a request. Writes may be retried; reads surface it to the caller.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
