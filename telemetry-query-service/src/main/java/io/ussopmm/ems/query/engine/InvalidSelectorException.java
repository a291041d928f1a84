package io.ussopmm.ems.query.engine;

public class InvalidSelectorException extends RuntimeException {

    public InvalidSelectorException(String message) {
        super(message);
    }
}
