package io.ussopmm.ems.query.engine;

import java.time.Instant;

public class InvalidWindowException extends RuntimeException {

    public InvalidWindowException(Instant from, Instant to) {
        super("window start " + from + " is after its end " + to);
    }
}
