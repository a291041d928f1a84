package io.ussopmm.ems.query.engine;

import java.time.Duration;

public class QueryTimeoutException extends RuntimeException {

    public QueryTimeoutException(Selector selector, Duration timeout, Throwable cause) {
        super("query for " + selector.kind().id() + " " + selector.value() + " did not complete within " + timeout, cause);
    }
}
