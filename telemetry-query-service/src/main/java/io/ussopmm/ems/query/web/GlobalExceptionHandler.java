package io.ussopmm.ems.query.web;

import io.ussopmm.ems.query.engine.InvalidSelectorException;
import io.ussopmm.ems.query.engine.InvalidWindowException;
import io.ussopmm.ems.query.engine.QueryTimeoutException;
import io.ussopmm.ems.store.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

/**
 * Renders query failures without internal detail, so that callers can tell a failed query from
 * an empty one.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({InvalidWindowException.class, InvalidSelectorException.class})
    public Mono<ResponseEntity<ErrorResponse>> handleInvalidQuery(RuntimeException ex, ServerWebExchange exchange) {
        log.warn("Rejected query {}: {}", exchange.getRequest().getURI().getQuery(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleBadInput(ServerWebInputException ex) {
        log.warn("Malformed query parameters: {}", ex.getReason());
        return respond(HttpStatus.BAD_REQUEST, ex.getReason());
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleStoreUnavailable(StoreUnavailableException ex) {
        log.error("Store unavailable while querying", ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Reading store is unavailable");
    }

    @ExceptionHandler(QueryTimeoutException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleTimeout(QueryTimeoutException ex) {
        log.warn(ex.getMessage());
        return respond(HttpStatus.GATEWAY_TIMEOUT, "Query timed out");
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(Exception ex) {
        log.error("Unexpected query failure", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
    }

    private static Mono<ResponseEntity<ErrorResponse>> respond(HttpStatus status, String message) {
        return Mono.just(ResponseEntity.status(status)
                .body(ErrorResponse.of(status.value(), status.getReasonPhrase(), message)));
    }
}
