package io.ussopmm.ems.query.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.ussopmm.ems.query.engine.Selector;

import java.time.Instant;

/**
 * Last line of a series response. A stream that ends without it was cut off by a failure.
 */
public record SeriesSummary(
        @JsonProperty("selector") Selector selector,
        @JsonProperty("from") Instant from,
        @JsonProperty("to") Instant to,
        @JsonProperty("count") long count,
        @JsonProperty("expired_count") long expiredCount) {
}
