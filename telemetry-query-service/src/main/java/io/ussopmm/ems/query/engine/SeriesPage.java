package io.ussopmm.ems.query.engine;

import io.ussopmm.ems.model.Reading;

import java.util.List;

/**
 * The part of a series that one store page contributed.
 *
 * @param readings     live readings of the page, ascending by ingest time
 * @param expiredCount records of the page left out because their TTL has elapsed
 */
public record SeriesPage(List<Reading> readings, long expiredCount) {

    public SeriesPage {
        readings = List.copyOf(readings);
    }
}
