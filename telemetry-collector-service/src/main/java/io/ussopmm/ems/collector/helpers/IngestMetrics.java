package io.ussopmm.ems.collector.helpers;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class IngestMetrics {

    private final MeterRegistry registry;

    public static final String M_INGEST_STORED = "ems_ingest_stored_total"; // counter
    public static final String M_INGEST_ERRORS = "ems_ingest_errors_total"; // counter

    public void incStored(String partition) {
        Counter counter = registry.counter(
                M_INGEST_STORED,
                Tags.of("partition", partition));
        counter.increment();
    }

    public void incError(String partition, String cause) {
        Counter counter = registry.counter(
                M_INGEST_ERRORS,
                Tags.of("partition", partition, "cause", cause));
        counter.increment();
    }

}
