package io.ussopmm.ems.simulator.helpers;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PublisherMetrics {

    private final MeterRegistry registry;

    public static final String M_READINGS_PUBLISHED = "ems_readings_published_total"; // counter
    public static final String M_READINGS_DROPPED   = "ems_readings_dropped_total";   // counter

    public void incPublished(String sensorType) {
        registry.counter(M_READINGS_PUBLISHED, Tags.of("sensor_type", sensorType)).increment();
    }

    /**
     * @param reason {@code disconnected} when no connection was up at the tick,
     *               {@code unacknowledged} when the publish itself failed
     */
    public void incDropped(String sensorType, String reason) {
        registry.counter(M_READINGS_DROPPED, Tags.of("sensor_type", sensorType, "reason", reason)).increment();
    }

}
