package io.ussopmm.ems.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One telemetry sample as it travels over the wire and as it is returned to query callers.
 *
 * @param deviceId      device that produced the sample
 * @param sensorType    sensor type id, see {@link SensorType#id()}
 * @param timestamp     ISO-8601 instant with second precision, e.g. {@code 2024-01-01T00:00:00Z}
 * @param values        numeric field values
 * @param schemaVersion payload schema version
 */
public record Reading(
        @JsonProperty("device_id") String deviceId,
        @JsonProperty("sensor_type") String sensorType,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("values") Map<String, Double> values,
        @JsonProperty("schema_version") int schemaVersion) {

    public static final int CURRENT_SCHEMA_VERSION = 1;

    public Reading {
        Objects.requireNonNull(deviceId, "deviceId");
        values = values == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
