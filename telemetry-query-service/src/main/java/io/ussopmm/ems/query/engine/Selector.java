package io.ussopmm.ems.query.engine;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * What a series is built from: one sensor type partition or one device.
 */
public record Selector(Kind kind, String value) {

    public enum Kind {
        SENSOR_TYPE("sensor_type"),
        DEVICE("device_id");

        private final String id;

        Kind(String id) {
            this.id = id;
        }

        @JsonValue
        public String id() {
            return id;
        }
    }

    public Selector {
        Objects.requireNonNull(kind, "kind");
        if (value == null || value.isBlank()) {
            throw new InvalidSelectorException("selector value is empty");
        }
    }

    public static Selector sensorType(String sensorType) {
        return new Selector(Kind.SENSOR_TYPE, sensorType);
    }

    public static Selector device(String deviceId) {
        return new Selector(Kind.DEVICE, deviceId);
    }

    /**
     * Builds a selector from request parameters; exactly one of them must be given.
     */
    public static Selector of(String sensorType, String deviceId) {
        boolean bySensor = sensorType != null && !sensorType.isBlank();
        boolean byDevice = deviceId != null && !deviceId.isBlank();
        if (bySensor == byDevice) {
            throw new InvalidSelectorException("exactly one of sensorType or deviceId is required");
        }
        return bySensor ? sensorType(sensorType) : device(deviceId);
    }
}
