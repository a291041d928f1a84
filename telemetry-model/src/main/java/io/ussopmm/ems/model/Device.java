package io.ussopmm.ems.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Identity of a simulated field device. Built once from configuration.
 */
@Value
public class Device {
    @NonNull
    String deviceId;
    @NonNull
    SensorType sensorType;
}
