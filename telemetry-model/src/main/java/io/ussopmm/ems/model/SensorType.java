package io.ussopmm.ems.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Device families of the energy monitoring installation. The id doubles as the storage
 * partition key and as the topic segment the device publishes under.
 */
public enum SensorType {

    BUILDING("building", List.of(
            new FieldProfile("building_total_energy_kwh", 1000, 2000, 25),
            new FieldProfile("building_demand_kw", 50, 150, 5))),
    HVAC("hvac", List.of(
            new FieldProfile("hvac_runtime_minutes", 0, 60, 5),
            new FieldProfile("hvac_power_kw", 0.5, 3.0, 0.2))),
    DHW("dhw", List.of(
            new FieldProfile("energy_consumption_kwh", 10, 50, 2),
            new FieldProfile("cycle_duration_minutes", 5, 30, 3))),
    LIGHTING("lighting", List.of(
            new FieldProfile("lighting_energy_kwh", 1, 5, 0.25))),
    OCCUPANCY("occupancy", List.of(
            new FieldProfile("activation_events", 0, 10, 2),
            new FieldProfile("battery_level", 20, 100, 1))),
    ENVIRONMENT("environment", List.of(
            new FieldProfile("ambient_temp", 65, 80, 0.5),
            new FieldProfile("humidity", 30, 60, 1.5))),
    NETWORK("network", List.of(
            new FieldProfile("latency_ms", 10, 100, 8),
            new FieldProfile("packet_loss_percent", 0, 5, 0.5))),
    APPLIANCE("appliance", List.of(
            new FieldProfile("appliance_energy_kwh", 1, 5, 0.25))),
    SPACE_TEMPERATURE("space_temperature", List.of(
            new FieldProfile("temperature_f", 65, 75, 0.5)));

    /** Partition holding diverted messages. Never a valid sensor type. */
    public static final String ERROR_PARTITION = "error";

    private final String id;
    private final List<FieldProfile> fields;

    SensorType(String id, List<FieldProfile> fields) {
        this.id = id;
        this.fields = fields;
    }

    public String id() {
        return id;
    }

    public List<FieldProfile> fields() {
        return fields;
    }

    public static Optional<SensorType> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(t -> t.id.equals(id))
                .findFirst();
    }

    @Override
    public String toString() {
        return id;
    }
}
