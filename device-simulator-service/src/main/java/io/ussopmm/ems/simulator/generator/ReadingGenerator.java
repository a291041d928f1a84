package io.ussopmm.ems.simulator.generator;

import io.ussopmm.ems.model.Device;
import io.ussopmm.ems.model.FieldProfile;
import io.ussopmm.ems.model.Reading;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Bounded random walk over the fields of one device: every call moves each field by at most its
 * {@link FieldProfile#maxStep()} and clamps it to the field's range. Deterministic for a given
 * seed, device id and clock. Not thread-safe; each device owns its generator.
 */
public class ReadingGenerator {

    private final Device device;
    private final Clock clock;
    private final Random random;
    private final List<FieldProfile> profiles;
    private final double[] current;

    public ReadingGenerator(Device device, long seed, Clock clock) {
        this.device = device;
        this.clock = clock;
        this.random = new Random(seed * 31 + device.getDeviceId().hashCode());
        this.profiles = device.getSensorType().fields();
        this.current = new double[profiles.size()];
        for (int i = 0; i < profiles.size(); i++) {
            FieldProfile profile = profiles.get(i);
            current[i] = profile.min() + random.nextDouble() * (profile.max() - profile.min());
        }
    }

    public Reading next() {
        Map<String, Double> values = new LinkedHashMap<>();
        for (int i = 0; i < profiles.size(); i++) {
            FieldProfile profile = profiles.get(i);
            double delta = (random.nextDouble() * 2 - 1) * profile.maxStep();
            current[i] = profile.clamp(current[i] + delta);
            values.put(profile.field(), current[i]);
        }
        String timestamp = clock.instant().truncatedTo(ChronoUnit.SECONDS).toString();
        return new Reading(device.getDeviceId(), device.getSensorType().id(), timestamp, values,
                Reading.CURRENT_SCHEMA_VERSION);
    }

    public Device device() {
        return device;
    }
}
