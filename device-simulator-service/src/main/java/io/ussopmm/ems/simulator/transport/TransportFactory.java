package io.ussopmm.ems.simulator.transport;

import io.ussopmm.ems.model.Device;

@FunctionalInterface
public interface TransportFactory {

    TelemetryTransport create(Device device);
}
