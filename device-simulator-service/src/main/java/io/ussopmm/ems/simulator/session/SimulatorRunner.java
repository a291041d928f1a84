package io.ussopmm.ems.simulator.session;

import io.ussopmm.ems.model.Device;
import io.ussopmm.ems.model.ReadingCodec;
import io.ussopmm.ems.simulator.config.SimulatorProperties;
import io.ussopmm.ems.simulator.credential.CredentialResolver;
import io.ussopmm.ems.simulator.generator.ReadingGenerator;
import io.ussopmm.ems.simulator.helpers.PublisherMetrics;
import io.ussopmm.ems.simulator.transport.TransportFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Starts one {@link PublisherSession} per configured device and closes them on shutdown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SimulatorRunner implements SmartLifecycle {

    private final SimulatorProperties properties;
    private final CredentialResolver credentialResolver;
    private final TransportFactory transportFactory;
    private final ReadingCodec codec;
    private final PublisherMetrics metrics;
    private final Clock clock;

    private final List<PublisherSession> sessions = new ArrayList<>();
    private volatile boolean running;

    @Override
    public synchronized void start() {
        List<Device> devices = devices();
        for (Device device : devices) {
            ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(
                    r -> new Thread(r, "publisher-" + device.getDeviceId()));
            SimulatorProperties.Backoff backoff = properties.getBackoff();
            PublisherSession session = PublisherSession.builder()
                    .generator(new ReadingGenerator(device, properties.getSeed(), clock))
                    .transport(transportFactory.create(device))
                    .credentialResolver(credentialResolver)
                    .backoff(new ExponentialBackoff(backoff.getMin(), backoff.getMax(), backoff.getJitter(),
                            new Random(properties.getSeed() ^ device.getDeviceId().hashCode())))
                    .scheduler(scheduler)
                    .codec(codec)
                    .metrics(metrics)
                    .topicPrefix(properties.getTopicPrefix())
                    .qos(properties.getQos())
                    .interval(properties.getPublishInterval())
                    .build();
            session.start();
            sessions.add(session);
        }
        running = true;
        log.info("Simulator started {} devices, publishing every {}", sessions.size(), properties.getPublishInterval());
    }

    @Override
    public synchronized void stop() {
        sessions.parallelStream().forEach(PublisherSession::shutdown);
        sessions.clear();
        running = false;
        log.info("Simulator stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    List<PublisherSession> sessions() {
        return List.copyOf(sessions);
    }

    private List<Device> devices() {
        Set<String> seen = new HashSet<>();
        List<Device> devices = new ArrayList<>();
        for (SimulatorProperties.DeviceSpec spec : properties.getDevices()) {
            if (spec.getDeviceId() == null || spec.getDeviceId().isBlank() || spec.getSensorType() == null) {
                throw new IllegalStateException("ems.simulator.devices entries need device-id and sensor-type");
            }
            if (!seen.add(spec.getDeviceId())) {
                throw new IllegalStateException("Duplicate simulated device " + spec.getDeviceId());
            }
            devices.add(new Device(spec.getDeviceId(), spec.getSensorType()));
        }
        return devices;
    }
}
