package io.ussopmm.ems.simulator.session;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.ussopmm.ems.model.Device;
import io.ussopmm.ems.model.Reading;
import io.ussopmm.ems.model.ReadingCodec;
import io.ussopmm.ems.simulator.credential.Credential;
import io.ussopmm.ems.simulator.credential.CredentialResolver;
import io.ussopmm.ems.simulator.credential.CredentialUnavailableException;
import io.ussopmm.ems.simulator.generator.ReadingGenerator;
import io.ussopmm.ems.simulator.helpers.PublisherMetrics;
import io.ussopmm.ems.simulator.transport.TelemetryTransport;
import io.ussopmm.ems.simulator.transport.TransportAuthenticationException;
import io.ussopmm.ems.simulator.transport.TransportFailureException;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Publishing loop of one device.
 * <pre>
 * DISCONNECTED --connect--> CONNECTING --ok--> CONNECTED --publish failure--> DISCONNECTED
 *                           CONNECTING --failure--> DISCONNECTED (reconnect after backoff)
 * any state --shutdown--> CLOSED
 * </pre>
 * Delivery is at-most-once: a reading generated while not connected, or whose publish is not
 * acknowledged, is dropped. Everything but {@link #shutdown()} runs on the session's own
 * single-threaded scheduler, so the generator and the backoff need no further synchronization.
 */
@Slf4j
public class PublisherSession {

    public enum State { DISCONNECTED, CONNECTING, CONNECTED, CLOSED }

    private final Device device;
    private final ReadingGenerator generator;
    private final TelemetryTransport transport;
    private final CredentialResolver credentialResolver;
    private final ExponentialBackoff backoff;
    private final ScheduledExecutorService scheduler;
    private final ReadingCodec codec;
    private final PublisherMetrics metrics;
    private final String topic;
    private final int qos;
    private final Duration interval;

    private final AtomicReference<State> state = new AtomicReference<>(State.DISCONNECTED);
    private volatile ScheduledFuture<?> cadence;
    private volatile ScheduledFuture<?> pendingConnect;
    private volatile Credential activeCredential;

    @Builder
    PublisherSession(ReadingGenerator generator,
                     TelemetryTransport transport,
                     CredentialResolver credentialResolver,
                     ExponentialBackoff backoff,
                     ScheduledExecutorService scheduler,
                     ReadingCodec codec,
                     PublisherMetrics metrics,
                     String topicPrefix,
                     int qos,
                     Duration interval) {
        this.device = generator.device();
        this.generator = generator;
        this.transport = transport;
        this.credentialResolver = credentialResolver;
        this.backoff = backoff;
        this.scheduler = scheduler;
        this.codec = codec;
        this.metrics = metrics;
        this.topic = topicPrefix + "/" + device.getSensorType().id();
        this.qos = qos;
        this.interval = interval;
    }

    public void start() {
        if (state.get() == State.CLOSED) {
            throw new IllegalStateException("session of " + device.getDeviceId() + " is closed");
        }
        transport.onConnectionLost(cause -> submit(() -> connectionLost(cause)));
        submit(this::connect);
        cadence = scheduler.scheduleAtFixedRate(this::tick, interval.toMillis(), interval.toMillis(),
                TimeUnit.MILLISECONDS);
    }

    public State state() {
        return state.get();
    }

    public Device device() {
        return device;
    }

    void connect() {
        if (!state.compareAndSet(State.DISCONNECTED, State.CONNECTING)) {
            return;
        }
        try (var ignored = MDC.putCloseable("deviceId", device.getDeviceId())) {
            var span = GlobalOpenTelemetry.getTracer(PublisherSession.class.getName())
                    .spanBuilder("publisherSession.connect")
                    .setAttribute("device.id", device.getDeviceId())
                    .startSpan();
            Credential credential = null;
            try {
                credential = credentialResolver.resolve();
                transport.connect(credential);
                activeCredential = credential;
                if (state.compareAndSet(State.CONNECTING, State.CONNECTED)) {
                    log.info("Device {} connected, publishing to {}", device.getDeviceId(), topic);
                } else {
                    // shut down while connecting
                    transport.close();
                }
            } catch (CredentialUnavailableException e) {
                connectFailed(span, e, "No credential for device " + device.getDeviceId());
            } catch (TransportAuthenticationException e) {
                credentialResolver.invalidate(credential);
                connectFailed(span, e, "Broker rejected credential of device " + device.getDeviceId());
            } catch (TransportFailureException e) {
                connectFailed(span, e, "Connect of device " + device.getDeviceId() + " failed");
            } catch (RuntimeException e) {
                // the session must always leave CONNECTING, or the device never reconnects
                if (credential != null) {
                    credentialResolver.invalidate(credential);
                }
                connectFailed(span, e, "Unexpected connect failure of device " + device.getDeviceId());
            } finally {
                span.end();
            }
        }
    }

    void tick() {
        try (var ignored = MDC.putCloseable("deviceId", device.getDeviceId())) {
            Reading reading = generator.next();
            if (state.get() != State.CONNECTED) {
                metrics.incDropped(device.getSensorType().id(), "disconnected");
                log.debug("Device {} not connected, dropped reading of {}", device.getDeviceId(), reading.timestamp());
                return;
            }
            try {
                transport.publish(topic, codec.encode(reading), qos);
                backoff.reset();
                metrics.incPublished(device.getSensorType().id());
                log.debug("Published reading of {} to {}", reading.timestamp(), topic);
            } catch (TransportFailureException e) {
                metrics.incDropped(device.getSensorType().id(), "unacknowledged");
                if (e instanceof TransportAuthenticationException) {
                    credentialResolver.invalidate(activeCredential);
                }
                connectionLost(e);
            }
        } catch (RuntimeException e) {
            // an exception escaping here would cancel the fixed-rate task
            log.error("Unexpected failure in publishing loop of device {}", device.getDeviceId(), e);
        }
    }

    /**
     * Moves to {@code CLOSED}, stops the cadence and any pending reconnect, closes the transport
     * and stops the scheduler. Returns within one publish interval.
     */
    public void shutdown() {
        if (state.getAndSet(State.CLOSED) == State.CLOSED) {
            return;
        }
        ScheduledFuture<?> timer = cadence;
        if (timer != null) {
            timer.cancel(false);
        }
        ScheduledFuture<?> reconnect = pendingConnect;
        if (reconnect != null) {
            reconnect.cancel(false);
        }
        scheduler.shutdown();
        transport.close();
        try {
            if (!scheduler.awaitTermination(interval.toMillis(), TimeUnit.MILLISECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Session of device {} closed", device.getDeviceId());
    }

    private void connectionLost(Throwable cause) {
        if (state.compareAndSet(State.CONNECTED, State.DISCONNECTED)) {
            log.warn("Device {} disconnected: {}", device.getDeviceId(), cause == null ? "unknown" : cause.toString());
            scheduleReconnect();
        }
    }

    private void connectFailed(Span span, RuntimeException e, String message) {
        span.recordException(e);
        span.setStatus(StatusCode.ERROR, e.getMessage() == null ? "" : e.getMessage());
        if (state.compareAndSet(State.CONNECTING, State.DISCONNECTED)) {
            log.warn("{}: {}", message, e.toString());
            scheduleReconnect();
        }
    }

    private void scheduleReconnect() {
        Duration delay = backoff.nextDelay();
        log.info("Device {} reconnects in {} ms", device.getDeviceId(), delay.toMillis());
        try {
            pendingConnect = scheduler.schedule(this::connect, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Reconnect of device {} not scheduled, scheduler stopped", device.getDeviceId());
        }
    }

    private void submit(Runnable task) {
        try {
            scheduler.execute(task);
        } catch (RejectedExecutionException e) {
            log.debug("Task for device {} not run, scheduler stopped", device.getDeviceId());
        }
    }
}
