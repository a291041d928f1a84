package io.ussopmm.ems.simulator.transport;

import io.ussopmm.ems.simulator.credential.Credential;

import java.util.function.Consumer;

/**
 * Connection of one device to the message broker. Instances are never shared between devices.
 */
public interface TelemetryTransport extends AutoCloseable {

    /**
     * Opens the connection with the given credential, blocking up to the connect timeout.
     *
     * @throws TransportAuthenticationException when the broker rejects the credential
     * @throws TransportFailureException        on any other connect failure
     */
    void connect(Credential credential);

    /**
     * Publishes one message and waits for the broker acknowledgement.
     *
     * @throws TransportFailureException when the message was not acknowledged; it is not resent
     */
    void publish(String topic, byte[] payload, int qos);

    boolean isConnected();

    /** Listener for connection losses detected outside of {@link #publish}, e.g. by keep-alive. */
    void onConnectionLost(Consumer<Throwable> listener);

    @Override
    void close();
}
