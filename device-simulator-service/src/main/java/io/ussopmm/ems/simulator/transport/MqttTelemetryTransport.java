package io.ussopmm.ems.simulator.transport;

import io.ussopmm.ems.simulator.config.SimulatorProperties;
import io.ussopmm.ems.simulator.credential.Credential;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.paho.client.mqttv3.*;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;

import javax.net.ssl.SSLHandshakeException;
import javax.net.ssl.SSLSocketFactory;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.function.Consumer;

/**
 * {@link TelemetryTransport} over MQTT 3.1.1 with mutual TLS, backed by a synchronous Paho client.
 */
@Slf4j
public class MqttTelemetryTransport implements TelemetryTransport {

    private final String endpoint;
    private final String clientId;
    private final SimulatorProperties.Mqtt config;

    private volatile MqttClient client;
    private volatile boolean closed;
    private volatile Consumer<Throwable> connectionLostListener = cause -> { };

    public MqttTelemetryTransport(String clientId, SimulatorProperties.Mqtt config) {
        this.endpoint = config.getEndpoint();
        this.clientId = clientId;
        this.config = config;
    }

    @Override
    public synchronized void connect(Credential credential) {
        if (closed) {
            throw new TransportFailureException("Client " + clientId + " is closed", null);
        }
        SSLSocketFactory socketFactory;
        try {
            socketFactory = PemSocketFactories.create(credential, config.getRootCaPath());
        } catch (GeneralSecurityException | IOException | RuntimeException e) {
            // corrupt PEM bodies surface as unchecked decoder errors from BouncyCastle
            throw new TransportAuthenticationException("Credential from " + credential.source()
                    + " cannot be turned into a TLS identity", e);
        }

        MqttConnectOptions options = new MqttConnectOptions();
        options.setSocketFactory(socketFactory);
        options.setCleanSession(true);
        options.setAutomaticReconnect(false);
        options.setConnectionTimeout((int) config.getConnectTimeout().toSeconds());
        options.setKeepAliveInterval((int) config.getKeepAlive().toSeconds());

        try {
            MqttClient current = client;
            if (current == null) {
                current = new MqttClient(endpoint, clientId, new MemoryPersistence());
                current.setTimeToWait(config.getOperationTimeout().toMillis());
                current.setCallback(new MqttCallback() {
                    @Override
                    public void connectionLost(Throwable cause) {
                        log.warn("Connection of {} lost: {}", clientId, cause == null ? "unknown" : cause.toString());
                        connectionLostListener.accept(cause);
                    }

                    @Override
                    public void messageArrived(String topic, MqttMessage message) {
                        log.debug("Ignoring message on {}; the simulator does not subscribe", topic);
                    }

                    @Override
                    public void deliveryComplete(IMqttDeliveryToken token) {
                        log.trace("Delivery complete for message {}", token.getMessageId());
                    }
                });
                client = current;
            }
            current.connect(options);
            if (closed) {
                // close() ran while the connect was in flight and may have missed this client
                client = null;
                release(current);
                throw new TransportFailureException("Client " + clientId + " was closed while connecting", null);
            }
            log.info("Client {} connected to {}", clientId, endpoint);
        } catch (MqttException e) {
            if (isAuthenticationFailure(e)) {
                throw new TransportAuthenticationException("Broker rejected credential of " + clientId, e);
            }
            throw new TransportFailureException("Connect of " + clientId + " to " + endpoint + " failed", e);
        }
    }

    @Override
    public void publish(String topic, byte[] payload, int qos) {
        MqttClient current = client;
        if (current == null || !current.isConnected()) {
            throw new TransportFailureException("Client " + clientId + " is not connected", null);
        }
        MqttMessage message = new MqttMessage(payload);
        message.setQos(qos);
        message.setRetained(false);
        try {
            current.publish(topic, message);
        } catch (MqttException e) {
            if (isAuthenticationFailure(e)) {
                throw new TransportAuthenticationException("Broker refused publish of " + clientId + " to " + topic, e);
            }
            throw new TransportFailureException("Publish of " + clientId + " to " + topic + " failed", e);
        }
    }

    @Override
    public boolean isConnected() {
        MqttClient current = client;
        return current != null && current.isConnected();
    }

    @Override
    public void onConnectionLost(Consumer<Throwable> listener) {
        this.connectionLostListener = listener;
    }

    @Override
    public void close() {
        // not synchronized: must not wait for a connect that is still in progress
        closed = true;
        MqttClient current = client;
        client = null;
        if (current != null) {
            release(current);
        }
    }

    private void release(MqttClient current) {
        try {
            if (current.isConnected()) {
                current.disconnectForcibly(config.getOperationTimeout().toMillis());
            }
            current.close();
            log.info("Client {} closed", clientId);
        } catch (MqttException e) {
            log.warn("Closing client {} failed: {}", clientId, e.toString());
        }
    }

    static boolean isAuthenticationFailure(MqttException e) {
        int reason = e.getReasonCode();
        if (reason == MqttException.REASON_CODE_FAILED_AUTHENTICATION
                || reason == MqttException.REASON_CODE_NOT_AUTHORIZED) {
            return true;
        }
        Throwable cause = e.getCause();
        while (cause != null && cause != cause.getCause()) {
            if (cause instanceof SSLHandshakeException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }
}
