package io.ussopmm.ems.simulator.transport;

import io.ussopmm.ems.simulator.config.SimulatorProperties;
import io.ussopmm.ems.simulator.credential.Credential;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MqttTelemetryTransportTest {

    private final MqttTelemetryTransport transport =
            new MqttTelemetryTransport("ems-simulated-device-unit_1_hvac", new SimulatorProperties.Mqtt());

    @Test
    void connect_corruptPemBody_isAuthenticationFailure() {
        // given
        char[] corrupt = "-----BEGIN CERTIFICATE-----\n!!!!not*base64@@@\n-----END CERTIFICATE-----\n".toCharArray();
        Credential credential = new Credential(corrupt, corrupt.clone(), Credential.Source.SECRET_STORE, Instant.now());

        // when / then
        assertThatThrownBy(() -> transport.connect(credential))
                .isInstanceOf(TransportAuthenticationException.class)
                .hasMessageContaining("SECRET_STORE");
        assertThat(transport.isConnected()).isFalse();
    }

    @Test
    void connect_afterClose_isRefused() {
        // given
        Credential credential = new Credential("CERT".toCharArray(), "KEY".toCharArray(),
                Credential.Source.INLINE, Instant.now());
        transport.close();

        // when / then
        assertThatThrownBy(() -> transport.connect(credential))
                .isInstanceOf(TransportFailureException.class)
                .isNotInstanceOf(TransportAuthenticationException.class)
                .hasMessageContaining("closed");
    }
}
