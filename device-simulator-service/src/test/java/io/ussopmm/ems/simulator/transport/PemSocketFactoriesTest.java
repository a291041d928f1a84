package io.ussopmm.ems.simulator.transport;

import io.ussopmm.ems.simulator.config.SimulatorProperties;
import io.ussopmm.ems.simulator.credential.Credential;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import javax.net.ssl.SSLHandshakeException;
import java.io.StringWriter;
import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PemSocketFactoriesTest {

    static String certificatePem;
    static String privateKeyPem;

    @BeforeAll
    static void selfSignedDevice() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        KeyPair keyPair = generator.generateKeyPair();
        X500Name subject = new X500Name("CN=unit_1_hvac");
        Instant now = Instant.now();
        X509CertificateHolder holder = new JcaX509v3CertificateBuilder(subject, BigInteger.ONE,
                Date.from(now), Date.from(now.plus(Duration.ofDays(1))), subject, keyPair.getPublic())
                .build(new JcaContentSignerBuilder("SHA256withRSA").build(keyPair.getPrivate()));

        certificatePem = pem(holder);
        privateKeyPem = pem(keyPair.getPrivate());
    }

    private static String pem(Object object) throws Exception {
        StringWriter out = new StringWriter();
        try (JcaPEMWriter writer = new JcaPEMWriter(out)) {
            writer.writeObject(object);
        }
        return out.toString();
    }

    private static Credential credential(String certificate, String key) {
        return new Credential(certificate.toCharArray(), key.toCharArray(), Credential.Source.INLINE, Instant.now());
    }

    @Test
    void create_buildsSocketFactoryFromPemPair() throws Exception {
        assertThat(PemSocketFactories.create(credential(certificatePem, privateKeyPem), null)).isNotNull();
    }

    @Test
    void readCertificates_parsesChain() throws Exception {
        assertThat(PemSocketFactories.readCertificates((certificatePem + certificatePem).toCharArray())).hasSize(2);
    }

    @Test
    void create_rejectsGarbageKey() {
        assertThatThrownBy(() -> PemSocketFactories.create(credential(certificatePem, "not a key"), null))
                .isInstanceOf(GeneralSecurityException.class);
    }

    @Test
    void connectWithUnusableCredential_isAuthenticationFailure() {
        // given
        MqttTelemetryTransport transport = new MqttTelemetryTransport("ems-simulated-device-d1",
                new SimulatorProperties.Mqtt());

        // when / then
        assertThatThrownBy(() -> transport.connect(credential("garbage", "garbage")))
                .isInstanceOf(TransportAuthenticationException.class);
        transport.close();
    }

    @Test
    void handshakeAndAuthReasonCodes_countAsAuthenticationFailures() {
        assertThat(MqttTelemetryTransport.isAuthenticationFailure(
                new MqttException(MqttException.REASON_CODE_NOT_AUTHORIZED))).isTrue();
        assertThat(MqttTelemetryTransport.isAuthenticationFailure(
                new MqttException(MqttException.REASON_CODE_SERVER_CONNECT_ERROR,
                        new SSLHandshakeException("certificate_unknown")))).isTrue();
        assertThat(MqttTelemetryTransport.isAuthenticationFailure(
                new MqttException(MqttException.REASON_CODE_CLIENT_TIMEOUT))).isFalse();
    }
}
