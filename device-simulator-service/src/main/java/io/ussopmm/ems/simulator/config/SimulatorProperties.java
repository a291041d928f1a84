package io.ussopmm.ems.simulator.config;

import io.ussopmm.ems.model.SensorType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties(prefix = "ems.simulator")
public class SimulatorProperties {

    private Duration publishInterval = Duration.ofSeconds(5);

    /** Base seed of the random walks; each device mixes in its own id. */
    private long seed = 42L;

    private String topicPrefix = "ems";

    private int qos = 1;

    private List<DeviceSpec> devices = new ArrayList<>();

    private Mqtt mqtt = new Mqtt();

    private Backoff backoff = new Backoff();

    private Credentials credentials = new Credentials();

    @Getter
    @Setter
    public static class DeviceSpec {
        private String deviceId;
        private SensorType sensorType;
    }

    @Getter
    @Setter
    public static class Mqtt {
        private String endpoint = "ssl://localhost:8883";
        private String clientIdPrefix = "ems-simulated-device";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration operationTimeout = Duration.ofSeconds(5);
        private Duration keepAlive = Duration.ofSeconds(60);
        /** PEM bundle of trusted CAs; JVM default trust store when empty. */
        private String rootCaPath;
    }

    @Getter
    @Setter
    public static class Backoff {
        private Duration min = Duration.ofSeconds(1);
        private Duration max = Duration.ofSeconds(60);
        /** Upper bound of the additive jitter as a fraction of the base delay. */
        private double jitter = 0.2;
    }

    @Getter
    @Setter
    public static class Credentials {
        private String certificate;
        private String privateKey;
        private String secretName;
        private String region;
        private String certificatePath = "certs/certificate.pem.crt";
        private String privateKeyPath = "certs/private.pem.key";
        /** Re-resolve after this age; never when unset. */
        private Duration maxAge;
    }
}
