package io.ussopmm.ems.collector.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "ems.router")
public class RouterProperties {

    /** Kafka topic the rule engine bridges device messages to. */
    private String topic = "ems-telemetry";

    private int topicPartitions = 3;

    /** Index of the MQTT topic segment naming the sensor type, {@code ems/<sensor_type>}. */
    private int sensorTypeSegment = 1;

    private Retry retry = new Retry();

    @Getter
    @Setter
    public static class Retry {
        private int maxAttempts = 3;
        private Duration minBackoff = Duration.ofMillis(200);
        private Duration maxBackoff = Duration.ofSeconds(2);
    }
}
