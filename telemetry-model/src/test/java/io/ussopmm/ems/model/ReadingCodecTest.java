package io.ussopmm.ems.model;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReadingCodecTest {

    private final ReadingCodec codec = new ReadingCodec();

    @Test
    void encode_writesSnakeCaseFields() {
        Reading reading = new Reading("d1", "hvac", "2024-01-01T00:00:00Z", Map.of("hvac_power_kw", 1.5), 1);

        String json = new String(codec.encode(reading), StandardCharsets.UTF_8);

        assertThat(json)
                .contains("\"device_id\":\"d1\"")
                .contains("\"sensor_type\":\"hvac\"")
                .contains("\"timestamp\":\"2024-01-01T00:00:00Z\"")
                .contains("\"values\":{\"hvac_power_kw\":1.5}")
                .contains("\"schema_version\":1");
    }

    @Test
    void decode_nestedLayout() {
        Reading reading = codec.decode("""
                {"device_id":"unit_1_hvac","sensor_type":"hvac","timestamp":"2024-01-01T00:00:00Z",
                 "values":{"hvac_power_kw":2.25,"hvac_runtime_minutes":12},"schema_version":1}
                """);

        assertThat(reading.deviceId()).isEqualTo("unit_1_hvac");
        assertThat(reading.sensorType()).isEqualTo("hvac");
        assertThat(reading.values()).containsEntry("hvac_power_kw", 2.25).containsEntry("hvac_runtime_minutes", 12.0);
        assertThat(reading.schemaVersion()).isEqualTo(1);
    }

    @Test
    void decode_flatLegacyLayout_skipsReservedFields() {
        Reading reading = codec.decode("""
                {"device_id":"ems-monitoring-device","sensor_type":"environment",
                 "edge_time_stamp":"2024-01-01 10:00:00.123","ttl":1706781600,
                 "ambient_temp":71.3,"humidity":44.0}
                """);

        assertThat(reading.values()).containsOnlyKeys("ambient_temp", "humidity");
        assertThat(reading.timestamp()).isEqualTo("2024-01-01 10:00:00.123");
        assertThat(reading.schemaVersion()).isEqualTo(ReadingCodec.LEGACY_SCHEMA_VERSION);
    }

    @Test
    void decode_rejectsMalformedJson() {
        assertThatThrownBy(() -> codec.decode("{not json"))
                .isInstanceOf(ReadingValidationException.class)
                .hasMessageContaining("malformed payload");
    }

    @Test
    void decode_rejectsMissingDeviceId() {
        assertThatThrownBy(() -> codec.decode("{\"values\":{\"a\":1}}"))
                .isInstanceOf(ReadingValidationException.class)
                .hasMessageContaining("device_id");
    }

    @Test
    void decode_rejectsNonNumericValue() {
        assertThatThrownBy(() -> codec.decode("{\"device_id\":\"d1\",\"values\":{\"status\":\"OK\"}}"))
                .isInstanceOf(ReadingValidationException.class)
                .hasMessageContaining("status");
    }

    @Test
    void decode_rejectsPayloadWithoutValues() {
        assertThatThrownBy(() -> codec.decode("{\"device_id\":\"d1\",\"values\":{}}"))
                .isInstanceOf(ReadingValidationException.class)
                .hasMessageContaining("no numeric values");
        assertThatThrownBy(() -> codec.decode("   "))
                .isInstanceOf(ReadingValidationException.class);
        assertThatThrownBy(() -> codec.decode("[1,2]"))
                .isInstanceOf(ReadingValidationException.class);
    }

    @Test
    void sensorType_fromId() {
        assertThat(SensorType.fromId("space_temperature")).contains(SensorType.SPACE_TEMPERATURE);
        assertThat(SensorType.fromId(SensorType.ERROR_PARTITION)).isEmpty();
        assertThat(SensorType.fromId(null)).isEmpty();
    }
}
