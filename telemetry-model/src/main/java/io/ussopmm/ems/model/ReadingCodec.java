package io.ussopmm.ems.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * JSON codec for {@link Reading} payloads.
 * <p>
 * Decoding is strict: it is the validation step of ingestion. Besides the current nested
 * {@code values} layout, the flat layout of the first simulator generation (numeric fields at
 * top level next to {@code device_id}, no {@code schema_version}) is accepted as schema
 * version {@value #LEGACY_SCHEMA_VERSION}.
 */
public class ReadingCodec {

    public static final int LEGACY_SCHEMA_VERSION = 0;

    private static final Set<String> LEGACY_RESERVED_FIELDS =
            Set.of("device_id", "sensor_type", "edge_time_stamp", "timestamp", "ttl", "unit_id");

    private final ObjectMapper objectMapper;

    public ReadingCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ReadingCodec() {
        this(new ObjectMapper());
    }

    public byte[] encode(Reading reading) {
        try {
            return objectMapper.writeValueAsBytes(reading);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Reading for device " + reading.deviceId() + " is not serializable", e);
        }
    }

    public Reading decode(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new ReadingValidationException("empty payload");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new ReadingValidationException("malformed payload: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ReadingValidationException("payload is not a JSON object");
        }

        String deviceId = text(root, "device_id");
        if (deviceId == null || deviceId.isBlank()) {
            throw new ReadingValidationException("device_id is missing");
        }

        JsonNode valuesNode = root.get("values");
        int schemaVersion;
        Map<String, Double> values;
        if (valuesNode != null) {
            if (!valuesNode.isObject()) {
                throw new ReadingValidationException("values is not an object");
            }
            values = numericFields(valuesNode, Set.of());
            JsonNode version = root.get("schema_version");
            schemaVersion = version != null && version.canConvertToInt()
                    ? version.intValue()
                    : Reading.CURRENT_SCHEMA_VERSION;
        } else {
            values = numericFields(root, LEGACY_RESERVED_FIELDS);
            schemaVersion = LEGACY_SCHEMA_VERSION;
        }
        if (values.isEmpty()) {
            throw new ReadingValidationException("no numeric values for device " + deviceId);
        }

        String timestamp = text(root, "timestamp");
        if (timestamp == null) {
            timestamp = text(root, "edge_time_stamp");
        }
        return new Reading(deviceId, text(root, "sensor_type"), timestamp, values, schemaVersion);
    }

    private static Map<String, Double> numericFields(JsonNode node, Set<String> skip) {
        Map<String, Double> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (skip.contains(field.getKey())) {
                continue;
            }
            JsonNode value = field.getValue();
            if (value.isNumber()) {
                double d = value.doubleValue();
                if (!Double.isFinite(d)) {
                    throw new ReadingValidationException("value of " + field.getKey() + " is not finite");
                }
                values.put(field.getKey(), d);
            } else if (skip.isEmpty()) {
                // nested layout: every entry must be numeric
                throw new ReadingValidationException("value of " + field.getKey() + " is not numeric");
            }
        }
        return values;
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node != null && node.isTextual() ? node.asText() : null;
    }
}
