package io.ussopmm.ems.store;

import io.ussopmm.ems.model.SensorType;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Persisted form of a reading, or of a message that failed ingestion.
 * <p>
 * {@code (partitionKey, sortKey)} is not unique across devices: two devices of the same sensor
 * type ingested within the same second land on the same key and the later write replaces the
 * earlier one.
 */
@Value
@Builder(toBuilder = true)
public class StorageRecord {

    @NonNull
    String partitionKey;
    @NonNull
    Instant sortKey;
    String deviceId;
    @Builder.Default
    Map<String, Double> payload = Map.of();
    /** Epoch seconds after which the record is logically absent. */
    long ttlEpochSeconds;
    int schemaVersion;

    // error partition only
    String rawPayload;
    String sourceTopic;
    String failureReason;

    public boolean isError() {
        return SensorType.ERROR_PARTITION.equals(partitionKey);
    }

    public boolean isExpiredAt(Instant now) {
        return ttlEpochSeconds <= now.getEpochSecond();
    }
}
