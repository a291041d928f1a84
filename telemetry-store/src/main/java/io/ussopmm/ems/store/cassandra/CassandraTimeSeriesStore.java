package io.ussopmm.ems.store.cassandra;

import com.datastax.oss.driver.api.core.cql.SimpleStatement;
import io.ussopmm.ems.store.RecordPage;
import io.ussopmm.ems.store.StorageRecord;
import io.ussopmm.ems.store.StoreUnavailableException;
import io.ussopmm.ems.store.TimeSeriesStore;
import io.ussopmm.ems.store.config.StoreProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.cassandra.core.CassandraOperations;
import org.springframework.data.cassandra.core.query.CassandraPageRequest;
import org.springframework.data.domain.Slice;

import java.nio.ByteBuffer;
import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.function.Supplier;

/**
 * {@link TimeSeriesStore} over two Cassandra tables: the primary table keyed by
 * {@code (sensor_type, ts)} and the device index keyed by {@code (device_id, ts)}.
 * <p>
 * Rows carry their logical expiry in {@code ttl_epoch}; the native TTL is set past it by the
 * configured purge grace so an expired row is still readable (and countable) for a while.
 */
@Slf4j
public class CassandraTimeSeriesStore implements TimeSeriesStore {

    // Cassandra rejects TTLs above 20 years
    private static final long MAX_NATIVE_TTL_SECONDS = 630_720_000L;
    private static final int RECONCILE_CHUNK = 100;

    private final CassandraOperations operations;
    private final StoreProperties properties;
    private final Clock clock;

    private final String insertReading;
    private final String insertError;
    private final String insertIndex;
    private final String selectPartition;
    private final String selectDevice;
    private final String selectPrimaryKeys;

    public CassandraTimeSeriesStore(CassandraOperations operations, StoreProperties properties, Clock clock) {
        this.operations = operations;
        this.properties = properties;
        this.clock = clock;

        String readings = properties.getReadingsTable();
        String index = properties.getDeviceIndexTable();
        this.insertReading = "INSERT INTO " + readings
                + " (sensor_type, ts, device_id, payload, ttl_epoch, schema_version)"
                + " VALUES (?, ?, ?, ?, ?, ?) USING TTL ?";
        this.insertError = "INSERT INTO " + readings
                + " (sensor_type, ts, device_id, ttl_epoch, schema_version, raw_payload, source_topic, failure_reason)"
                + " VALUES (?, ?, ?, ?, ?, ?, ?, ?) USING TTL ?";
        this.insertIndex = "INSERT INTO " + index
                + " (device_id, ts, sensor_type, ttl_epoch) VALUES (?, ?, ?, ?) USING TTL ?";
        this.selectPartition = "SELECT * FROM " + readings + " WHERE sensor_type = ? AND ts >= ? AND ts <= ?";
        this.selectDevice = "SELECT * FROM " + index + " WHERE device_id = ? AND ts >= ? AND ts <= ?";
        this.selectPrimaryKeys = "SELECT * FROM " + readings + " WHERE sensor_type = ? AND ts IN ?";
    }

    @Override
    public void put(StorageRecord record) {
        int ttl = nativeTtl(record);
        translate("put into " + record.getPartitionKey(), () -> {
            if (record.isError()) {
                operations.getCqlOperations().execute(SimpleStatement.newInstance(insertError,
                        record.getPartitionKey(), record.getSortKey(), record.getDeviceId(),
                        record.getTtlEpochSeconds(), record.getSchemaVersion(),
                        record.getRawPayload(), record.getSourceTopic(), record.getFailureReason(), ttl));
                return null;
            }
            operations.getCqlOperations().execute(SimpleStatement.newInstance(insertReading,
                    record.getPartitionKey(), record.getSortKey(), record.getDeviceId(),
                    record.getPayload(), record.getTtlEpochSeconds(), record.getSchemaVersion(), ttl));
            if (record.getDeviceId() != null) {
                operations.getCqlOperations().execute(SimpleStatement.newInstance(insertIndex,
                        record.getDeviceId(), record.getSortKey(), record.getPartitionKey(),
                        record.getTtlEpochSeconds(), ttl));
            }
            return null;
        });
        log.debug("Stored record partition={} ts={} device={}",
                record.getPartitionKey(), record.getSortKey(), record.getDeviceId());
    }

    @Override
    public RecordPage queryByPartition(String partitionKey, Instant from, Instant to, ByteBuffer cursor) {
        SimpleStatement statement = paged(selectPartition, cursor, partitionKey, from, to);
        return translate("query partition " + partitionKey, () -> {
            Slice<ReadingEntity> slice = operations.slice(statement, ReadingEntity.class);
            List<StorageRecord> records = slice.getContent().stream()
                    .map(CassandraTimeSeriesStore::toRecord)
                    .toList();
            return new RecordPage(records, nextCursor(slice));
        });
    }

    @Override
    public RecordPage queryByDevice(String deviceId, Instant from, Instant to, ByteBuffer cursor) {
        SimpleStatement statement = paged(selectDevice, cursor, deviceId, from, to);
        return translate("query device " + deviceId, () -> {
            Slice<DeviceReadingEntity> slice = operations.slice(statement, DeviceReadingEntity.class);
            return new RecordPage(reconcile(deviceId, slice.getContent()), nextCursor(slice));
        });
    }

    /**
     * Resolves index entries against the primary table. An entry whose primary row is gone or
     * now belongs to another device (same sensor type, same second) is dropped.
     */
    private List<StorageRecord> reconcile(String deviceId, List<DeviceReadingEntity> entries) {
        if (entries.isEmpty()) {
            return List.of();
        }
        Map<String, List<Instant>> bySensorType = new LinkedHashMap<>();
        for (DeviceReadingEntity entry : entries) {
            bySensorType.computeIfAbsent(entry.getSensorType(), k -> new ArrayList<>()).add(entry.getTs());
        }

        List<StorageRecord> records = new ArrayList<>(entries.size());
        bySensorType.forEach((sensorType, timestamps) -> {
            for (int i = 0; i < timestamps.size(); i += RECONCILE_CHUNK) {
                List<Instant> chunk = timestamps.subList(i, Math.min(i + RECONCILE_CHUNK, timestamps.size()));
                List<ReadingEntity> primaries = operations.select(
                        SimpleStatement.newInstance(selectPrimaryKeys, sensorType, chunk), ReadingEntity.class);
                for (ReadingEntity primary : primaries) {
                    if (deviceId.equals(primary.getDeviceId())) {
                        records.add(toRecord(primary));
                    }
                }
            }
        });
        int superseded = entries.size() - records.size();
        if (superseded > 0) {
            log.debug("{} index entries of device {} superseded by other devices", superseded, deviceId);
        }
        records.sort(Comparator.comparing(StorageRecord::getSortKey));
        return records;
    }

    private SimpleStatement paged(String cql, ByteBuffer cursor, Object... values) {
        return SimpleStatement.builder(cql)
                .addPositionalValues(values)
                .setPageSize(properties.getPageSize())
                .setPagingState(cursor)
                .build();
    }

    private int nativeTtl(StorageRecord record) {
        long remaining = Math.max(0L, record.getTtlEpochSeconds() - clock.instant().getEpochSecond());
        long ttl = remaining + properties.getPurgeGrace().toSeconds();
        return (int) Math.max(1L, Math.min(ttl, MAX_NATIVE_TTL_SECONDS));
    }

    private static ByteBuffer nextCursor(Slice<?> slice) {
        if (slice.hasNext() && slice.getPageable() instanceof CassandraPageRequest request) {
            return request.getPagingState();
        }
        return null;
    }

    static StorageRecord toRecord(ReadingEntity entity) {
        return StorageRecord.builder()
                .partitionKey(entity.getSensorType())
                .sortKey(entity.getTs())
                .deviceId(entity.getDeviceId())
                .payload(entity.getPayload() == null ? Map.of() : entity.getPayload())
                .ttlEpochSeconds(entity.getTtlEpoch() == null ? 0L : entity.getTtlEpoch())
                .schemaVersion(entity.getSchemaVersion() == null ? 0 : entity.getSchemaVersion())
                .rawPayload(entity.getRawPayload())
                .sourceTopic(entity.getSourceTopic())
                .failureReason(entity.getFailureReason())
                .build();
    }

    private static <T> T translate(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (TransientDataAccessException | DataAccessResourceFailureException e) {
            throw new StoreUnavailableException(operation + " failed: " + e.getMessage(), e);
        }
    }
}
