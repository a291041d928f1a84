package io.ussopmm.ems.store.cassandra;

import io.ussopmm.ems.store.config.StoreProperties;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * CQL for the keyspace and both tables. Statements are idempotent and run at every start.
 */
@RequiredArgsConstructor
public class TimeSeriesSchema {

    private final StoreProperties properties;

    public List<String> statements() {
        String ks = properties.getKeyspace();
        return List.of(
                "CREATE KEYSPACE IF NOT EXISTS " + ks
                        + " WITH replication = {'class': 'SimpleStrategy', 'replication_factor': "
                        + properties.getReplicationFactor() + "}",
                "CREATE TABLE IF NOT EXISTS " + ks + "." + properties.getReadingsTable() + " ("
                        + "sensor_type text, "
                        + "ts timestamp, "
                        + "device_id text, "
                        + "payload map<text, double>, "
                        + "ttl_epoch bigint, "
                        + "schema_version int, "
                        + "raw_payload text, "
                        + "source_topic text, "
                        + "failure_reason text, "
                        + "PRIMARY KEY ((sensor_type), ts)"
                        + ") WITH CLUSTERING ORDER BY (ts ASC)",
                "CREATE TABLE IF NOT EXISTS " + ks + "." + properties.getDeviceIndexTable() + " ("
                        + "device_id text, "
                        + "ts timestamp, "
                        + "sensor_type text, "
                        + "ttl_epoch bigint, "
                        + "PRIMARY KEY ((device_id), ts)"
                        + ") WITH CLUSTERING ORDER BY (ts ASC)");
    }
}
