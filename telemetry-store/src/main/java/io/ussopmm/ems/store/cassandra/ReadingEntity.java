package io.ussopmm.ems.store.cassandra;

import lombok.*;
import org.springframework.data.cassandra.core.cql.Ordering;
import org.springframework.data.cassandra.core.cql.PrimaryKeyType;
import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKeyColumn;
import org.springframework.data.cassandra.core.mapping.Table;

import java.time.Instant;
import java.util.Map;

/**
 * Row of the primary table, partitioned by sensor type (or {@code error}).
 */
@Table("readings")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReadingEntity {

    @PrimaryKeyColumn(name = "sensor_type", type = PrimaryKeyType.PARTITIONED)
    private String sensorType;

    @PrimaryKeyColumn(name = "ts", type = PrimaryKeyType.CLUSTERED, ordering = Ordering.ASCENDING)
    private Instant ts;

    @Column("device_id")
    private String deviceId;

    @Column("payload")
    private Map<String, Double> payload;

    @Column("ttl_epoch")
    private Long ttlEpoch;

    @Column("schema_version")
    private Integer schemaVersion;

    @Column("raw_payload")
    private String rawPayload;

    @Column("source_topic")
    private String sourceTopic;

    @Column("failure_reason")
    private String failureReason;
}
