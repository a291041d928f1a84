package io.ussopmm.ems.store.cassandra;

import lombok.*;
import org.springframework.data.cassandra.core.cql.Ordering;
import org.springframework.data.cassandra.core.cql.PrimaryKeyType;
import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKeyColumn;
import org.springframework.data.cassandra.core.mapping.Table;

import java.time.Instant;

/**
 * Device index entry. Points back at the primary row {@code (sensorType, ts)}.
 */
@Table("readings_by_device")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceReadingEntity {

    @PrimaryKeyColumn(name = "device_id", type = PrimaryKeyType.PARTITIONED)
    private String deviceId;

    @PrimaryKeyColumn(name = "ts", type = PrimaryKeyType.CLUSTERED, ordering = Ordering.ASCENDING)
    private Instant ts;

    @Column("sensor_type")
    private String sensorType;

    @Column("ttl_epoch")
    private Long ttlEpoch;
}
