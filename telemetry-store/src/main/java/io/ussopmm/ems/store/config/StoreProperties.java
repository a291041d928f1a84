package io.ussopmm.ems.store.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "ems.store")
public class StoreProperties {

    private String keyspace = "ems";

    private String readingsTable = "readings";

    private String deviceIndexTable = "readings_by_device";

    /** Retention horizon added to the ingest time to compute a record's TTL. */
    private Duration retention = Duration.ofDays(30);

    /** How long an expired record stays physically in the store before Cassandra purges it. */
    private Duration purgeGrace = Duration.ofDays(1);

    private int pageSize = 500;

    private int replicationFactor = 1;
}
