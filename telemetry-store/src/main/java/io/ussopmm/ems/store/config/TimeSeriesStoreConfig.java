package io.ussopmm.ems.store.config;

import com.datastax.oss.driver.api.core.CqlIdentifier;
import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.CqlSessionBuilder;
import io.ussopmm.ems.store.TimeSeriesStore;
import io.ussopmm.ems.store.cassandra.CassandraTimeSeriesStore;
import io.ussopmm.ems.store.cassandra.TimeSeriesSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.data.cassandra.core.CassandraOperations;
import java.time.Clock;

@Slf4j
@Configuration
@EnableConfigurationProperties(StoreProperties.class)
public class TimeSeriesStoreConfig {

    // NOTE: the keyspace may not exist yet, so the schema runs on a bootstrap session without one
    @Bean
    @Profile("!test")
    public CqlSession cqlSession(ObjectProvider<CqlSessionBuilder> builders, StoreProperties properties) {
        try (CqlSession bootstrap = builders.getObject().withKeyspace((CqlIdentifier) null).build()) {
            for (String cql : new TimeSeriesSchema(properties).statements()) {
                bootstrap.execute(cql);
            }
        }
        log.info("Schema of keyspace {} is up to date", properties.getKeyspace());
        return builders.getObject().withKeyspace(properties.getKeyspace()).build();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(TimeSeriesStore.class)
    public TimeSeriesStore timeSeriesStore(CassandraOperations cassandraOperations,
                                           StoreProperties properties,
                                           Clock clock) {
        return new CassandraTimeSeriesStore(cassandraOperations, properties, clock);
    }
}
