package io.ussopmm.ems.collector;

import io.ussopmm.ems.store.config.TimeSeriesStoreConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import(TimeSeriesStoreConfig.class)
public class TelemetryCollectorServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(TelemetryCollectorServiceApplication.class, args);
    }

}
