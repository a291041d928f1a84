package io.ussopmm.ems.query.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "ems.query")
public class QueryProperties {

    /** Upper bound for one series query, paging included. */
    private Duration timeout = Duration.ofSeconds(10);
}
