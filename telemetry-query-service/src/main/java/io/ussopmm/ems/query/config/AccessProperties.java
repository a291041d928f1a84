package io.ussopmm.ems.query.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "ems.access")
public class AccessProperties {

    private String username = "admin";

    /** Encoded password with its encoder id, e.g. {@code {bcrypt}$2a$10$...}. */
    private String passwordHash;
}
