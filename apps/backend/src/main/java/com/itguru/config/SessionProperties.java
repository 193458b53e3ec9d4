package com.itguru.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "itguru.session")
public class SessionProperties {
    private Duration expireAfterAccess = Duration.ofMinutes(30);
    private long maximumSize = 10_000;
}
