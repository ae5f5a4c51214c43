package com.quickgo.orderservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "quickgo.sweeper")
@Data
public class SweeperProperties {

    // Tick of DispatchSweeper, read by @Scheduled through the same property key
    private long intervalMs = 60_000;

    // PENDING longer than this gets flagged for operators
    private Duration confirmationSla = Duration.ofMinutes(10);
}
