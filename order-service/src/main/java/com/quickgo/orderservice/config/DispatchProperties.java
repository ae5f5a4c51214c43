package com.quickgo.orderservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Dispatch tunables, bound from quickgo.dispatch.* in application.yml.
 */
@Configuration
@ConfigurationProperties(prefix = "quickgo.dispatch")
@Data
public class DispatchProperties {

    // How long one driver has to answer an offer
    private Duration offerTimeout = Duration.ofSeconds(30);

    private double maxRadiusKm = 10.0;

    // Locations older than this are not dispatchable
    private Duration locationFreshness = Duration.ofMinutes(5);

    // Rounds before the order is escalated for manual dispatch
    private int maxRounds = 5;

    // Retry delay after a round that found no candidate
    private Duration noDriverBackoff = Duration.ofSeconds(60);

    // A driver who declined or let an offer expire is skipped for this order this long
    private Duration declineCooldown = Duration.ofMinutes(15);
}
