package com.quickgo.orderservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;

@Configuration
@ConfigurationProperties(prefix = "quickgo.pricing")
@Data
public class PricingProperties {

    private BigDecimal serviceFee = new BigDecimal("0.50");

    // Applied to the subtotal
    private BigDecimal taxRate = new BigDecimal("0.12");

    private int defaultPreparationMinutes = 20;

    private double averageSpeedKmh = 30.0;
}
