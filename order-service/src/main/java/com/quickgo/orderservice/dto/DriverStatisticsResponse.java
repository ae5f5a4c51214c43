package com.quickgo.orderservice.dto;

import lombok.Data;

import java.math.BigDecimal;

@Data
public class DriverStatisticsResponse {
    private Long driverId;
    private int totalDeliveries;
    private long activeDeliveries;
    private long deliveriesToday;
    private BigDecimal tipsEarned;
    private BigDecimal tipsToday;
    // assignment to hand-over, null until the first delivery
    private Double averageDeliveryMinutes;
}
