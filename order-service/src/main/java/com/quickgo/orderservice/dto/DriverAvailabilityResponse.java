package com.quickgo.orderservice.dto;

import lombok.Data;

import java.time.Instant;

@Data
public class DriverAvailabilityResponse {
    private Long driverId;
    private boolean available;
    private boolean online;
    private Double latitude;
    private Double longitude;
    private Instant locationUpdatedAt;
    private Long currentOrderId;
    private Instant lastAssignedAt;
    private int totalDeliveries;
}
