package com.quickgo.orderservice.dto;

import lombok.Data;

import java.time.Instant;

@Data
public class DeliveryLocationResponse {
    private Double latitude;
    private Double longitude;
    private Double accuracy;
    private Double speedKmh;
    private Double heading;
    private Instant recordedAt;
}
