package com.quickgo.orderservice.dto;

import com.quickgo.orderservice.model.OfferOutcome;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
public class DispatchOfferResponse {
    private UUID id;
    private Long orderId;
    private Long driverId;
    private int round;
    private Instant offeredAt;
    private Instant expiresAt;
    private OfferOutcome outcome;
    private Instant decidedAt;
}
