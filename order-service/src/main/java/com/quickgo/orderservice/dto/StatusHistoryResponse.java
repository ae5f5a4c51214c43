package com.quickgo.orderservice.dto;

import com.quickgo.orderservice.model.OrderStatus;
import com.quickgo.orderservice.security.ActorRole;
import lombok.Data;

import java.time.Instant;

@Data
public class StatusHistoryResponse {
    private OrderStatus status;
    private Long actorId;
    private ActorRole actorRole;
    private String notes;
    private Instant createdAt;
}
