package com.quickgo.orderservice.dto;

import com.quickgo.orderservice.model.IssueType;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
public class DeliveryIssueResponse {
    private UUID id;
    private Long orderId;
    private Long driverId;
    private IssueType issueType;
    private String description;
    private boolean resolved;
    private String resolutionNotes;
    private Long resolvedBy;
    private Instant resolvedAt;
    private Instant createdAt;
}
