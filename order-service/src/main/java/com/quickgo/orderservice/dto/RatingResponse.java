package com.quickgo.orderservice.dto;

import lombok.Data;

import java.time.Instant;

@Data
public class RatingResponse {
    private Long orderId;
    private Integer overallRating;
    private Integer foodRating;
    private Integer deliveryRating;
    private Integer driverRating;
    private String driverComment;
    private String comment;
    private boolean wouldOrderAgain;
    private Instant createdAt;
}
