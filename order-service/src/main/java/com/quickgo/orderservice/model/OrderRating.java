package com.quickgo.orderservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "order_ratings")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderRating {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // One rating per order
    @Column(name = "order_id", nullable = false, unique = true)
    private Long orderId;

    @Column(name = "customer_id", nullable = false)
    private Long customerId;

    @Column(name = "driver_id")
    private Long driverId;

    @Column(name = "overall_rating", nullable = false)
    private Integer overallRating;

    @Column(name = "food_rating", nullable = false)
    private Integer foodRating;

    @Column(name = "delivery_rating", nullable = false)
    private Integer deliveryRating;

    @Column(name = "driver_rating")
    private Integer driverRating;

    @Column(name = "driver_comment", length = 1000)
    private String driverComment;

    @Column(length = 2000)
    private String comment;

    @Column(name = "would_order_again", nullable = false)
    private boolean wouldOrderAgain;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
