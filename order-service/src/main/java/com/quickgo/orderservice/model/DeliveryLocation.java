package com.quickgo.orderservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One GPS fix reported by a driver while carrying an order. Append-only; the latest row
 * per order is the trail's head, the driver's current position lives on DriverAvailability.
 */
@Entity
@Table(name = "delivery_locations", indexes = {
        @Index(name = "idx_delivery_locations_order", columnList = "order_id, recorded_at"),
        @Index(name = "idx_delivery_locations_driver", columnList = "driver_id, recorded_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryLocation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "order_id", nullable = false, updatable = false)
    private Long orderId;

    @Column(name = "driver_id", nullable = false, updatable = false)
    private Long driverId;

    @Column(nullable = false)
    private Double latitude;

    @Column(nullable = false)
    private Double longitude;

    // metres, as reported by the device
    private Double accuracy;

    @Column(name = "speed_kmh")
    private Double speedKmh;

    // degrees clockwise from north
    private Double heading;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;
}
