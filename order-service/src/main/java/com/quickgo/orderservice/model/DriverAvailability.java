package com.quickgo.orderservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * Single source of truth for a driver's dispatch state.
 *
 * Invariants:
 * - online implies available (checked on every write)
 * - currentOrderId is the assignment slot; it is only claimed through a
 *   conditional update that requires the slot to be empty
 */
@Entity
@Table(name = "driver_availability")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriverAvailability {

    @Id // JWT subject of the driver
    @ToString.Include
    private Long driverId;

    @Builder.Default
    @Column(nullable = false)
    @ToString.Include
    private boolean available = false;

    @Builder.Default
    @Column(nullable = false)
    @ToString.Include
    private boolean online = false;

    @Column(name = "current_latitude")
    private Double latitude;

    @Column(name = "current_longitude")
    private Double longitude;

    @Column(name = "location_updated_at")
    private Instant locationUpdatedAt;

    // Assignment slot: the one non-terminal order this driver carries
    @Column(name = "current_order_id")
    @ToString.Include
    private Long currentOrderId;

    @Column(name = "last_assigned_at")
    private Instant lastAssignedAt;

    @Builder.Default
    @Column(name = "total_deliveries", nullable = false)
    private int totalDeliveries = 0;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    public boolean hasLocation() {
        return latitude != null && longitude != null;
    }

    public boolean isBusy() {
        return currentOrderId != null;
    }

    @PrePersist
    @PreUpdate
    void checkOnlineImpliesAvailable() {
        if (online && !available) {
            throw new IllegalStateException("Driver " + driverId + " cannot be online while unavailable");
        }
    }
}
