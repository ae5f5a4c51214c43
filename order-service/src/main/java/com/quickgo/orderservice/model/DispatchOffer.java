package com.quickgo.orderservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

/**
 * A time-bounded proposal of one order to one driver.
 * The outcome only leaves PENDING through a conditional update, so a decided
 * offer never changes again.
 */
@Entity
@Table(name = "dispatch_offers", indexes = {
        @Index(name = "idx_offer_order", columnList = "order_id"),
        @Index(name = "idx_offer_driver_outcome", columnList = "driver_id, outcome")
})
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DispatchOffer {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @ToString.Include
    private UUID id;

    @Column(name = "order_id", nullable = false, updatable = false)
    @ToString.Include
    private Long orderId;

    @Column(name = "driver_id", nullable = false, updatable = false)
    @ToString.Include
    private Long driverId;

    @Column(nullable = false, updatable = false)
    private int round;

    @Column(name = "offered_at", nullable = false, updatable = false)
    private Instant offeredAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @ToString.Include
    private OfferOutcome outcome = OfferOutcome.PENDING;

    @Column(name = "decided_at")
    private Instant decidedAt;

    public boolean isPending() {
        return outcome == OfferOutcome.PENDING;
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
