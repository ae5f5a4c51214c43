package com.quickgo.orderservice.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;

@Entity
@Table(name = "restaurant_snapshots")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class RestaurantSnapshot {

    @Id // id from the catalog
    @ToString.Include
    private Long restaurantId;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private Double latitude;

    @Column(nullable = false)
    private Double longitude;

    @Column(name = "accepting_orders", nullable = false)
    private boolean acceptingOrders;

    @Column(name = "delivery_fee", nullable = false, precision = 10, scale = 2)
    private BigDecimal deliveryFee;

    // null falls back to quickgo.pricing.default-preparation-minutes
    @Column(name = "preparation_minutes")
    private Integer preparationMinutes;

    public GeoPoint location() {
        return GeoPoint.of(latitude, longitude);
    }
}
