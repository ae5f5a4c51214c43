package com.quickgo.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Contract for restaurant.updated events from the catalog.
 * order-service keeps a local snapshot for order validation and pickup location.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RestaurantEventContract {
    private Long restaurantId;
    private String name;
    private Double latitude;
    private Double longitude;
    private boolean acceptingOrders;
    private BigDecimal deliveryFee;
    private Integer preparationMinutes;
}
