package com.quickgo.orderservice.service;

import com.quickgo.orderservice.config.PricingProperties;
import com.quickgo.orderservice.model.GeoPoint;
import com.quickgo.orderservice.model.Order;
import com.quickgo.orderservice.model.RestaurantSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

@Service
@RequiredArgsConstructor
public class PricingService {

    private final PricingProperties pricingProperties;

    /**
     * Fills every money field of a new order from its line items and the restaurant snapshot.
     * Items must already be attached.
     */
    public void price(Order order, RestaurantSnapshot restaurant, BigDecimal tip) {
        // First pass computes the subtotal the tax is based on
        order.recalculateTotals();

        order.setDeliveryFee(Order.money(restaurant.getDeliveryFee()));
        order.setServiceFee(Order.money(pricingProperties.getServiceFee()));
        order.setTax(Order.money(order.getSubtotal().multiply(pricingProperties.getTaxRate())));
        order.setTip(Order.money(tip));
        order.setDiscount(Order.money(BigDecimal.ZERO));

        order.recalculateTotals();
    }

    /**
     * Preparation time plus straight-line travel from the restaurant at the average driver speed.
     */
    public Instant estimateDeliveryTime(Instant createdAt, RestaurantSnapshot restaurant, GeoPoint destination) {
        int preparationMinutes = restaurant.getPreparationMinutes() != null
                ? restaurant.getPreparationMinutes()
                : pricingProperties.getDefaultPreparationMinutes();

        double distanceKm = GeoUtils.distanceKm(restaurant.location(), destination);
        long travelMinutes = Math.round(distanceKm / pricingProperties.getAverageSpeedKmh() * 60);

        return createdAt.plus(Duration.ofMinutes(preparationMinutes + travelMinutes));
    }
}
