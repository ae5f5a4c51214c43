package com.quickgo.orderservice.service;

import com.quickgo.orderservice.config.PricingProperties;
import com.quickgo.orderservice.model.GeoPoint;
import com.quickgo.orderservice.model.Order;
import com.quickgo.orderservice.model.OrderItem;
import com.quickgo.orderservice.model.RestaurantSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PricingService Unit Tests")
class PricingServiceTest {

    private PricingService pricingService;
    private RestaurantSnapshot restaurant;

    @BeforeEach
    void setUp() {
        pricingService = new PricingService(new PricingProperties());

        restaurant = new RestaurantSnapshot();
        restaurant.setRestaurantId(7L);
        restaurant.setName("Pizzeria");
        restaurant.setLatitude(41.0082);
        restaurant.setLongitude(28.9784);
        restaurant.setAcceptingOrders(true);
        restaurant.setDeliveryFee(new BigDecimal("2.50"));
        restaurant.setPreparationMinutes(15);
    }

    @Test
    @DisplayName("prices a 10.00 cart to 14.20 with default fees and no tip")
    void shouldPriceCart() {
        Order order = new Order();
        OrderItem item = new OrderItem();
        item.setProductId(1L);
        item.setProductName("Margherita");
        item.setUnitPrice(new BigDecimal("5.00"));
        item.setQuantity(2);
        order.addItem(item);

        pricingService.price(order, restaurant, BigDecimal.ZERO);

        assertThat(order.getSubtotal()).isEqualByComparingTo("10.00");
        assertThat(order.getDeliveryFee()).isEqualByComparingTo("2.50");
        assertThat(order.getServiceFee()).isEqualByComparingTo("0.50");
        assertThat(order.getTax()).isEqualByComparingTo("1.20");
        assertThat(order.getDiscount()).isEqualByComparingTo("0.00");
        assertThat(order.getTotal()).isEqualByComparingTo("14.20");
    }

    @Test
    @DisplayName("tip goes straight into the total")
    void shouldAddTip() {
        Order order = new Order();
        OrderItem item = new OrderItem();
        item.setProductId(1L);
        item.setProductName("Margherita");
        item.setUnitPrice(new BigDecimal("10.00"));
        item.setQuantity(1);
        order.addItem(item);

        pricingService.price(order, restaurant, new BigDecimal("2.00"));

        assertThat(order.getTip()).isEqualByComparingTo("2.00");
        assertThat(order.getTotal()).isEqualByComparingTo("16.20");
    }

    @Test
    @DisplayName("estimate is preparation time plus travel at average speed")
    void shouldEstimateDeliveryTime() {
        Instant createdAt = Instant.parse("2024-05-17T12:00:00Z");
        // ~5 km north of the restaurant, 10 minutes at 30 km/h
        GeoPoint destination = GeoPoint.of(41.0082 + 5.0 / 111.195, 28.9784);

        Instant eta = pricingService.estimateDeliveryTime(createdAt, restaurant, destination);

        assertThat(Duration.between(createdAt, eta)).isEqualTo(Duration.ofMinutes(25));
    }

    @Test
    @DisplayName("falls back to the default preparation time")
    void shouldUseDefaultPreparationTime() {
        restaurant.setPreparationMinutes(null);
        Instant createdAt = Instant.parse("2024-05-17T12:00:00Z");

        Instant eta = pricingService.estimateDeliveryTime(createdAt, restaurant, restaurant.location());

        assertThat(Duration.between(createdAt, eta)).isEqualTo(Duration.ofMinutes(20));
    }
}
