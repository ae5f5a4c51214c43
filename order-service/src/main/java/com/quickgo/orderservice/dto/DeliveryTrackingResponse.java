package com.quickgo.orderservice.dto;

import com.quickgo.orderservice.model.DeliveryAddress;
import com.quickgo.orderservice.model.GeoPoint;
import com.quickgo.orderservice.model.OrderStatus;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Live view of one delivery. The driver's position is only shown while the order is
 * still open and a driver is assigned.
 */
@Data
public class DeliveryTrackingResponse {
    private Long orderId;
    private String orderNumber;
    private OrderStatus status;
    private Long driverId;
    private GeoPoint pickupLocation;
    private DeliveryAddress deliveryAddress;
    private DeliveryLocationResponse driverLocation;
    // straight line from the driver to the drop-off, null without a driver position
    private Double distanceToDestinationKm;
    private Instant estimatedDeliveryTime;
    private boolean delayed;
    private List<StatusHistoryResponse> timeline;
}
