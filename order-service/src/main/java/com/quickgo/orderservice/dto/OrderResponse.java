package com.quickgo.orderservice.dto;

import com.quickgo.orderservice.model.CancellationReason;
import com.quickgo.orderservice.model.DeliveryAddress;
import com.quickgo.orderservice.model.EscalationReason;
import com.quickgo.orderservice.model.GeoPoint;
import com.quickgo.orderservice.model.OrderStatus;
import com.quickgo.orderservice.model.PaymentMethod;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Data
public class OrderResponse {
    private Long id;
    private String orderNumber;
    private Long customerId;
    private Long restaurantId;
    private Long driverId;
    private OrderStatus status;

    private List<OrderItemResponse> items;
    private int totalItems;

    private BigDecimal subtotal;
    private BigDecimal deliveryFee;
    private BigDecimal serviceFee;
    private BigDecimal tax;
    private BigDecimal discount;
    private BigDecimal tip;
    private BigDecimal total;

    private DeliveryAddress deliveryAddress;
    private GeoPoint pickupLocation;

    private PaymentMethod paymentMethod;
    private boolean paid;
    private Instant paidAt;

    private String specialInstructions;
    private Instant estimatedDeliveryTime;

    private Instant createdAt;
    private Instant confirmedAt;
    private Instant preparingAt;
    private Instant readyAt;
    private Instant assignedAt;
    private Instant pickedUpAt;
    private Instant inTransitAt;
    private Instant deliveredAt;
    private Instant cancelledAt;

    private CancellationReason cancellationReason;
    private String cancellationNotes;

    private boolean escalated;
    private EscalationReason escalationReason;
    private int dispatchRounds;

    // Derived flags, filled by the service
    private boolean canBeCancelled;
    private boolean delayed;

    private List<StatusHistoryResponse> statusHistory;
}
