package com.quickgo.orderservice.dto;

import com.quickgo.orderservice.model.DeliveryAddress;
import com.quickgo.orderservice.model.PaymentMethod;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

@Data
public class CreateOrderRequest {

    @NotNull(message = "Restaurant ID cannot be null")
    private Long restaurantId;

    @NotNull(message = "Delivery address cannot be null")
    @Valid
    private DeliveryAddress deliveryAddress;

    @NotEmpty(message = "Order must contain at least one item")
    @Valid
    private List<OrderItemRequest> items;

    @NotNull(message = "Payment method cannot be null")
    private PaymentMethod paymentMethod;

    @DecimalMin(value = "0.00", message = "Tip cannot be negative")
    private BigDecimal tip;

    @Size(max = 1000)
    private String specialInstructions;

    // Total the client displayed at checkout; a mismatch with the server total rejects the order
    private BigDecimal expectedTotal;
}
