package com.quickgo.orderservice.exception;

import com.quickgo.orderservice.model.OrderStatus;
import lombok.Getter;

/**
 * Cancellation requested outside PENDING/CONFIRMED. The current status is surfaced to the caller.
 * HTTP Status: 422 Unprocessable Entity
 */
@Getter
public class NotCancellableException extends RuntimeException {

    private final OrderStatus currentStatus;

    public NotCancellableException(Long orderId, OrderStatus currentStatus) {
        super(String.format("Order %d cannot be cancelled in status %s", orderId, currentStatus));
        this.currentStatus = currentStatus;
    }
}
