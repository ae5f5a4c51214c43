package com.quickgo.orderservice.exception;

import com.quickgo.orderservice.model.OrderStatus;
import lombok.Getter;

/**
 * Requested status change is not an edge of the lifecycle graph. The order is left untouched.
 * HTTP Status: 422 Unprocessable Entity
 */
@Getter
public class InvalidTransitionException extends RuntimeException {

    private final OrderStatus from;
    private final OrderStatus to;

    public InvalidTransitionException(Long orderId, OrderStatus from, OrderStatus to) {
        super(String.format("Order %d cannot move from %s to %s", orderId, from, to));
        this.from = from;
        this.to = to;
    }
}
