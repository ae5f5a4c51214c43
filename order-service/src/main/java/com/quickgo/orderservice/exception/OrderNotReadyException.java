package com.quickgo.orderservice.exception;

/**
 * The order is no longer READY and unassigned (cancelled, or assigned elsewhere),
 * or a pickup was attempted without an assigned driver.
 * HTTP Status: 422 Unprocessable Entity
 */
public class OrderNotReadyException extends RuntimeException {

    public OrderNotReadyException(String message) {
        super(message);
    }
}
