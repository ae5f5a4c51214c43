package com.quickgo.orderservice.model;

public enum CancellationReason {
    CUSTOMER_REQUEST,
    RESTAURANT_UNAVAILABLE,
    DRIVER_UNAVAILABLE,
    PAYMENT_FAILED,
    WRONG_ORDER,
    LONG_WAIT,
    OTHER
}
