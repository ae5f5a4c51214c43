package com.quickgo.orderservice.model;

public enum PaymentMethod {
    CASH,
    CARD,
    ONLINE
}
