package com.quickgo.orderservice.service;

import com.quickgo.orderservice.model.OrderStatus;

import java.util.Locale;

public enum NotificationEventType {
    ORDER_CREATED,
    ORDER_CONFIRMED,
    ORDER_PREPARING,
    ORDER_READY,
    ORDER_PICKED_UP,
    ORDER_IN_TRANSIT,
    ORDER_DELIVERED,
    ORDER_CANCELLED,
    OFFER_CREATED,
    OFFER_WITHDRAWN,
    DRIVER_ASSIGNED,
    DISPATCH_ESCALATED,
    CONFIRMATION_OVERDUE,
    DELIVERY_ISSUE_REPORTED;

    public String routingKey() {
        return "notification." + name().toLowerCase(Locale.ROOT);
    }

    public static NotificationEventType forStatus(OrderStatus status) {
        return switch (status) {
            case PENDING -> ORDER_CREATED;
            case CONFIRMED -> ORDER_CONFIRMED;
            case PREPARING -> ORDER_PREPARING;
            case READY -> ORDER_READY;
            case PICKED_UP -> ORDER_PICKED_UP;
            case IN_TRANSIT -> ORDER_IN_TRANSIT;
            case DELIVERED -> ORDER_DELIVERED;
            case CANCELLED -> ORDER_CANCELLED;
        };
    }
}
