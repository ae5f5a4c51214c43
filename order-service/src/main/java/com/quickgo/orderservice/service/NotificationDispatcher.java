package com.quickgo.orderservice.service;

import com.quickgo.orderservice.model.Order;

import java.util.Map;

/**
 * Best effort delivery of order events to customer, driver, restaurant and operator channels.
 * Implementations never throw: a notification failure must not undo a state change.
 */
public interface NotificationDispatcher {

    void notify(String recipientId, NotificationEventType eventType, Order order, Map<String, Object> payload);

    default void notify(String recipientId, NotificationEventType eventType, Order order) {
        notify(recipientId, eventType, order, Map.of());
    }
}
