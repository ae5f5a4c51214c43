package com.quickgo.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Contract for notifications about an order or a dispatch offer.
 *
 * Published by order-service for every status change, offer and escalation.
 * Push/in-app delivery subscribes on the event type routing key and fans out
 * to the recipient channel.
 *
 * Recipient format:
 * - customer:<id>
 * - driver:<id>
 * - restaurant:<id>
 * - operators
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationContract {
    private String recipient;
    private String eventType;      // ORDER_CREATED, OFFER_CREATED, ORDER_ASSIGNED ...
    private Long orderId;
    private String orderNumber;
    private String status;         // order status at the time of the event, nullable
    private Map<String, Object> payload;
    private Instant occurredAt;
}
