package com.quickgo.orderservice.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quickgo.common.contracts.NotificationContract;
import com.quickgo.orderservice.model.Order;
import com.quickgo.orderservice.model.OutboxEvent;
import com.quickgo.orderservice.repository.OutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;

/**
 * Writes notifications to the outbox table inside the caller's transaction.
 * OutboxPublisher relays them to RabbitMQ, so a notification is only sent
 * if the state change that produced it committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxNotificationDispatcher implements NotificationDispatcher {

    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;
    private final TimerService timerService;

    @Override
    public void notify(String recipientId, NotificationEventType eventType, Order order, Map<String, Object> payload) {
        try {
            Instant now = timerService.now();
            NotificationContract contract = NotificationContract.builder()
                    .recipient(recipientId)
                    .eventType(eventType.name())
                    .orderId(order.getId())
                    .orderNumber(order.getOrderNumber())
                    .status(order.getStatus() != null ? order.getStatus().name() : null)
                    .payload(payload)
                    .occurredAt(now)
                    .build();

            OutboxEvent event = OutboxEvent.builder()
                    .aggregateType("ORDER")
                    .aggregateId(String.valueOf(order.getId()))
                    .type(eventType.routingKey())
                    .payload(objectMapper.writeValueAsString(contract))
                    .createdAt(now)
                    .processed(false)
                    .build();

            outboxRepository.save(event);
            log.debug("Notification queued: recipient={}, type={}, orderId={}", recipientId, eventType, order.getId());
        } catch (Exception e) {
            log.error("Failed to queue notification: recipient={}, type={}, orderId={}, error={}",
                    recipientId, eventType, order.getId(), e.getMessage(), e);
        }
    }
}
