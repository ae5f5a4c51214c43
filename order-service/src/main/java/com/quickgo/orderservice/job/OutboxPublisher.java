package com.quickgo.orderservice.job;

import com.quickgo.orderservice.config.AmqpConfig;
import com.quickgo.orderservice.model.OutboxEvent;
import com.quickgo.orderservice.repository.OutboxRepository;
import com.quickgo.orderservice.service.TimerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageBuilder;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;

/**
 * Relays queued notifications to {@code order_events_exchange}. Every message carries the
 * outbox row id as its message id, so consumers can drop the duplicates a crash between
 * send and commit may produce.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

  static final String HEADER_AGGREGATE_TYPE = "x-aggregate-type";
  static final String HEADER_AGGREGATE_ID = "x-aggregate-id";

  private static final Duration RETENTION = Duration.ofDays(1);

  private final OutboxRepository outboxRepository;
  private final RabbitTemplate rabbitTemplate;
  private final TimerService timerService;

  @Value("${quickgo.outbox.max-attempts:10}")
  private int maxAttempts = 10;

  @Scheduled(fixedDelayString = "${quickgo.outbox.publish-interval-ms:2000}")
  @Transactional
  public void publishOutboxEvents() {
    List<OutboxEvent> events = outboxRepository.findTop50ByProcessedFalseAndAttemptsLessThanOrderByCreatedAtAsc(maxAttempts);
    if (events.isEmpty()) {
      return;
    }

    log.debug("Relaying {} outbox events", events.size());

    for (OutboxEvent event : events) {
      try {
        rabbitTemplate.send(AmqpConfig.ORDER_EXCHANGE, event.getType(), toMessage(event));
        event.markPublished(timerService.now());
        log.info("Notification published: id={}, routingKey={}, {}={}",
            event.getId(), event.getType(), event.getAggregateType(), event.getAggregateId());
      } catch (Exception e) {
        event.recordFailure(e);
        if (event.getAttempts() >= maxAttempts) {
          log.error("Outbox event parked after {} attempts: id={}, routingKey={}",
              event.getAttempts(), event.getId(), event.getType(), e);
        } else {
          log.warn("Failed to publish outbox event, will retry: id={}, attempt={}, error={}",
              event.getId(), event.getAttempts(), e.getMessage());
        }
      }
      outboxRepository.save(event);
    }
  }

  @Scheduled(cron = "${quickgo.outbox.cleanup-cron:0 0 3 * * *}")
  @Transactional
  public void cleanupProcessedEvents() {
    Instant cutoff = timerService.now().minus(RETENTION);
    log.info("Cleaning up outbox events published before {}", cutoff);

    int totalDeleted = 0;
    List<OutboxEvent> batch;
    while (!(batch = outboxRepository.findTop1000ByProcessedTrueAndPublishedAtBefore(cutoff)).isEmpty()) {
      outboxRepository.deleteAll(batch);
      totalDeleted += batch.size();
    }

    long parked = outboxRepository.countByProcessedFalseAndAttemptsGreaterThanEqual(maxAttempts);
    if (parked > 0) {
      log.warn("{} outbox events are parked and need manual attention", parked);
    }
    log.info("Outbox cleanup completed: deleted={}", totalDeleted);
  }

  private Message toMessage(OutboxEvent event) {
    // payload is stored as JSON already
    return MessageBuilder.withBody(event.getPayload().getBytes(StandardCharsets.UTF_8))
        .setContentType(MessageProperties.CONTENT_TYPE_JSON)
        .setContentEncoding(StandardCharsets.UTF_8.name())
        .setMessageId(event.getId().toString())
        .setTimestamp(Date.from(event.getCreatedAt()))
        .setDeliveryMode(MessageDeliveryMode.PERSISTENT)
        .setHeader(HEADER_AGGREGATE_TYPE, event.getAggregateType())
        .setHeader(HEADER_AGGREGATE_ID, event.getAggregateId())
        .build();
  }
}
