package com.quickgo.orderservice.job;

import com.quickgo.orderservice.model.OutboxEvent;
import com.quickgo.orderservice.repository.OutboxRepository;
import com.quickgo.orderservice.service.TimerService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("OutboxPublisher Unit Tests")
class OutboxPublisherTest {

  private static final Instant NOW = Instant.parse("2024-05-17T12:00:00Z");

  @Mock
  private OutboxRepository outboxRepository;

  @Mock
  private RabbitTemplate rabbitTemplate;

  @Mock
  private TimerService timerService;

  @InjectMocks
  private OutboxPublisher publisher;

  @Nested
  @DisplayName("publishOutboxEvents Tests")
  class PublishOutboxEventsTests {

    @Test
    @DisplayName("should send the stored JSON with the row id as message id")
    void shouldPublishRawJson() {
      // Arrange
      OutboxEvent event = createOutboxEvent("notification.order_confirmed");
      when(outboxRepository.findTop50ByProcessedFalseAndAttemptsLessThanOrderByCreatedAtAsc(10)).thenReturn(List.of(event));
      when(timerService.now()).thenReturn(NOW);

      // Act
      publisher.publishOutboxEvents();

      // Assert
      ArgumentCaptor<Message> captor = ArgumentCaptor.forClass(Message.class);
      verify(rabbitTemplate).send(eq("order_events_exchange"), eq("notification.order_confirmed"), captor.capture());

      Message message = captor.getValue();
      MessageProperties props = message.getMessageProperties();
      assertThat(new String(message.getBody(), StandardCharsets.UTF_8)).isEqualTo(event.getPayload());
      assertThat(props.getContentType()).isEqualTo(MessageProperties.CONTENT_TYPE_JSON);
      assertThat(props.getMessageId()).isEqualTo(event.getId().toString());
      assertThat(props.getDeliveryMode()).isEqualTo(MessageDeliveryMode.PERSISTENT);
      assertThat((String) props.getHeader(OutboxPublisher.HEADER_AGGREGATE_ID)).isEqualTo("100");

      assertThat(event.isProcessed()).isTrue();
      assertThat(event.getPublishedAt()).isEqualTo(NOW);
      verify(outboxRepository).save(event);
    }

    @Test
    @DisplayName("should record the failure and keep going with the next event")
    void shouldRecordFailureAndContinue() {
      // Arrange
      OutboxEvent event1 = createOutboxEvent("notification.offer_created");
      OutboxEvent event2 = createOutboxEvent("notification.driver_assigned");
      when(outboxRepository.findTop50ByProcessedFalseAndAttemptsLessThanOrderByCreatedAtAsc(10)).thenReturn(List.of(event1, event2));
      when(timerService.now()).thenReturn(NOW);

      doThrow(new AmqpConnectException(new ConnectException("Connection refused")))
          .doNothing()
          .when(rabbitTemplate).send(eq("order_events_exchange"), anyString(), any(Message.class));

      // Act
      publisher.publishOutboxEvents();

      // Assert
      verify(rabbitTemplate, times(2)).send(eq("order_events_exchange"), anyString(), any(Message.class));
      assertThat(event1.isProcessed()).isFalse();
      assertThat(event1.getAttempts()).isEqualTo(1);
      assertThat(event1.getLastError()).startsWith("AmqpConnectException");
      assertThat(event2.isProcessed()).isTrue();
      verify(outboxRepository).save(event1);
      verify(outboxRepository).save(event2);
    }

    @Test
    @DisplayName("should park an event once it reaches the attempt limit")
    void shouldParkAfterLastAttempt() {
      OutboxEvent event = createOutboxEvent("notification.order_cancelled");
      event.setAttempts(9);
      when(outboxRepository.findTop50ByProcessedFalseAndAttemptsLessThanOrderByCreatedAtAsc(10)).thenReturn(List.of(event));
      doThrow(new AmqpConnectException(new ConnectException("Connection refused")))
          .when(rabbitTemplate).send(anyString(), anyString(), any(Message.class));

      publisher.publishOutboxEvents();

      assertThat(event.getAttempts()).isEqualTo(10);
      assertThat(event.isProcessed()).isFalse();
      assertThat(event.getPublishedAt()).isNull();
    }

    @Test
    @DisplayName("should do nothing when no events to process")
    void shouldDoNothingWhenNoEvents() {
      when(outboxRepository.findTop50ByProcessedFalseAndAttemptsLessThanOrderByCreatedAtAsc(10)).thenReturn(List.of());

      publisher.publishOutboxEvents();

      verifyNoInteractions(rabbitTemplate);
      verify(outboxRepository, never()).save(any());
    }
  }

  @Nested
  @DisplayName("cleanupProcessedEvents Tests")
  class CleanupTests {

    @Test
    @DisplayName("should delete events published more than a day ago in batches")
    void shouldDeleteInBatches() {
      Instant cutoff = NOW.minusSeconds(24 * 3600);
      when(timerService.now()).thenReturn(NOW);
      List<OutboxEvent> batch = List.of(createOutboxEvent("a"), createOutboxEvent("b"));
      when(outboxRepository.findTop1000ByProcessedTrueAndPublishedAtBefore(cutoff))
          .thenReturn(batch)
          .thenReturn(List.of());

      publisher.cleanupProcessedEvents();

      verify(outboxRepository).deleteAll(batch);
      verify(outboxRepository, times(2)).findTop1000ByProcessedTrueAndPublishedAtBefore(cutoff);
      verify(outboxRepository).countByProcessedFalseAndAttemptsGreaterThanEqual(10);
    }
  }

  private OutboxEvent createOutboxEvent(String type) {
    return OutboxEvent.builder()
        .id(UUID.randomUUID())
        .aggregateType("ORDER")
        .aggregateId("100")
        .type(type)
        .payload("{\"recipient\":\"customer:1\",\"eventType\":\"ORDER_CONFIRMED\",\"orderId\":100}")
        .createdAt(NOW)
        .processed(false)
        .build();
  }
}
