package com.quickgo.orderservice.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.quickgo.common.contracts.NotificationContract;
import com.quickgo.orderservice.model.Order;
import com.quickgo.orderservice.model.OrderStatus;
import com.quickgo.orderservice.model.OutboxEvent;
import com.quickgo.orderservice.repository.OutboxRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("OutboxNotificationDispatcher Unit Tests")
class OutboxNotificationDispatcherTest {

    private static final Instant NOW = Instant.parse("2024-05-17T12:00:00Z");

    @Mock
    private OutboxRepository outboxRepository;
    @Spy
    private ObjectMapper objectMapper = new ObjectMapper();
    @Mock
    private TimerService timerService;

    @InjectMocks
    private OutboxNotificationDispatcher dispatcher;

    private Order order;

    @BeforeEach
    void setUp() {
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        lenient().when(timerService.now()).thenReturn(NOW);

        order = new Order();
        order.setId(100L);
        order.setOrderNumber("ORD-20240517-000100");
        order.setStatus(OrderStatus.CONFIRMED);
    }

    @Test
    @DisplayName("should write a notification row routed by event type")
    void shouldWriteOutboxRow() throws Exception {
        dispatcher.notify(Recipients.customer(1L), NotificationEventType.ORDER_CONFIRMED, order, Map.of("eta", 25));

        ArgumentCaptor<OutboxEvent> captor = ArgumentCaptor.forClass(OutboxEvent.class);
        verify(outboxRepository).save(captor.capture());

        OutboxEvent event = captor.getValue();
        assertThat(event.getType()).isEqualTo("notification.order_confirmed");
        assertThat(event.getAggregateType()).isEqualTo("ORDER");
        assertThat(event.getAggregateId()).isEqualTo("100");
        assertThat(event.isProcessed()).isFalse();
        assertThat(event.getCreatedAt()).isEqualTo(NOW);

        NotificationContract contract = objectMapper.readValue(event.getPayload(), NotificationContract.class);
        assertThat(contract.getRecipient()).isEqualTo("customer:1");
        assertThat(contract.getEventType()).isEqualTo("ORDER_CONFIRMED");
        assertThat(contract.getOrderNumber()).isEqualTo("ORD-20240517-000100");
        assertThat(contract.getStatus()).isEqualTo("CONFIRMED");
        assertThat(contract.getPayload()).containsEntry("eta", 25);
        assertThat(contract.getOccurredAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("should never throw when the outbox write fails")
    void shouldSwallowOutboxFailure() {
        when(outboxRepository.save(any())).thenThrow(new IllegalStateException("db down"));

        assertThatCode(() -> dispatcher.notify(Recipients.OPERATORS, NotificationEventType.DISPATCH_ESCALATED, order))
                .doesNotThrowAnyException();
    }
}
