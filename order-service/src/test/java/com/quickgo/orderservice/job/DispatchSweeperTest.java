package com.quickgo.orderservice.job;

import com.quickgo.orderservice.config.SweeperProperties;
import com.quickgo.orderservice.repository.DispatchOfferRepository;
import com.quickgo.orderservice.repository.OrderRepository;
import com.quickgo.orderservice.service.DispatchAttempt;
import com.quickgo.orderservice.service.DispatchService;
import com.quickgo.orderservice.service.OrderLifecycleService;
import com.quickgo.orderservice.service.TimerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("DispatchSweeper Unit Tests")
class DispatchSweeperTest {

    private static final Instant NOW = Instant.parse("2024-05-17T12:00:00Z");

    @Mock
    private DispatchOfferRepository offerRepository;
    @Mock
    private OrderRepository orderRepository;
    @Mock
    private DispatchService dispatchService;
    @Mock
    private OrderLifecycleService orderLifecycleService;
    @Spy
    private SweeperProperties sweeperProperties = new SweeperProperties();
    @Mock
    private TimerService timerService;

    @InjectMocks
    private DispatchSweeper sweeper;

    @BeforeEach
    void setUp() {
        lenient().when(timerService.now()).thenReturn(NOW);
    }

    @Test
    @DisplayName("expires every overdue offer and keeps going after a failure")
    void shouldExpireOverdueOffers() {
        UUID failing = UUID.randomUUID();
        UUID ok = UUID.randomUUID();
        UUID alreadyDecided = UUID.randomUUID();
        when(offerRepository.findOverdueOfferIds(NOW)).thenReturn(List.of(failing, ok, alreadyDecided));
        when(dispatchService.expireOffer(failing)).thenThrow(new IllegalStateException("db hiccup"));
        when(dispatchService.expireOffer(ok)).thenReturn(true);
        when(dispatchService.expireOffer(alreadyDecided)).thenReturn(false);

        assertThat(sweeper.expireOverdueOffers(NOW)).isEqualTo(1);
        verify(dispatchService, times(3)).expireOffer(any(UUID.class));
    }

    @Test
    @DisplayName("flags PENDING orders older than the confirmation window")
    void shouldFlagOverdueConfirmations() {
        when(orderRepository.findOverduePendingOrderIds(NOW.minus(Duration.ofMinutes(10)))).thenReturn(List.of(1L, 2L));
        when(orderLifecycleService.flagConfirmationOverdue(1L)).thenReturn(true);
        when(orderLifecycleService.flagConfirmationOverdue(2L)).thenReturn(false);

        assertThat(sweeper.flagOverdueConfirmations(NOW)).isEqualTo(1);
    }

    @Test
    @DisplayName("dispatches stalled READY orders again")
    void shouldRedispatchStalledOrders() {
        when(orderRepository.findStalledReadyOrderIds()).thenReturn(List.of(5L, 6L));
        when(dispatchService.requestDispatch(5L)).thenReturn(DispatchAttempt.offered(UUID.randomUUID(), 1L, NOW));
        when(dispatchService.requestDispatch(6L)).thenReturn(DispatchAttempt.skipped());

        assertThat(sweeper.redispatchStalledOrders()).isEqualTo(1);
    }

    @Test
    @DisplayName("a full sweep runs all three steps")
    void shouldRunAllSteps() {
        when(offerRepository.findOverdueOfferIds(NOW)).thenReturn(List.of());
        when(orderRepository.findOverduePendingOrderIds(any())).thenReturn(List.of());
        when(orderRepository.findStalledReadyOrderIds()).thenReturn(List.of());

        sweeper.sweep();

        verify(offerRepository).findOverdueOfferIds(NOW);
        verify(orderRepository).findOverduePendingOrderIds(NOW.minus(Duration.ofMinutes(10)));
        verify(orderRepository).findStalledReadyOrderIds();
    }
}
