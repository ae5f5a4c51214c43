package com.quickgo.orderservice.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class OrderStatusTest {

    @Test
    void happyPathEdgesAreAllowed() {
        assertThat(OrderStatus.PENDING.canTransitionTo(OrderStatus.CONFIRMED)).isTrue();
        assertThat(OrderStatus.CONFIRMED.canTransitionTo(OrderStatus.PREPARING)).isTrue();
        assertThat(OrderStatus.PREPARING.canTransitionTo(OrderStatus.READY)).isTrue();
        assertThat(OrderStatus.READY.canTransitionTo(OrderStatus.PICKED_UP)).isTrue();
        assertThat(OrderStatus.PICKED_UP.canTransitionTo(OrderStatus.IN_TRANSIT)).isTrue();
        assertThat(OrderStatus.IN_TRANSIT.canTransitionTo(OrderStatus.DELIVERED)).isTrue();
    }

    @Test
    void cancellationOnlyBeforePreparing() {
        assertThat(OrderStatus.PENDING.canTransitionTo(OrderStatus.CANCELLED)).isTrue();
        assertThat(OrderStatus.CONFIRMED.canTransitionTo(OrderStatus.CANCELLED)).isTrue();
        assertThat(OrderStatus.PREPARING.canTransitionTo(OrderStatus.CANCELLED)).isFalse();
        assertThat(OrderStatus.READY.canTransitionTo(OrderStatus.CANCELLED)).isFalse();
    }

    @Test
    void skippingAndGoingBackAreRejected() {
        assertThat(OrderStatus.PENDING.canTransitionTo(OrderStatus.READY)).isFalse();
        assertThat(OrderStatus.READY.canTransitionTo(OrderStatus.PREPARING)).isFalse();
        assertThat(OrderStatus.IN_TRANSIT.canTransitionTo(OrderStatus.PICKED_UP)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(value = OrderStatus.class, names = {"DELIVERED", "CANCELLED"})
    void terminalStatusesHaveNoOutgoingEdges(OrderStatus status) {
        assertThat(status.isTerminal()).isTrue();
        assertThat(status.allowedTargets()).isEmpty();
    }

    @Test
    void activeAndTerminalPartitionAllStatuses() {
        assertThat(OrderStatus.activeStatuses()).doesNotContainAnyElementsOf(OrderStatus.terminalStatuses());
        assertThat(OrderStatus.activeStatuses().size() + OrderStatus.terminalStatuses().size())
                .isEqualTo(OrderStatus.values().length);
    }
}
