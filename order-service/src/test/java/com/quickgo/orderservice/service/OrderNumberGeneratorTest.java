package com.quickgo.orderservice.service;

import com.quickgo.orderservice.repository.OrderRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("OrderNumberGenerator Unit Tests")
class OrderNumberGeneratorTest {

    private static final Instant NOW = Instant.parse("2024-05-17T23:59:59Z");

    @Mock
    private OrderRepository orderRepository;

    @InjectMocks
    private OrderNumberGenerator generator;

    @Test
    @DisplayName("should prefix the UTC day and pad the sequence value")
    void shouldFormatNumber() {
        when(orderRepository.nextOrderSequence()).thenReturn(42L);

        assertThat(generator.next(NOW)).isEqualTo("ORD-20240517-000042");
    }

    @Test
    @DisplayName("should never repeat a number within one instant")
    void shouldNotRepeatWithinOneInstant() {
        AtomicLong sequence = new AtomicLong();
        when(orderRepository.nextOrderSequence()).thenAnswer(i -> sequence.incrementAndGet());

        Set<String> seen = new HashSet<>();
        int duplicates = 0;
        for (int i = 0; i < 300_000; i++) {
            if (!seen.add(generator.next(NOW))) {
                duplicates++;
            }
        }

        assertThat(duplicates).isZero();
        assertThat(seen).hasSize(300_000);
    }

    @Test
    @DisplayName("should keep digits beyond the padding width")
    void shouldKeepLargeSequenceValues() {
        assertThat(OrderNumberGenerator.format(NOW, 12_345_678L)).isEqualTo("ORD-20240517-12345678");
    }
}
