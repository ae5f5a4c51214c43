package com.quickgo.orderservice.service;

import com.quickgo.orderservice.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Human readable order numbers: ORD-20240517-000042.
 * The numeric part is a database sequence value, so two orders never share a number
 * regardless of the day prefix.
 */
@Component
@RequiredArgsConstructor
public class OrderNumberGenerator {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);

    private final OrderRepository orderRepository;

    public String next(Instant now) {
        return format(now, orderRepository.nextOrderSequence());
    }

    static String format(Instant now, long sequence) {
        return String.format(Locale.ROOT, "ORD-%s-%06d", DAY.format(now), sequence);
    }
}
