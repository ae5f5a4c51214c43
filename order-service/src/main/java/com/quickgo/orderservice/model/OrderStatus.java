package com.quickgo.orderservice.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Canonical order lifecycle.
 *
 * <pre>
 * PENDING -> CONFIRMED -> PREPARING -> READY -> PICKED_UP -> IN_TRANSIT -> DELIVERED
 * PENDING -> CANCELLED
 * CONFIRMED -> CANCELLED
 * </pre>
 *
 * Any edge not listed in the table is rejected centrally by {@link #canTransitionTo}.
 */
public enum OrderStatus {
    PENDING,
    CONFIRMED,
    PREPARING,
    READY,
    PICKED_UP,
    IN_TRANSIT,
    DELIVERED,
    CANCELLED;

    private static final Map<OrderStatus, Set<OrderStatus>> TRANSITIONS = new EnumMap<>(OrderStatus.class);

    static {
        TRANSITIONS.put(PENDING, EnumSet.of(CONFIRMED, CANCELLED));
        TRANSITIONS.put(CONFIRMED, EnumSet.of(PREPARING, CANCELLED));
        TRANSITIONS.put(PREPARING, EnumSet.of(READY));
        TRANSITIONS.put(READY, EnumSet.of(PICKED_UP));
        TRANSITIONS.put(PICKED_UP, EnumSet.of(IN_TRANSIT));
        TRANSITIONS.put(IN_TRANSIT, EnumSet.of(DELIVERED));
        TRANSITIONS.put(DELIVERED, EnumSet.noneOf(OrderStatus.class));
        TRANSITIONS.put(CANCELLED, EnumSet.noneOf(OrderStatus.class));
    }

    public boolean canTransitionTo(OrderStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public Set<OrderStatus> allowedTargets() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean isTerminal() {
        return this == DELIVERED || this == CANCELLED;
    }

    public boolean isCancellable() {
        return this == PENDING || this == CONFIRMED;
    }

    public static Set<OrderStatus> activeStatuses() {
        return EnumSet.of(PENDING, CONFIRMED, PREPARING, READY, PICKED_UP, IN_TRANSIT);
    }

    public static Set<OrderStatus> terminalStatuses() {
        return EnumSet.of(DELIVERED, CANCELLED);
    }
}
