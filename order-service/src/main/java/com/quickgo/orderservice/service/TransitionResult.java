package com.quickgo.orderservice.service;

import com.quickgo.orderservice.dto.OrderResponse;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class TransitionResult {

    private final OrderResponse order;

    // false when the order already was in the target status
    private final boolean changed;
}
