package com.quickgo.orderservice.service;

import com.quickgo.orderservice.dto.CreateOrderRequest;
import com.quickgo.orderservice.dto.OrderResponse;
import com.quickgo.orderservice.dto.RatingRequest;
import com.quickgo.orderservice.dto.RatingResponse;
import com.quickgo.orderservice.dto.TransitionMetadata;
import com.quickgo.orderservice.model.CancellationReason;
import com.quickgo.orderservice.model.OrderStatus;
import com.quickgo.orderservice.security.Actor;

import java.util.List;

public interface OrderLifecycleService {

    OrderResponse create(CreateOrderRequest request, Actor actor);

    /**
     * Applies one edge of the lifecycle graph. Re-applying the current status is a no-op success.
     * Entering READY triggers dispatch once the change is committed.
     */
    OrderResponse transition(Long orderId, OrderStatus targetStatus, Actor actor, TransitionMetadata metadata);

    OrderResponse cancel(Long orderId, CancellationReason reason, String notes, Actor actor);

    RatingResponse recordRating(Long orderId, RatingRequest request, Actor actor);

    OrderResponse getOrder(Long orderId, Actor actor);

    List<OrderResponse> getActiveOrders(Actor actor);

    List<OrderResponse> getHistory(Actor actor);

    OrderResponse markPaid(Long orderId, Actor actor);

    /**
     * Flags a PENDING order that has waited too long for the restaurant.
     *
     * @return true if the order was flagged by this call
     */
    boolean flagConfirmationOverdue(Long orderId);
}
