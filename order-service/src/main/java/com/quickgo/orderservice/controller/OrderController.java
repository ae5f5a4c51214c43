package com.quickgo.orderservice.controller;

import com.quickgo.orderservice.dto.CancelOrderRequest;
import com.quickgo.orderservice.dto.CreateOrderRequest;
import com.quickgo.orderservice.dto.DeliveryIssueResponse;
import com.quickgo.orderservice.dto.DeliveryLocationResponse;
import com.quickgo.orderservice.dto.DeliveryTrackingResponse;
import com.quickgo.orderservice.dto.OrderResponse;
import com.quickgo.orderservice.dto.RatingRequest;
import com.quickgo.orderservice.dto.RatingResponse;
import com.quickgo.orderservice.dto.ReportIssueRequest;
import com.quickgo.orderservice.dto.TransitionMetadata;
import com.quickgo.orderservice.dto.TransitionRequest;
import com.quickgo.orderservice.model.OrderStatus;
import com.quickgo.orderservice.security.ActorResolver;
import com.quickgo.orderservice.service.DeliveryIssueService;
import com.quickgo.orderservice.service.DeliveryTrackingService;
import com.quickgo.orderservice.service.OrderLifecycleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderLifecycleService orderLifecycleService;
    private final DeliveryIssueService deliveryIssueService;
    private final DeliveryTrackingService deliveryTrackingService;
    private final ActorResolver actorResolver;

    @PostMapping
    public ResponseEntity<OrderResponse> createOrder(
            @Valid @RequestBody CreateOrderRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        OrderResponse response = orderLifecycleService.create(request, actorResolver.resolve(jwt));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/active")
    public ResponseEntity<List<OrderResponse>> getActiveOrders(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(orderLifecycleService.getActiveOrders(actorResolver.resolve(jwt)));
    }

    @GetMapping("/history")
    public ResponseEntity<List<OrderResponse>> getOrderHistory(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(orderLifecycleService.getHistory(actorResolver.resolve(jwt)));
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<OrderResponse> getOrderById(
            @PathVariable Long orderId,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(orderLifecycleService.getOrder(orderId, actorResolver.resolve(jwt)));
    }

    @GetMapping("/{orderId}/tracking")
    public ResponseEntity<DeliveryTrackingResponse> trackOrder(
            @PathVariable Long orderId,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(deliveryTrackingService.getTracking(orderId, actorResolver.resolve(jwt)));
    }

    @GetMapping("/{orderId}/locations")
    public ResponseEntity<List<DeliveryLocationResponse>> getLocationTrail(
            @PathVariable Long orderId,
            @RequestParam(required = false) Integer limit,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(deliveryTrackingService.getLocations(orderId, limit, actorResolver.resolve(jwt)));
    }

    @PostMapping("/{orderId}/confirm")
    public ResponseEntity<OrderResponse> confirmOrder(
            @PathVariable Long orderId,
            @RequestBody(required = false) TransitionRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(transition(orderId, OrderStatus.CONFIRMED, request, jwt));
    }

    @PostMapping("/{orderId}/preparing")
    public ResponseEntity<OrderResponse> startPreparing(
            @PathVariable Long orderId,
            @RequestBody(required = false) TransitionRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(transition(orderId, OrderStatus.PREPARING, request, jwt));
    }

    @PostMapping("/{orderId}/ready")
    public ResponseEntity<OrderResponse> markReady(
            @PathVariable Long orderId,
            @RequestBody(required = false) TransitionRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(transition(orderId, OrderStatus.READY, request, jwt));
    }

    @PostMapping("/{orderId}/pickup")
    public ResponseEntity<OrderResponse> pickupOrder(
            @PathVariable Long orderId,
            @RequestBody(required = false) TransitionRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(transition(orderId, OrderStatus.PICKED_UP, request, jwt));
    }

    @PostMapping("/{orderId}/in-transit")
    public ResponseEntity<OrderResponse> startTransit(
            @PathVariable Long orderId,
            @RequestBody(required = false) TransitionRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(transition(orderId, OrderStatus.IN_TRANSIT, request, jwt));
    }

    @PostMapping("/{orderId}/deliver")
    public ResponseEntity<OrderResponse> deliverOrder(
            @PathVariable Long orderId,
            @RequestBody(required = false) TransitionRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(transition(orderId, OrderStatus.DELIVERED, request, jwt));
    }

    @PostMapping("/{orderId}/cancel")
    public ResponseEntity<OrderResponse> cancelOrder(
            @PathVariable Long orderId,
            @Valid @RequestBody CancelOrderRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        OrderResponse response = orderLifecycleService.cancel(orderId, request.getReason(), request.getNotes(),
                actorResolver.resolve(jwt));
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{orderId}/pay")
    public ResponseEntity<OrderResponse> markPaid(
            @PathVariable Long orderId,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(orderLifecycleService.markPaid(orderId, actorResolver.resolve(jwt)));
    }

    @PostMapping("/{orderId}/rating")
    public ResponseEntity<RatingResponse> rateOrder(
            @PathVariable Long orderId,
            @Valid @RequestBody RatingRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        RatingResponse response = orderLifecycleService.recordRating(orderId, request, actorResolver.resolve(jwt));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/{orderId}/issues")
    public ResponseEntity<DeliveryIssueResponse> reportIssue(
            @PathVariable Long orderId,
            @Valid @RequestBody ReportIssueRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        DeliveryIssueResponse response = deliveryIssueService.reportIssue(orderId, request, actorResolver.resolve(jwt));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    private OrderResponse transition(Long orderId, OrderStatus target, TransitionRequest request, Jwt jwt) {
        TransitionMetadata metadata = request == null
                ? TransitionMetadata.empty()
                : TransitionMetadata.withNotes(request.getNotes());
        return orderLifecycleService.transition(orderId, target, actorResolver.resolve(jwt), metadata);
    }
}
