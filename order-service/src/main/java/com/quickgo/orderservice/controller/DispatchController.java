package com.quickgo.orderservice.controller;

import com.quickgo.orderservice.dto.DeliveryIssueResponse;
import com.quickgo.orderservice.dto.DriverAvailabilityResponse;
import com.quickgo.orderservice.dto.DriverStatisticsResponse;
import com.quickgo.orderservice.dto.ManualAssignRequest;
import com.quickgo.orderservice.dto.OrderResponse;
import com.quickgo.orderservice.dto.ResolveIssueRequest;
import com.quickgo.orderservice.security.Actor;
import com.quickgo.orderservice.security.ActorResolver;
import com.quickgo.orderservice.service.DeliveryIssueService;
import com.quickgo.orderservice.service.DeliveryTrackingService;
import com.quickgo.orderservice.service.DispatchService;
import com.quickgo.orderservice.service.OrderLifecycleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Operator console: escalations, manual assignment and delivery issues.
 * Role checks happen in the services.
 */
@RestController
@RequestMapping("/api/v1/dispatch")
@RequiredArgsConstructor
public class DispatchController {

    private final DispatchService dispatchService;
    private final DeliveryIssueService deliveryIssueService;
    private final DeliveryTrackingService deliveryTrackingService;
    private final OrderLifecycleService orderLifecycleService;
    private final ActorResolver actorResolver;

    @GetMapping("/escalations")
    public ResponseEntity<List<OrderResponse>> getEscalatedOrders(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(dispatchService.getEscalatedOrders(actorResolver.resolve(jwt)));
    }

    @PostMapping("/orders/{orderId}/assign")
    public ResponseEntity<OrderResponse> assignDriver(
            @PathVariable Long orderId,
            @RequestBody(required = false) ManualAssignRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        Actor actor = actorResolver.resolve(jwt);
        dispatchService.manualAssign(orderId, request == null ? null : request.getDriverId(), actor);
        return ResponseEntity.ok(orderLifecycleService.getOrder(orderId, actor));
    }

    @PostMapping("/orders/{orderId}/redispatch")
    public ResponseEntity<OrderResponse> redispatch(
            @PathVariable Long orderId,
            @AuthenticationPrincipal Jwt jwt) {
        Actor actor = actorResolver.resolve(jwt);
        dispatchService.resetDispatch(orderId, actor);
        return ResponseEntity.ok(orderLifecycleService.getOrder(orderId, actor));
    }

    @PostMapping("/drivers/{driverId}/release")
    public ResponseEntity<DriverAvailabilityResponse> releaseDriver(
            @PathVariable Long driverId,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(dispatchService.releaseDriver(driverId, actorResolver.resolve(jwt)));
    }

    @GetMapping("/drivers/{driverId}/statistics")
    public ResponseEntity<DriverStatisticsResponse> getDriverStatistics(
            @PathVariable Long driverId,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(deliveryTrackingService.getDriverStatistics(driverId, actorResolver.resolve(jwt)));
    }

    @GetMapping("/issues")
    public ResponseEntity<List<DeliveryIssueResponse>> getOpenIssues(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(deliveryIssueService.getOpenIssues(actorResolver.resolve(jwt)));
    }

    @GetMapping("/orders/{orderId}/issues")
    public ResponseEntity<List<DeliveryIssueResponse>> getIssuesForOrder(
            @PathVariable Long orderId,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(deliveryIssueService.getIssuesForOrder(orderId, actorResolver.resolve(jwt)));
    }

    @PostMapping("/issues/{issueId}/resolve")
    public ResponseEntity<DeliveryIssueResponse> resolveIssue(
            @PathVariable UUID issueId,
            @Valid @RequestBody ResolveIssueRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(deliveryIssueService.resolveIssue(
                issueId, request.getResolutionNotes(), actorResolver.resolve(jwt)));
    }
}
