package com.quickgo.orderservice.controller;

import com.quickgo.common.exception.AccessDeniedException;
import com.quickgo.orderservice.dto.AvailabilityRequest;
import com.quickgo.orderservice.dto.DispatchOfferResponse;
import com.quickgo.orderservice.dto.DriverAvailabilityResponse;
import com.quickgo.orderservice.dto.DriverStatisticsResponse;
import com.quickgo.orderservice.dto.LocationUpdateRequest;
import com.quickgo.orderservice.dto.OnlineRequest;
import com.quickgo.orderservice.security.Actor;
import com.quickgo.orderservice.security.ActorResolver;
import com.quickgo.orderservice.security.ActorRole;
import com.quickgo.orderservice.service.DeliveryTrackingService;
import com.quickgo.orderservice.service.DispatchService;
import com.quickgo.orderservice.service.DriverAvailabilityService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Endpoints a driver calls about themselves: presence, location, offers and figures.
 */
@RestController
@RequestMapping("/api/v1/drivers/me")
@RequiredArgsConstructor
public class DriverController {

    private final DriverAvailabilityService driverAvailabilityService;
    private final DispatchService dispatchService;
    private final DeliveryTrackingService deliveryTrackingService;
    private final ActorResolver actorResolver;

    @GetMapping
    public ResponseEntity<DriverAvailabilityResponse> getMyAvailability(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(driverAvailabilityService.getAvailability(driverId(jwt)));
    }

    @PutMapping("/availability")
    public ResponseEntity<DriverAvailabilityResponse> setAvailability(
            @Valid @RequestBody AvailabilityRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(driverAvailabilityService.setAvailability(driverId(jwt), request.getAvailable()));
    }

    @PutMapping("/online")
    public ResponseEntity<DriverAvailabilityResponse> setOnline(
            @Valid @RequestBody OnlineRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(driverAvailabilityService.setOnline(driverId(jwt), request.getOnline()));
    }

    @PutMapping("/location")
    public ResponseEntity<DriverAvailabilityResponse> updateLocation(
            @Valid @RequestBody LocationUpdateRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(driverAvailabilityService.updateLocation(driverId(jwt), request));
    }

    @GetMapping("/statistics")
    public ResponseEntity<DriverStatisticsResponse> getMyStatistics(@AuthenticationPrincipal Jwt jwt) {
        Long driverId = driverId(jwt);
        return ResponseEntity.ok(deliveryTrackingService.getDriverStatistics(driverId, Actor.driver(driverId)));
    }

    @GetMapping("/offers")
    public ResponseEntity<List<DispatchOfferResponse>> getOutstandingOffers(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(dispatchService.getOutstandingOffers(driverId(jwt)));
    }

    @PostMapping("/offers/{offerId}/accept")
    public ResponseEntity<DispatchOfferResponse> acceptOffer(
            @PathVariable UUID offerId,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(dispatchService.respondToOffer(offerId, driverId(jwt), true));
    }

    @PostMapping("/offers/{offerId}/reject")
    public ResponseEntity<DispatchOfferResponse> rejectOffer(
            @PathVariable UUID offerId,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(dispatchService.respondToOffer(offerId, driverId(jwt), false));
    }

    private Long driverId(Jwt jwt) {
        Actor actor = actorResolver.resolve(jwt);
        if (!actor.is(ActorRole.DRIVER)) {
            throw new AccessDeniedException("Only drivers can use this endpoint");
        }
        return actor.getUserId();
    }
}
