package com.quickgo.orderservice.service;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * A dispatchable driver with its distance to the pickup point.
 */
@Getter
@ToString
@AllArgsConstructor
public class DriverCandidate {

    private final Long driverId;
    private final double distanceKm;

    // null when the driver never had an assignment
    private final Instant lastAssignedAt;
}
