package com.quickgo.orderservice.service;

import com.quickgo.common.exception.ResourceNotFoundException;
import com.quickgo.orderservice.config.DispatchProperties;
import com.quickgo.orderservice.dto.DriverAvailabilityResponse;
import com.quickgo.orderservice.dto.LocationUpdateRequest;
import com.quickgo.orderservice.exception.InvalidStateException;
import com.quickgo.orderservice.exception.ValidationException;
import com.quickgo.orderservice.mapper.DispatchMapper;
import com.quickgo.orderservice.model.DeliveryLocation;
import com.quickgo.orderservice.model.DriverAvailability;
import com.quickgo.orderservice.model.GeoPoint;
import com.quickgo.orderservice.repository.DeliveryLocationRepository;
import com.quickgo.orderservice.repository.DriverAvailabilityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Owns each driver's availability record: the opt-in flags, last known location
 * and the assignment slot.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DriverAvailabilityService {

    // Ties go to the longest idle driver. Read literally, "fewest minutes since last assignment"
    // would hand the next order to whoever just finished one, the opposite of spreading load.
    // Keep this ordering.
    private static final Comparator<DriverCandidate> NEAREST_THEN_LONGEST_IDLE = Comparator
            .comparingDouble(DriverCandidate::getDistanceKm)
            .thenComparing(DriverCandidate::getLastAssignedAt, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final DriverAvailabilityRepository driverAvailabilityRepository;
    private final DeliveryLocationRepository deliveryLocationRepository;
    private final DispatchProperties dispatchProperties;
    private final DispatchMapper dispatchMapper;
    private final TimerService timerService;

    /**
     * Opts a driver in or out of offers. Opting out also takes the driver offline.
     * The record is created on first use.
     */
    @Transactional
    public DriverAvailabilityResponse setAvailability(Long driverId, boolean isAvailable) {
        DriverAvailability record = findOrCreate(driverId);

        record.setAvailable(isAvailable);
        if (!isAvailable) {
            record.setOnline(false);
        }

        DriverAvailability saved = driverAvailabilityRepository.save(record);
        log.info("Driver availability changed: driverId={}, available={}, online={}",
                driverId, saved.isAvailable(), saved.isOnline());
        return dispatchMapper.toAvailabilityResponse(saved);
    }

    @Transactional
    public DriverAvailabilityResponse setOnline(Long driverId, boolean isOnline) {
        DriverAvailability record = findOrCreate(driverId);

        if (isOnline && !record.isAvailable()) {
            log.warn("Rejected going online while unavailable: driverId={}", driverId);
            throw new InvalidStateException("Driver must be available before going online");
        }

        record.setOnline(isOnline);
        DriverAvailability saved = driverAvailabilityRepository.save(record);
        log.info("Driver online state changed: driverId={}, online={}", driverId, isOnline);
        return dispatchMapper.toAvailabilityResponse(saved);
    }

    @Transactional
    public DriverAvailabilityResponse updateLocation(Long driverId, Double latitude, Double longitude) {
        return updateLocation(driverId, new LocationUpdateRequest(latitude, longitude));
    }

    /**
     * Moves the driver's current position. While the driver carries an order the fix is
     * also appended to that order's trail.
     */
    @Transactional
    public DriverAvailabilityResponse updateLocation(Long driverId, LocationUpdateRequest fix) {
        Double latitude = fix.getLatitude();
        Double longitude = fix.getLongitude();
        if (!GeoPoint.isValid(latitude, longitude)) {
            log.warn("Rejected invalid driver location: driverId={}, lat={}, lon={}", driverId, latitude, longitude);
            throw new ValidationException("Coordinates out of range: lat=" + latitude + ", lon=" + longitude);
        }

        Instant now = timerService.now();
        DriverAvailability record = findOrCreate(driverId);
        record.setLatitude(latitude);
        record.setLongitude(longitude);
        record.setLocationUpdatedAt(now);

        DriverAvailability saved = driverAvailabilityRepository.save(record);
        if (saved.isBusy()) {
            deliveryLocationRepository.save(DeliveryLocation.builder()
                    .orderId(saved.getCurrentOrderId())
                    .driverId(driverId)
                    .latitude(latitude)
                    .longitude(longitude)
                    .accuracy(fix.getAccuracy())
                    .speedKmh(fix.getSpeedKmh())
                    .heading(fix.getHeading())
                    .recordedAt(now)
                    .build());
        }
        log.debug("Driver location updated: driverId={}, lat={}, lon={}, orderId={}",
                driverId, latitude, longitude, saved.getCurrentOrderId());
        return dispatchMapper.toAvailabilityResponse(saved);
    }

    /**
     * Operator escape hatch: frees the slot whatever order it holds.
     */
    @Transactional
    public boolean releaseAssignment(Long driverId) {
        boolean released = driverAvailabilityRepository.clearAssignmentSlot(driverId) == 1;
        log.info("Driver assignment slot cleared: driverId={}, released={}", driverId, released);
        return released;
    }

    /**
     * Frees the slot only if it still holds this order, so a late release for an old
     * order never frees a newer assignment.
     */
    @Transactional
    public boolean releaseAssignment(Long driverId, Long orderId) {
        boolean released = driverAvailabilityRepository.releaseAssignmentSlot(driverId, orderId) == 1;
        if (released) {
            log.info("Driver released from order: driverId={}, orderId={}", driverId, orderId);
        } else {
            log.warn("Driver slot did not hold order, nothing released: driverId={}, orderId={}", driverId, orderId);
        }
        return released;
    }

    /**
     * Frees the slot after a delivery and counts it.
     */
    @Transactional
    public boolean completeAssignment(Long driverId, Long orderId) {
        boolean completed = driverAvailabilityRepository.completeAssignment(driverId, orderId) == 1;
        if (completed) {
            log.info("Driver completed delivery: driverId={}, orderId={}", driverId, orderId);
        } else {
            log.warn("Driver slot did not hold delivered order: driverId={}, orderId={}", driverId, orderId);
        }
        return completed;
    }

    /**
     * Drivers that may receive an offer for a pickup at {@code origin}: available, online,
     * free slot, fresh location, within {@code maxRadiusKm} and not excluded.
     * Nearest first; equal distances go to the driver idle the longest
     * (never assigned, then earliest last assignment).
     */
    @Transactional(readOnly = true)
    public List<DriverCandidate> findCandidates(GeoPoint origin, double maxRadiusKm, Collection<Long> excludeDriverIds) {
        Instant freshSince = timerService.now().minus(dispatchProperties.getLocationFreshness());
        Set<Long> excluded = excludeDriverIds == null ? Set.of() : new HashSet<>(excludeDriverIds);

        List<DriverCandidate> candidates = driverAvailabilityRepository.findDispatchable(freshSince).stream()
                .filter(driver -> !excluded.contains(driver.getDriverId()))
                .map(driver -> new DriverCandidate(
                        driver.getDriverId(),
                        GeoUtils.distanceKm(origin.getLatitude(), origin.getLongitude(),
                                driver.getLatitude(), driver.getLongitude()),
                        driver.getLastAssignedAt()))
                .filter(candidate -> candidate.getDistanceKm() <= maxRadiusKm)
                .sorted(NEAREST_THEN_LONGEST_IDLE)
                .toList();

        log.debug("Candidate search: origin={}, radiusKm={}, excluded={}, found={}",
                origin, maxRadiusKm, excluded.size(), candidates.size());
        return candidates;
    }

    @Transactional(readOnly = true)
    public DriverAvailabilityResponse getAvailability(Long driverId) {
        return driverAvailabilityRepository.findById(driverId)
                .map(dispatchMapper::toAvailabilityResponse)
                .orElseThrow(() -> new ResourceNotFoundException("No availability record for driver: " + driverId));
    }

    private DriverAvailability findOrCreate(Long driverId) {
        return driverAvailabilityRepository.findById(driverId)
                .orElseGet(() -> {
                    log.info("Creating availability record for driver: driverId={}", driverId);
                    return DriverAvailability.builder().driverId(driverId).build();
                });
    }
}
