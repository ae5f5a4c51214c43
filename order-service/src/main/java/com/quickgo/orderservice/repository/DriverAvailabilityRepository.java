package com.quickgo.orderservice.repository;

import com.quickgo.orderservice.model.DriverAvailability;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface DriverAvailabilityRepository extends JpaRepository<DriverAvailability, Long> {

    /**
     * Base candidate query: available, online, free slot and a location reported
     * at or after freshSince. Radius and exclusion filtering happen in the tracker.
     */
    @Query("SELECT d FROM DriverAvailability d "
            + "WHERE d.available = true AND d.online = true "
            + "AND d.currentOrderId IS NULL "
            + "AND d.latitude IS NOT NULL AND d.longitude IS NOT NULL "
            + "AND d.locationUpdatedAt >= :freshSince")
    List<DriverAvailability> findDispatchable(@Param("freshSince") Instant freshSince);

    /**
     * Claims the assignment slot. This is the write that keeps a driver at one active order:
     * it only succeeds while the slot is empty.
     *
     * @return 1 if claimed, 0 if the slot is occupied or the driver went unavailable
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DriverAvailability d SET d.currentOrderId = :orderId, d.lastAssignedAt = :now, "
            + "d.version = d.version + 1 "
            + "WHERE d.driverId = :driverId AND d.currentOrderId IS NULL AND d.available = true")
    int claimAssignmentSlot(@Param("driverId") Long driverId, @Param("orderId") Long orderId,
                            @Param("now") Instant now);

    // Only clears the slot if it still holds this order
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DriverAvailability d SET d.currentOrderId = null, d.version = d.version + 1 "
            + "WHERE d.driverId = :driverId AND d.currentOrderId = :orderId")
    int releaseAssignmentSlot(@Param("driverId") Long driverId, @Param("orderId") Long orderId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DriverAvailability d SET d.currentOrderId = null, "
            + "d.totalDeliveries = d.totalDeliveries + 1, d.version = d.version + 1 "
            + "WHERE d.driverId = :driverId AND d.currentOrderId = :orderId")
    int completeAssignment(@Param("driverId") Long driverId, @Param("orderId") Long orderId);

    // Operator escape hatch, clears whatever the slot holds
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DriverAvailability d SET d.currentOrderId = null, d.version = d.version + 1 "
            + "WHERE d.driverId = :driverId AND d.currentOrderId IS NOT NULL")
    int clearAssignmentSlot(@Param("driverId") Long driverId);
}
