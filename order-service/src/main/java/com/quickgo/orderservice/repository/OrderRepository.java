package com.quickgo.orderservice.repository;

import com.quickgo.orderservice.model.Order;
import com.quickgo.orderservice.model.OrderStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface OrderRepository extends JpaRepository<Order, Long> {

    // shares the id sequence, values are never handed out twice
    @Query(value = "SELECT nextval('" + Order.ID_SEQUENCE + "')", nativeQuery = true)
    long nextOrderSequence();

    List<Order> findByCustomerIdAndStatusInOrderByCreatedAtDesc(Long customerId, Collection<OrderStatus> statuses);

    List<Order> findByRestaurantIdAndStatusInOrderByCreatedAtDesc(Long restaurantId, Collection<OrderStatus> statuses);

    List<Order> findByDriverIdAndStatusInOrderByCreatedAtDesc(Long driverId, Collection<OrderStatus> statuses);

    long countByDriverIdAndStatusIn(Long driverId, Collection<OrderStatus> statuses);

    List<Order> findByStatusInOrderByCreatedAtDesc(Collection<OrderStatus> statuses);

    List<Order> findByEscalatedTrueOrderByEscalatedAtAsc();

    /**
     * Conditional assignment: succeeds only while the order is READY and has no driver.
     * Clears any dispatch escalation in the same write.
     *
     * @return 1 if the driver was assigned, 0 if the order moved on or already has a driver
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Order o SET o.driverId = :driverId, o.assignedAt = :now, "
            + "o.escalated = false, o.escalationReason = null, o.escalatedAt = null, "
            + "o.version = o.version + 1 "
            + "WHERE o.id = :orderId "
            + "AND o.status = com.quickgo.orderservice.model.OrderStatus.READY "
            + "AND o.driverId IS NULL")
    int assignDriver(@Param("orderId") Long orderId, @Param("driverId") Long driverId, @Param("now") Instant now);

    // PENDING orders past the confirmation SLA that nobody has flagged yet
    @Query("SELECT o.id FROM Order o "
            + "WHERE o.status = com.quickgo.orderservice.model.OrderStatus.PENDING "
            + "AND o.createdAt < :cutoff AND o.escalated = false "
            + "ORDER BY o.createdAt ASC")
    List<Long> findOverduePendingOrderIds(@Param("cutoff") Instant cutoff);

    // READY, unassigned, not exhausted and without an outstanding offer
    @Query("SELECT o.id FROM Order o "
            + "WHERE o.status = com.quickgo.orderservice.model.OrderStatus.READY "
            + "AND o.driverId IS NULL "
            + "AND (o.escalationReason IS NULL "
            + "OR o.escalationReason <> com.quickgo.orderservice.model.EscalationReason.DISPATCH_EXHAUSTED) "
            + "AND NOT EXISTS (SELECT f.id FROM DispatchOffer f WHERE f.orderId = o.id "
            + "AND f.outcome = com.quickgo.orderservice.model.OfferOutcome.PENDING) "
            + "ORDER BY o.readyAt ASC")
    List<Long> findStalledReadyOrderIds();
}
