package com.quickgo.orderservice.repository;

import com.quickgo.orderservice.model.DispatchOffer;
import com.quickgo.orderservice.model.OfferOutcome;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Offer outcomes only move away from PENDING through the conditional updates below.
 * Each returns the number of rows changed: 1 means this caller won the race, 0 means
 * another writer decided the offer first (or the deadline condition failed).
 */
@Repository
public interface DispatchOfferRepository extends JpaRepository<DispatchOffer, UUID> {

    List<DispatchOffer> findByOrderIdOrderByOfferedAtAsc(Long orderId);

    List<DispatchOffer> findByDriverIdAndOutcomeAndExpiresAtAfterOrderByOfferedAtAsc(
            Long driverId, OfferOutcome outcome, Instant now);

    boolean existsByOrderIdAndOutcomeAndExpiresAtAfter(Long orderId, OfferOutcome outcome, Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DispatchOffer f SET f.outcome = com.quickgo.orderservice.model.OfferOutcome.ACCEPTED, "
            + "f.decidedAt = :now "
            + "WHERE f.id = :offerId "
            + "AND f.outcome = com.quickgo.orderservice.model.OfferOutcome.PENDING "
            + "AND f.expiresAt > :now")
    int acceptIfPending(@Param("offerId") UUID offerId, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DispatchOffer f SET f.outcome = com.quickgo.orderservice.model.OfferOutcome.REJECTED, "
            + "f.decidedAt = :now "
            + "WHERE f.id = :offerId "
            + "AND f.outcome = com.quickgo.orderservice.model.OfferOutcome.PENDING "
            + "AND f.expiresAt > :now")
    int rejectIfPending(@Param("offerId") UUID offerId, @Param("now") Instant now);

    // Used after an assignment conflict, where the deadline no longer matters
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DispatchOffer f SET f.outcome = com.quickgo.orderservice.model.OfferOutcome.REJECTED, "
            + "f.decidedAt = :now "
            + "WHERE f.id = :offerId "
            + "AND f.outcome = com.quickgo.orderservice.model.OfferOutcome.PENDING")
    int forceRejectIfPending(@Param("offerId") UUID offerId, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DispatchOffer f SET f.outcome = com.quickgo.orderservice.model.OfferOutcome.EXPIRED, "
            + "f.decidedAt = :now "
            + "WHERE f.id = :offerId "
            + "AND f.outcome = com.quickgo.orderservice.model.OfferOutcome.PENDING "
            + "AND f.expiresAt <= :now")
    int expireIfOverdue(@Param("offerId") UUID offerId, @Param("now") Instant now);

    // Invalidates every outstanding offer of an order (accepted elsewhere, cancelled, manual assignment)
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DispatchOffer f SET f.outcome = com.quickgo.orderservice.model.OfferOutcome.EXPIRED, "
            + "f.decidedAt = :now "
            + "WHERE f.orderId = :orderId "
            + "AND f.outcome = com.quickgo.orderservice.model.OfferOutcome.PENDING")
    int expirePendingForOrder(@Param("orderId") Long orderId, @Param("now") Instant now);

    // Drivers that declined, timed out or conflicted on this order inside the cool-down window
    @Query("SELECT DISTINCT f.driverId FROM DispatchOffer f "
            + "WHERE f.orderId = :orderId "
            + "AND f.outcome IN (com.quickgo.orderservice.model.OfferOutcome.REJECTED, "
            + "com.quickgo.orderservice.model.OfferOutcome.EXPIRED) "
            + "AND f.decidedAt >= :since")
    List<Long> findCoolingDownDriverIds(@Param("orderId") Long orderId, @Param("since") Instant since);

    @Query("SELECT f.id FROM DispatchOffer f "
            + "WHERE f.outcome = com.quickgo.orderservice.model.OfferOutcome.PENDING "
            + "AND f.expiresAt <= :now "
            + "ORDER BY f.expiresAt ASC")
    List<UUID> findOverdueOfferIds(@Param("now") Instant now);
}
