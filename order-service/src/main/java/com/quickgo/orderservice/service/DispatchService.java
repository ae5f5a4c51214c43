package com.quickgo.orderservice.service;

import com.quickgo.common.exception.AccessDeniedException;
import com.quickgo.common.exception.ResourceNotFoundException;
import com.quickgo.orderservice.config.DispatchProperties;
import com.quickgo.orderservice.dto.DispatchOfferResponse;
import com.quickgo.orderservice.dto.DriverAvailabilityResponse;
import com.quickgo.orderservice.dto.OrderResponse;
import com.quickgo.orderservice.exception.AssignmentConflictException;
import com.quickgo.orderservice.exception.NoDriverAvailableException;
import com.quickgo.orderservice.exception.OfferExpiredException;
import com.quickgo.orderservice.exception.OrderNotReadyException;
import com.quickgo.orderservice.mapper.DispatchMapper;
import com.quickgo.orderservice.mapper.OrderMapper;
import com.quickgo.orderservice.model.DispatchOffer;
import com.quickgo.orderservice.model.EscalationReason;
import com.quickgo.orderservice.model.OfferOutcome;
import com.quickgo.orderservice.model.Order;
import com.quickgo.orderservice.model.OrderStatus;
import com.quickgo.orderservice.model.OrderStatusHistory;
import com.quickgo.orderservice.repository.DispatchOfferRepository;
import com.quickgo.orderservice.repository.DriverAvailabilityRepository;
import com.quickgo.orderservice.repository.OrderRepository;
import com.quickgo.orderservice.repository.OrderStatusHistoryRepository;
import com.quickgo.orderservice.security.Actor;
import com.quickgo.orderservice.security.ActorRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Lazy;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Matches READY orders to drivers with sequential, time-bounded offers.
 *
 * Every decision is a conditional write:
 * - offer outcome only leaves PENDING once (acceptIfPending / rejectIfPending / expireIfOverdue)
 * - a driver's slot is only claimed while empty (claimAssignmentSlot)
 * - an order only takes a driver while READY and unassigned (assignDriver)
 * - concurrent dispatch rounds for one order race on the order version
 *
 * Public entry points are not transactional; they call the transactional steps through
 * {@code self} so each step commits (or rolls back) before timers fire or re-dispatch starts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DispatchService {

    // Fire expiry callbacks just after the deadline so expireIfOverdue sees the offer as due
    private static final Duration EXPIRY_GRACE = Duration.ofMillis(500);

    private final OrderRepository orderRepository;
    private final DispatchOfferRepository offerRepository;
    private final DriverAvailabilityRepository driverAvailabilityRepository;
    private final OrderStatusHistoryRepository historyRepository;
    private final DriverAvailabilityService driverAvailabilityService;
    private final NotificationDispatcher notificationDispatcher;
    private final TimerService timerService;
    private final DispatchProperties dispatchProperties;
    private final DispatchMapper dispatchMapper;
    private final OrderMapper orderMapper;

    @Autowired
    @Lazy
    private DispatchService self;

    /**
     * Runs one dispatch round for the order and arms the follow-up timer.
     * Safe to call repeatedly: it does nothing unless the order is READY, unassigned,
     * not exhausted and without an outstanding offer.
     */
    public DispatchAttempt requestDispatch(Long orderId) {
        DispatchAttempt attempt;
        try {
            attempt = self.openRound(orderId);
        } catch (OptimisticLockingFailureException e) {
            // Another round for the same order committed first, it owns the next step
            log.info("Concurrent dispatch round lost the version check: orderId={}", orderId);
            return DispatchAttempt.skipped();
        }

        switch (attempt.getResult()) {
            case OFFERED -> {
                UUID offerId = attempt.getOfferId();
                timerService.scheduleAt(attempt.getNextCheckAt().plus(EXPIRY_GRACE), () -> expireOffer(offerId));
            }
            case NO_CANDIDATE -> timerService.scheduleAt(attempt.getNextCheckAt(), () -> requestDispatch(orderId));
            default -> {
                // nothing to arm
            }
        }
        return attempt;
    }

    @Transactional
    public DispatchAttempt openRound(Long orderId) {
        Instant now = timerService.now();
        Order order = findOrder(orderId);

        if (order.getStatus() != OrderStatus.READY || order.getDriverId() != null) {
            log.debug("Dispatch skipped, order not waiting for a driver: orderId={}, status={}, driverId={}",
                    orderId, order.getStatus(), order.getDriverId());
            return DispatchAttempt.skipped();
        }
        if (order.isDispatchExhausted()) {
            log.debug("Dispatch skipped, order awaits manual dispatch: orderId={}", orderId);
            return DispatchAttempt.skipped();
        }
        if (offerRepository.existsByOrderIdAndOutcomeAndExpiresAtAfter(orderId, OfferOutcome.PENDING, now)) {
            log.debug("Dispatch skipped, offer still outstanding: orderId={}", orderId);
            return DispatchAttempt.skipped();
        }

        if (order.getDispatchRounds() >= dispatchProperties.getMaxRounds()) {
            order.escalate(EscalationReason.DISPATCH_EXHAUSTED, now);
            orderRepository.save(order);
            notificationDispatcher.notify(Recipients.OPERATORS, NotificationEventType.DISPATCH_ESCALATED, order,
                    Map.of("reason", EscalationReason.DISPATCH_EXHAUSTED.name(), "rounds", order.getDispatchRounds()));
            log.warn("Dispatch exhausted, escalating for manual dispatch: orderId={}, rounds={}",
                    orderId, order.getDispatchRounds());
            return DispatchAttempt.exhausted();
        }

        List<Long> coolingDown = offerRepository.findCoolingDownDriverIds(
                orderId, now.minus(dispatchProperties.getDeclineCooldown()));
        List<DriverCandidate> candidates = driverAvailabilityService.findCandidates(
                order.getPickupLocation(), dispatchProperties.getMaxRadiusKm(), coolingDown);

        order.setDispatchRounds(order.getDispatchRounds() + 1);

        if (candidates.isEmpty()) {
            boolean newAlert = order.getEscalationReason() != EscalationReason.NO_DRIVER_AVAILABLE;
            if (newAlert) {
                order.escalate(EscalationReason.NO_DRIVER_AVAILABLE, now);
            }
            orderRepository.save(order);
            if (newAlert) {
                notificationDispatcher.notify(Recipients.OPERATORS, NotificationEventType.DISPATCH_ESCALATED, order,
                        Map.of("reason", EscalationReason.NO_DRIVER_AVAILABLE.name(),
                                "rounds", order.getDispatchRounds()));
            }
            Instant retryAt = now.plus(dispatchProperties.getNoDriverBackoff());
            log.warn("No driver available: orderId={}, round={}, excluded={}, retryAt={}",
                    orderId, order.getDispatchRounds(), coolingDown.size(), retryAt);
            return DispatchAttempt.noCandidate(retryAt);
        }

        DriverCandidate best = candidates.get(0);
        DispatchOffer offer = offerRepository.save(DispatchOffer.builder()
                .orderId(orderId)
                .driverId(best.getDriverId())
                .round(order.getDispatchRounds())
                .offeredAt(now)
                .expiresAt(now.plus(dispatchProperties.getOfferTimeout()))
                .outcome(OfferOutcome.PENDING)
                .build());

        // Version bump: a concurrent round for this order fails at commit and its offer rolls back
        orderRepository.save(order);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("offerId", offer.getId());
        payload.put("expiresAt", offer.getExpiresAt());
        payload.put("distanceKm", Math.round(best.getDistanceKm() * 100.0) / 100.0);
        payload.put("pickup", order.getPickupLocation());
        payload.put("deliveryAddress", order.getDeliveryAddress());
        notificationDispatcher.notify(Recipients.driver(best.getDriverId()), NotificationEventType.OFFER_CREATED,
                order, payload);

        log.info("Offer created: offerId={}, orderId={}, driverId={}, round={}, distanceKm={}, expiresAt={}",
                offer.getId(), orderId, best.getDriverId(), offer.getRound(),
                String.format("%.2f", best.getDistanceKm()), offer.getExpiresAt());
        return DispatchAttempt.offered(offer.getId(), best.getDriverId(), offer.getExpiresAt());
    }

    /**
     * A driver's answer to an offer.
     *
     * @throws OfferExpiredException       deadline passed or the offer was already decided
     * @throws AssignmentConflictException the driver took another order first; this order is re-dispatched
     * @throws OrderNotReadyException      the order was cancelled or assigned elsewhere
     */
    public DispatchOfferResponse respondToOffer(UUID offerId, Long driverId, boolean accept) {
        DispatchOffer offer = offerRepository.findById(offerId)
                .orElseThrow(() -> new ResourceNotFoundException("Offer not found: " + offerId));

        if (!offer.getDriverId().equals(driverId)) {
            log.warn("Driver answered an offer made to someone else: offerId={}, driverId={}, offeredTo={}",
                    offerId, driverId, offer.getDriverId());
            throw new AccessDeniedException("This offer was not made to you");
        }

        return accept ? acceptOffer(offer) : rejectOffer(offer);
    }

    private DispatchOfferResponse acceptOffer(DispatchOffer offer) {
        try {
            DispatchOfferResponse accepted = self.atomicAccept(offer.getId(), offer.getOrderId(), offer.getDriverId());
            log.info("Offer accepted: offerId={}, orderId={}, driverId={}",
                    offer.getId(), offer.getOrderId(), offer.getDriverId());
            return accepted;
        } catch (AssignmentConflictException e) {
            log.warn("Assignment conflict, offer rejected and order re-dispatched: offerId={}, orderId={}, driverId={}",
                    offer.getId(), offer.getOrderId(), offer.getDriverId());
            self.rejectAfterConflict(offer.getId());
            requestDispatch(offer.getOrderId());
            throw e;
        } catch (OfferExpiredException e) {
            log.warn("Late or duplicate accept: offerId={}, orderId={}, driverId={}",
                    offer.getId(), offer.getOrderId(), offer.getDriverId());
            expireOffer(offer.getId());
            throw e;
        } catch (OrderNotReadyException e) {
            log.warn("Accept for an order no longer waiting for a driver: offerId={}, orderId={}",
                    offer.getId(), offer.getOrderId());
            self.withdrawOffers(offer.getOrderId());
            throw e;
        }
    }

    private DispatchOfferResponse rejectOffer(DispatchOffer offer) {
        if (!self.atomicReject(offer.getId())) {
            log.warn("Reject after deadline or decision: offerId={}, orderId={}", offer.getId(), offer.getOrderId());
            expireOffer(offer.getId());
            throw new OfferExpiredException("Offer " + offer.getId() + " has expired or was already answered");
        }
        log.info("Offer rejected: offerId={}, orderId={}, driverId={}",
                offer.getId(), offer.getOrderId(), offer.getDriverId());
        requestDispatch(offer.getOrderId());
        return offerRepository.findById(offer.getId()).map(dispatchMapper::toOfferResponse)
                .orElseThrow(() -> new ResourceNotFoundException("Offer not found: " + offer.getId()));
    }

    /**
     * The accept as one transaction: offer outcome, driver slot, order assignment,
     * withdrawal of other offers. Any failed condition rolls back all of it.
     */
    @Transactional
    public DispatchOfferResponse atomicAccept(UUID offerId, Long orderId, Long driverId) {
        Instant now = timerService.now();

        if (offerRepository.acceptIfPending(offerId, now) == 0) {
            throw new OfferExpiredException("Offer " + offerId + " has expired or was already answered");
        }
        if (driverAvailabilityRepository.claimAssignmentSlot(driverId, orderId, now) == 0) {
            throw new AssignmentConflictException("Driver " + driverId + " is already assigned to another order");
        }
        if (orderRepository.assignDriver(orderId, driverId, now) == 0) {
            throw new OrderNotReadyException("Order " + orderId + " is no longer waiting for a driver");
        }
        offerRepository.expirePendingForOrder(orderId, now);

        Order order = findOrder(orderId);
        recordAssignment(order, driverId, ActorRole.DRIVER, driverId, now);

        return offerRepository.findById(offerId).map(dispatchMapper::toOfferResponse)
                .orElseThrow(() -> new ResourceNotFoundException("Offer not found: " + offerId));
    }

    @Transactional
    public boolean atomicReject(UUID offerId) {
        return offerRepository.rejectIfPending(offerId, timerService.now()) == 1;
    }

    @Transactional
    public void rejectAfterConflict(UUID offerId) {
        offerRepository.forceRejectIfPending(offerId, timerService.now());
    }

    @Transactional
    public void withdrawOffers(Long orderId) {
        int withdrawn = offerRepository.expirePendingForOrder(orderId, timerService.now());
        log.debug("Pending offers withdrawn: orderId={}, count={}", orderId, withdrawn);
    }

    /**
     * Expires an unanswered offer past its deadline and moves dispatch on to the next driver.
     * Called by the offer timer and the sweeper; only the caller that wins the
     * PENDING to EXPIRED write re-dispatches.
     *
     * @return true if this call expired the offer
     */
    public boolean expireOffer(UUID offerId) {
        DispatchOffer offer = offerRepository.findById(offerId).orElse(null);
        if (offer == null) {
            log.warn("Expiry for unknown offer: offerId={}", offerId);
            return false;
        }
        if (!self.atomicExpire(offerId)) {
            log.debug("Offer already decided or not yet due: offerId={}", offerId);
            return false;
        }
        log.info("Offer expired: offerId={}, orderId={}, driverId={}", offerId, offer.getOrderId(), offer.getDriverId());
        requestDispatch(offer.getOrderId());
        return true;
    }

    @Transactional
    public boolean atomicExpire(UUID offerId) {
        return offerRepository.expireIfOverdue(offerId, timerService.now()) == 1;
    }

    /**
     * Operator assignment, bypassing offers. With no driver given the best candidate is picked.
     *
     * @throws NoDriverAvailableException no driver given and nobody eligible
     */
    public void manualAssign(Long orderId, Long driverId, Actor actor) {
        requireOperator(actor);

        Long chosen = driverId;
        if (chosen == null) {
            Order order = findOrder(orderId);
            List<DriverCandidate> candidates = driverAvailabilityService.findCandidates(
                    order.getPickupLocation(), dispatchProperties.getMaxRadiusKm(), List.of());
            if (candidates.isEmpty()) {
                log.warn("Manual assignment found no eligible driver: orderId={}", orderId);
                throw new NoDriverAvailableException("No eligible driver near order " + orderId);
            }
            chosen = candidates.get(0).getDriverId();
        }

        self.atomicManualAssign(orderId, chosen, actor);
        log.info("Order manually assigned: orderId={}, driverId={}, by={}", orderId, chosen, actor.getUserId());
    }

    @Transactional
    public void atomicManualAssign(Long orderId, Long driverId, Actor actor) {
        Instant now = timerService.now();
        Order order = findOrder(orderId);
        if (order.getStatus() != OrderStatus.READY || order.getDriverId() != null) {
            throw new OrderNotReadyException("Order " + orderId + " is not READY and unassigned");
        }

        if (driverAvailabilityRepository.claimAssignmentSlot(driverId, orderId, now) == 0) {
            throw new AssignmentConflictException("Driver " + driverId + " is unavailable or already assigned");
        }
        if (orderRepository.assignDriver(orderId, driverId, now) == 0) {
            throw new OrderNotReadyException("Order " + orderId + " is no longer waiting for a driver");
        }
        offerRepository.expirePendingForOrder(orderId, now);

        recordAssignment(findOrder(orderId), driverId, actor.getRole(), actor.getUserId(), now);
    }

    /**
     * Clears escalation and round counter of a READY order and dispatches again.
     */
    public DispatchAttempt resetDispatch(Long orderId, Actor actor) {
        requireOperator(actor);
        self.clearDispatchState(orderId);
        log.info("Dispatch reset by operator: orderId={}, by={}", orderId, actor.getUserId());
        return requestDispatch(orderId);
    }

    /**
     * Frees a driver whose slot is stuck on an order that will never complete.
     */
    public DriverAvailabilityResponse releaseDriver(Long driverId, Actor actor) {
        requireOperator(actor);
        boolean released = driverAvailabilityService.releaseAssignment(driverId);
        log.info("Driver slot released by operator: driverId={}, released={}, by={}",
                driverId, released, actor.getUserId());
        return driverAvailabilityService.getAvailability(driverId);
    }

    @Transactional
    public void clearDispatchState(Long orderId) {
        Order order = findOrder(orderId);
        if (order.getStatus() != OrderStatus.READY || order.getDriverId() != null) {
            throw new OrderNotReadyException("Order " + orderId + " is not READY and unassigned");
        }
        order.clearEscalation();
        order.setDispatchRounds(0);
        orderRepository.save(order);
    }

    @Transactional(readOnly = true)
    public List<DispatchOfferResponse> getOutstandingOffers(Long driverId) {
        return offerRepository.findByDriverIdAndOutcomeAndExpiresAtAfterOrderByOfferedAtAsc(
                        driverId, OfferOutcome.PENDING, timerService.now()).stream()
                .map(dispatchMapper::toOfferResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<OrderResponse> getEscalatedOrders(Actor actor) {
        requireOperator(actor);
        return orderRepository.findByEscalatedTrueOrderByEscalatedAtAsc().stream()
                .map(orderMapper::toOrderResponse)
                .toList();
    }

    private void recordAssignment(Order order, Long driverId, ActorRole role, Long actorId, Instant now) {
        historyRepository.save(OrderStatusHistory.builder()
                .orderId(order.getId())
                .status(order.getStatus())
                .actorId(actorId)
                .actorRole(role)
                .notes("Driver " + driverId + " assigned")
                .createdAt(now)
                .build());

        Map<String, Object> payload = Map.of("driverId", driverId);
        notificationDispatcher.notify(Recipients.driver(driverId), NotificationEventType.DRIVER_ASSIGNED, order, payload);
        notificationDispatcher.notify(Recipients.customer(order.getCustomerId()),
                NotificationEventType.DRIVER_ASSIGNED, order, payload);
        notificationDispatcher.notify(Recipients.restaurant(order.getRestaurantId()),
                NotificationEventType.DRIVER_ASSIGNED, order, payload);
    }

    private void requireOperator(Actor actor) {
        if (!actor.isPrivileged()) {
            throw AccessDeniedException.operatorsOnly("manage dispatch");
        }
    }

    private Order findOrder(Long orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found: " + orderId));
    }
}
