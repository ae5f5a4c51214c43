package com.quickgo.orderservice.job;

import com.quickgo.orderservice.config.SweeperProperties;
import com.quickgo.orderservice.repository.DispatchOfferRepository;
import com.quickgo.orderservice.repository.OrderRepository;
import com.quickgo.orderservice.service.DispatchAttempt;
import com.quickgo.orderservice.service.DispatchService;
import com.quickgo.orderservice.service.OrderLifecycleService;
import com.quickgo.orderservice.service.TimerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Safety net for the in-memory timers. Offers whose expiry callback was lost (restart, crash)
 * get expired here, READY orders without an outstanding offer get dispatched again and
 * orders stuck in PENDING past the confirmation window are flagged for operators.
 * Every step goes through the same conditional updates as the timers, so running it
 * on several instances at once is harmless.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DispatchSweeper {

    private final DispatchOfferRepository offerRepository;
    private final OrderRepository orderRepository;
    private final DispatchService dispatchService;
    private final OrderLifecycleService orderLifecycleService;
    private final SweeperProperties sweeperProperties;
    private final TimerService timerService;

    @Scheduled(fixedDelayString = "${quickgo.sweeper.interval-ms:60000}",
            initialDelayString = "${quickgo.sweeper.interval-ms:60000}")
    public void sweep() {
        Instant now = timerService.now();
        int expired = expireOverdueOffers(now);
        int flagged = flagOverdueConfirmations(now);
        int redispatched = redispatchStalledOrders();

        if (expired + flagged + redispatched > 0) {
            log.info("Sweep finished: expiredOffers={}, overdueConfirmations={}, redispatched={}",
                    expired, flagged, redispatched);
        }
    }

    int expireOverdueOffers(Instant now) {
        List<UUID> overdue = offerRepository.findOverdueOfferIds(now);
        int count = 0;
        for (UUID offerId : overdue) {
            try {
                if (dispatchService.expireOffer(offerId)) {
                    count++;
                }
            } catch (Exception e) {
                log.error("Sweeper failed to expire offer: offerId={}, error={}", offerId, e.getMessage(), e);
            }
        }
        return count;
    }

    int flagOverdueConfirmations(Instant now) {
        Instant cutoff = now.minus(sweeperProperties.getConfirmationSla());
        int count = 0;
        for (Long orderId : orderRepository.findOverduePendingOrderIds(cutoff)) {
            try {
                if (orderLifecycleService.flagConfirmationOverdue(orderId)) {
                    count++;
                }
            } catch (Exception e) {
                log.error("Sweeper failed to flag overdue order: orderId={}, error={}", orderId, e.getMessage(), e);
            }
        }
        return count;
    }

    int redispatchStalledOrders() {
        int count = 0;
        for (Long orderId : orderRepository.findStalledReadyOrderIds()) {
            try {
                if (dispatchService.requestDispatch(orderId).getResult() != DispatchAttempt.Result.SKIPPED) {
                    count++;
                }
            } catch (Exception e) {
                log.error("Sweeper failed to dispatch order: orderId={}, error={}", orderId, e.getMessage(), e);
            }
        }
        return count;
    }
}
