package com.quickgo.orderservice.service;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

/**
 * What one dispatch round decided. Timers are scheduled from it only after the
 * round's transaction committed.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DispatchAttempt {

    public enum Result {
        // order not READY, already assigned, exhausted, or an offer is still outstanding
        SKIPPED,
        OFFERED,
        NO_CANDIDATE,
        EXHAUSTED
    }

    private final Result result;
    private final UUID offerId;
    private final Long driverId;
    // offer deadline for OFFERED, retry time for NO_CANDIDATE
    private final Instant nextCheckAt;

    public static DispatchAttempt skipped() {
        return new DispatchAttempt(Result.SKIPPED, null, null, null);
    }

    public static DispatchAttempt offered(UUID offerId, Long driverId, Instant expiresAt) {
        return new DispatchAttempt(Result.OFFERED, offerId, driverId, expiresAt);
    }

    public static DispatchAttempt noCandidate(Instant retryAt) {
        return new DispatchAttempt(Result.NO_CANDIDATE, null, null, retryAt);
    }

    public static DispatchAttempt exhausted() {
        return new DispatchAttempt(Result.EXHAUSTED, null, null, null);
    }
}
