package com.quickgo.orderservice.service;

import java.time.Instant;

/**
 * Current time plus one-shot delayed callbacks (offer expiry, dispatch retry).
 * Callbacks are in-memory only; DispatchSweeper reconciles anything lost on restart.
 */
public interface TimerService {

    Instant now();

    void scheduleAt(Instant when, Runnable callback);
}
