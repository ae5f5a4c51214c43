package com.quickgo.orderservice.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

@Service
@RequiredArgsConstructor
@Slf4j
public class TaskSchedulerTimerService implements TimerService {

    private final Clock clock;
    private final TaskScheduler taskScheduler;

    @Override
    public Instant now() {
        return clock.instant();
    }

    @Override
    public void scheduleAt(Instant when, Runnable callback) {
        taskScheduler.schedule(() -> {
            try {
                callback.run();
            } catch (Exception e) {
                // The sweeper picks up whatever this callback failed to do
                log.error("Scheduled callback failed: scheduledFor={}, error={}", when, e.getMessage(), e);
            }
        }, when);
        log.debug("Callback scheduled: at={}", when);
    }
}
