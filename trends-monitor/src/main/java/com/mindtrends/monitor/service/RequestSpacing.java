package com.mindtrends.monitor.service;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Enforces a minimum gap between consecutive upstream requests of one pipeline run.
 *
 * The limiter bounds the average rate in fixed refresh periods, which still lets a permit
 * taken at the end of one period be followed at once by the next period's permit. This
 * gate holds the time the next request may start. Workers take their turn one at a time
 * under a fair lock, sleeping while holding it, so two requests are never closer than the
 * interval whichever workers issue them.
 */
@Slf4j
public class RequestSpacing {

    private final long intervalNanos;
    private final ReentrantLock lock = new ReentrantLock(true);

    // Guarded by lock; meaningful once a first turn has been taken.
    private long nextAllowed;
    private boolean started;

    public RequestSpacing(Duration interval) {
        this.intervalNanos = Math.max(0L, interval.toNanos());
    }

    /**
     * Blocks until at least the interval has passed since the previous turn ended, then
     * claims the current instant as this request's start.
     *
     * @throws InterruptedException if the worker is cancelled while queued or sleeping
     */
    public void awaitTurn() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            if (started) {
                long remaining = nextAllowed - System.nanoTime();
                if (remaining > 0) {
                    log.trace("Spacing next request by {} ms", TimeUnit.NANOSECONDS.toMillis(remaining));
                }
                while (remaining > 0) {
                    TimeUnit.NANOSECONDS.sleep(remaining);
                    remaining = nextAllowed - System.nanoTime();
                }
            }
            started = true;
            nextAllowed = System.nanoTime() + intervalNanos;
        } finally {
            lock.unlock();
        }
    }

    public Duration getInterval() {
        return Duration.ofNanos(intervalNanos);
    }
}
