package com.futures.monitor.api;

import java.time.Duration;
import java.util.concurrent.locks.LockSupport;

/**
 * Blocking wait used when pacing requests. Replaceable so tests can advance a simulated clock.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper PARKING = duration -> {
        LockSupport.parkNanos(duration.toNanos());
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("Interrupted while pacing request");
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
