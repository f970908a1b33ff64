package com.futures.monitor.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-endpoint request weight budget over a sliding window.
 *
 * Every request is recorded with its own timestamp and weight, and a request only fits
 * if the weight recorded within the window ending at that request plus its own weight stays
 * within the limit. There is no fixed window boundary that resets the budget.
 *
 * The lock is not held while waiting.
 */
public class SlidingWindowWeightBudget {
    private static final Logger logger = LoggerFactory.getLogger(SlidingWindowWeightBudget.class);

    private final int weightLimit;
    private final Duration window;
    private final Clock clock;
    private final Sleeper sleeper;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Endpoint, Deque<Slot>> usage = new EnumMap<>(Endpoint.class);

    public SlidingWindowWeightBudget(int weightLimit, Duration window, Clock clock, Sleeper sleeper) {
        if (weightLimit <= 0) {
            throw new IllegalArgumentException("weightLimit must be positive");
        }
        this.weightLimit = weightLimit;
        this.window = window;
        this.clock = clock;
        this.sleeper = sleeper;
        logger.info("Weight budget initialized: {} per {}s per endpoint", weightLimit, window.toSeconds());
    }

    /**
     * Block until the endpoint's budget has room for one more request, then record it.
     */
    public void acquire(Endpoint endpoint) throws InterruptedException {
        while (true) {
            Duration wait = tryAcquire(endpoint);
            if (wait.isZero()) {
                return;
            }
            logger.debug("Weight budget for {} exhausted, delaying {}ms", endpoint, wait.toMillis());
            sleeper.sleep(wait);
        }
    }

    /**
     * Record the request if it fits; otherwise return how long until it would.
     *
     * @return {@link Duration#ZERO} when the request was recorded
     */
    public Duration tryAcquire(Endpoint endpoint) {
        int weight = Math.min(endpoint.weight(), weightLimit);
        lock.lock();
        try {
            Instant now = clock.instant();
            Deque<Slot> slots = usage.computeIfAbsent(endpoint, e -> new ArrayDeque<>());
            evictExpired(slots, now);

            int used = slots.stream().mapToInt(Slot::weight).sum();
            if (used + weight <= weightLimit) {
                slots.addLast(new Slot(now, weight));
                return Duration.ZERO;
            }

            // Walk the oldest slots until enough weight would have left the window
            int toFree = used + weight - weightLimit;
            for (Slot slot : slots) {
                toFree -= slot.weight();
                if (toFree <= 0) {
                    Duration wait = Duration.between(now, slot.at().plus(window));
                    return wait.isNegative() || wait.isZero() ? Duration.ofMillis(1) : wait;
                }
            }
            return window;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Weight currently counted against the endpoint's window.
     */
    public int usedWeight(Endpoint endpoint) {
        lock.lock();
        try {
            Deque<Slot> slots = usage.get(endpoint);
            if (slots == null) {
                return 0;
            }
            evictExpired(slots, clock.instant());
            return slots.stream().mapToInt(Slot::weight).sum();
        } finally {
            lock.unlock();
        }
    }

    private void evictExpired(Deque<Slot> slots, Instant now) {
        Instant cutoff = now.minus(window);
        while (!slots.isEmpty() && !slots.peekFirst().at().isAfter(cutoff)) {
            slots.pollFirst();
        }
    }

    private record Slot(Instant at, int weight) {}
}
