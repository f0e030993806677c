package com.rsl.retrieval.resilience;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Opens after {@code failureThreshold} consecutive failures and rejects calls until the
 * cool-down elapses.
 */
public class CircuitBreaker {
    private final String name;
    private final int failureThreshold;
    private final long openDurationMs;
    private final LongSupplier clockMs;
    private final AtomicInteger failureCount = new AtomicInteger(0);
    private final AtomicLong openUntilMs = new AtomicLong(0L);

    public CircuitBreaker(String name, int failureThreshold, long openDurationMs) {
        this(name, failureThreshold, openDurationMs, System::currentTimeMillis);
    }

    public CircuitBreaker(String name, int failureThreshold, long openDurationMs, LongSupplier clockMs) {
        this.name = name;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.openDurationMs = Math.max(1L, openDurationMs);
        this.clockMs = clockMs;
    }

    public String getName() {
        return name;
    }

    public boolean allowRequest() {
        return clockMs.getAsLong() >= openUntilMs.get();
    }

    public boolean isOpen() {
        return !allowRequest();
    }

    public void recordSuccess() {
        failureCount.set(0);
    }

    /**
     * @return true when this failure opened the breaker
     */
    public boolean recordFailure() {
        int failures = failureCount.incrementAndGet();
        if (failures >= failureThreshold) {
            openUntilMs.set(clockMs.getAsLong() + openDurationMs);
            failureCount.set(0);
            return true;
        }
        return false;
    }
}
