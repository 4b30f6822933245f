package com.infergate.service;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide request counters, written by every request and read by the health endpoint.
 */
@Component
public class ServerState {

    private final Clock clock;
    private final Instant startTime;
    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong errorCount = new AtomicLong();

    public ServerState(Clock clock) {
        this.clock = clock;
        this.startTime = clock.instant();
    }

    public void recordRequest() {
        totalRequests.incrementAndGet();
    }

    public void recordError() {
        errorCount.incrementAndGet();
    }

    public long getTotalRequests() {
        return totalRequests.get();
    }

    public long getErrorCount() {
        return errorCount.get();
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Duration uptime() {
        return Duration.between(startTime, clock.instant());
    }

    /**
     * Errors over requests, 0.0 before the first request.
     * Errors are read first: every error is counted after its request, so the ratio never exceeds 1.
     */
    public double errorRate() {
        long errors = errorCount.get();
        long total = totalRequests.get();
        if (total == 0) {
            return 0.0;
        }
        return Math.min(1.0, (double) errors / total);
    }
}
