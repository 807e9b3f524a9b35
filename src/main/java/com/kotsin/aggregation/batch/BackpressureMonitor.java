package com.kotsin.aggregation.batch;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks buffered depth for one batcher against its high-water mark.
 *
 * Throttling is on while the records left waiting behind an in-flight flush
 * reach the mark, and turns off once a flush cycle drains the buffer below it.
 */
@Slf4j
public class BackpressureMonitor {

    private final long highWaterMark;

    private final AtomicLong processedRecords = new AtomicLong(0);
    private final AtomicLong pendingRecords = new AtomicLong(0);
    private final AtomicLong throttleEvents = new AtomicLong(0);
    private final AtomicBoolean throttlingActive = new AtomicBoolean(false);
    private final AtomicLong lastThrottleTime = new AtomicLong(0);

    public BackpressureMonitor(long highWaterMark) {
        this.highWaterMark = highWaterMark;
    }

    /**
     * Records the current buffered depth and decides whether the producer must
     * wait for the in-flight flush.
     */
    public boolean shouldApplyBackpressure(long pending) {
        long currentPending = Math.max(pending, 0);
        pendingRecords.set(currentPending);
        boolean shouldThrottle = currentPending >= highWaterMark;

        if (shouldThrottle && throttlingActive.compareAndSet(false, true)) {
            throttleEvents.incrementAndGet();
            log.warn("🚨 Backpressure triggered: pending={}, highWaterMark={}, processed={}",
                    currentPending, highWaterMark, processedRecords.get());
            lastThrottleTime.set(System.currentTimeMillis());
        } else if (!shouldThrottle && throttlingActive.compareAndSet(true, false)) {
            long throttleDuration = System.currentTimeMillis() - lastThrottleTime.get();
            log.info("✅ Backpressure released after {}ms: pending={}, processed={}",
                    throttleDuration, currentPending, processedRecords.get());
        }

        return shouldThrottle;
    }

    public void recordProcessed(int count) {
        processedRecords.addAndGet(count);
    }

    public long getProcessedRecords() {
        return processedRecords.get();
    }

    public long getThrottleEvents() {
        return throttleEvents.get();
    }

    public boolean isThrottling() {
        return throttlingActive.get();
    }

    public String getBackpressureStats() {
        return String.format("Processed: %d, Pending: %d, Throttling: %s",
                processedRecords.get(),
                pendingRecords.get(),
                throttlingActive.get() ? "Active" : "Inactive");
    }
}
