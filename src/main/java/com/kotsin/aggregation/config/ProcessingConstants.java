package com.kotsin.aggregation.config;

import java.time.Duration;

/**
 * Central constants for record batching and window aggregation
 */
public final class ProcessingConstants {

    private ProcessingConstants() {
        throw new UnsupportedOperationException("Constants class");
    }

    // ========== BATCHING CONSTANTS ==========

    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final int DEFAULT_FAN_OUT = 4;
    public static final int DEFAULT_HIGH_WATER_MARK = 1000;

    // ========== WINDOW CONSTANTS ==========

    public static final Duration DEFAULT_WINDOW_SIZE = Duration.ofMillis(1000);
    public static final Duration DEFAULT_SLIDING_INTERVAL = Duration.ofMillis(500);

    // ========== PERFORMANCE CONSTANTS ==========

    public static final int SOURCE_POOL_SIZE = 4;
    public static final int CHUNK_POOL_SIZE = 4;
    public static final int QUEUE_CAPACITY = 1000;
    public static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    // ========== MONITORING CONSTANTS ==========

    public static final long MONITOR_INTERVAL_MS = 60000;
}
