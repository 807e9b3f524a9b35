package com.kotsin.aggregation.config;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable batching and windowing configuration.
 *
 * Validated on construction: sizes and durations must be positive.
 */
@Getter
@ToString
@EqualsAndHashCode
@Slf4j
public final class ProcessingOptions {

    private final int batchSize;
    private final Duration windowSize;
    private final Duration slidingInterval;

    /** Number of concurrent sub-chunks a batch is split into. */
    private final int fanOut;

    /** Buffer depth that forces a flush and counts as backpressure. */
    private final int highWaterMark;

    @Builder
    private ProcessingOptions(int batchSize, Duration windowSize, Duration slidingInterval,
                              Integer fanOut, Integer highWaterMark) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, got " + batchSize);
        }
        requirePositive(windowSize, "windowSize");
        requirePositive(slidingInterval, "slidingInterval");

        this.batchSize = batchSize;
        this.windowSize = windowSize;
        this.slidingInterval = slidingInterval;
        this.fanOut = fanOut != null ? fanOut : ProcessingConstants.DEFAULT_FAN_OUT;
        this.highWaterMark = highWaterMark != null ? highWaterMark : ProcessingConstants.DEFAULT_HIGH_WATER_MARK;

        if (this.fanOut <= 0) {
            throw new IllegalArgumentException("fanOut must be positive, got " + this.fanOut);
        }
        if (this.highWaterMark <= 0) {
            throw new IllegalArgumentException("highWaterMark must be positive, got " + this.highWaterMark);
        }
        if (windowSize.toMillis() % slidingInterval.toMillis() != 0) {
            log.warn("windowSize {}ms is not a multiple of slidingInterval {}ms; windows will overlap unevenly",
                    windowSize.toMillis(), slidingInterval.toMillis());
        }
    }

    public static ProcessingOptions of(int batchSize, long windowSizeMs, long slidingIntervalMs) {
        return builder()
                .batchSize(batchSize)
                .windowSize(Duration.ofMillis(windowSizeMs))
                .slidingInterval(Duration.ofMillis(slidingIntervalMs))
                .build();
    }

    public long windowSizeMs() {
        return windowSize.toMillis();
    }

    public long slidingIntervalMs() {
        return slidingInterval.toMillis();
    }

    /**
     * Upper bound on windows that can cover a single instant.
     */
    public int maxWindows() {
        return (int) ((windowSizeMs() + slidingIntervalMs() - 1) / slidingIntervalMs()) + 1;
    }

    private static void requirePositive(Duration duration, String name) {
        Objects.requireNonNull(duration, name);
        if (duration.toMillis() <= 0) {
            throw new IllegalArgumentException(name + " must be a positive duration, got " + duration);
        }
    }
}
