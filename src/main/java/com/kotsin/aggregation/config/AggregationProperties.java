package com.kotsin.aggregation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Binds {@code aggregation.*} from application.yml.
 */
@Data
@ConfigurationProperties(prefix = "aggregation")
public class AggregationProperties {

    private int batchSize = ProcessingConstants.DEFAULT_BATCH_SIZE;
    private long windowSizeMs = ProcessingConstants.DEFAULT_WINDOW_SIZE.toMillis();
    private long slidingIntervalMs = ProcessingConstants.DEFAULT_SLIDING_INTERVAL.toMillis();
    private int fanOut = ProcessingConstants.DEFAULT_FAN_OUT;
    private int highWaterMark = ProcessingConstants.DEFAULT_HIGH_WATER_MARK;

    private int sourcePoolSize = ProcessingConstants.SOURCE_POOL_SIZE;
    private int chunkPoolSize = ProcessingConstants.CHUNK_POOL_SIZE;
    private int queueCapacity = ProcessingConstants.QUEUE_CAPACITY;
    private long monitorIntervalMs = ProcessingConstants.MONITOR_INTERVAL_MS;

    public ProcessingOptions toOptions() {
        return ProcessingOptions.builder()
                .batchSize(batchSize)
                .windowSize(Duration.ofMillis(windowSizeMs))
                .slidingInterval(Duration.ofMillis(slidingIntervalMs))
                .fanOut(fanOut)
                .highWaterMark(highWaterMark)
                .build();
    }
}
