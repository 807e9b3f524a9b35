package com.kotsin.aggregation.config;

import com.kotsin.aggregation.engine.DataEngine;
import com.kotsin.aggregation.window.SlidingWindowAggregator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Thread pools and the engine bean.
 *
 * - sourceExecutor: one task per source being processed
 * - chunkExecutor: sub-chunk stamping inside a flush cycle
 *
 * Both pools run rejected work on the caller thread so a full queue slows the
 * producer down instead of dropping records.
 */
@Configuration
@EnableConfigurationProperties(AggregationProperties.class)
@Slf4j
public class EngineConfig {

    @Bean
    public Clock engineClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProcessingOptions processingOptions(AggregationProperties properties) {
        return properties.toOptions();
    }

    @Bean(name = "sourceExecutor")
    public ThreadPoolTaskExecutor sourceExecutor(AggregationProperties properties) {
        return callerRunsPool("source-worker-", properties.getSourcePoolSize(), properties.getQueueCapacity());
    }

    @Bean(name = "chunkExecutor")
    public ThreadPoolTaskExecutor chunkExecutor(AggregationProperties properties) {
        return callerRunsPool("chunk-worker-", properties.getChunkPoolSize(), properties.getQueueCapacity());
    }

    @Bean(destroyMethod = "stop")
    public SlidingWindowAggregator slidingWindowAggregator(ProcessingOptions options, Clock engineClock) {
        SlidingWindowAggregator aggregator = new SlidingWindowAggregator(options, engineClock);
        aggregator.start();
        return aggregator;
    }

    @Bean(destroyMethod = "close")
    public DataEngine dataEngine(ProcessingOptions options,
                                 SlidingWindowAggregator aggregator,
                                 @Qualifier("sourceExecutor") Executor sourceExecutor,
                                 @Qualifier("chunkExecutor") Executor chunkExecutor,
                                 Clock engineClock) {
        return new DataEngine(options, aggregator, sourceExecutor, chunkExecutor, engineClock);
    }

    private ThreadPoolTaskExecutor callerRunsPool(String prefix, int poolSize, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);

        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("[{}] Queue full, executing in caller thread. activeCount={}, queueSize={}",
                    prefix, e.getActiveCount(), e.getQueue().size());
            if (!e.isShutdown()) {
                r.run();
            }
        });

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) ProcessingConstants.SHUTDOWN_TIMEOUT.toSeconds());
        executor.initialize();

        log.info("[{}] Initialized: poolSize={}, queueCapacity={}", prefix, poolSize, queueCapacity);
        return executor;
    }
}
