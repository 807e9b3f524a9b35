package com.kotsin.aggregation.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Fails startup on batching or windowing settings the engine cannot run with.
 */
@Component
@Slf4j
public class ConfigurationValidator {

    private final AggregationProperties properties;

    @Value("${spring.profiles.active:default}")
    private String activeProfile;

    public ConfigurationValidator(AggregationProperties properties) {
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateConfiguration() {
        if ("test".equals(activeProfile)) {
            log.info("⏭️ Skipping configuration validation in test mode");
            return;
        }

        log.info("🔍 Validating aggregation configuration...");
        List<String> errors = validate();

        if (!errors.isEmpty()) {
            log.error("❌ Configuration validation failed with {} errors:", errors.size());
            errors.forEach(error -> log.error("  - {}", error));
            throw new IllegalStateException("Configuration validation failed. Please fix the errors above.");
        }

        log.info("✅ Configuration validation passed");
        logConfigurationSummary();
    }

    List<String> validate() {
        List<String> errors = new ArrayList<>();

        if (properties.getBatchSize() <= 0) {
            errors.add("aggregation.batch-size must be positive");
        }
        if (properties.getWindowSizeMs() <= 0) {
            errors.add("aggregation.window-size-ms must be positive");
        }
        if (properties.getSlidingIntervalMs() <= 0) {
            errors.add("aggregation.sliding-interval-ms must be positive");
        }
        if (properties.getFanOut() <= 0) {
            errors.add("aggregation.fan-out must be positive");
        }
        if (properties.getHighWaterMark() <= 0) {
            errors.add("aggregation.high-water-mark must be positive");
        }
        if (properties.getSourcePoolSize() <= 0 || properties.getChunkPoolSize() <= 0) {
            errors.add("aggregation pool sizes must be positive");
        }

        if (properties.getSlidingIntervalMs() > 0
                && properties.getWindowSizeMs() % properties.getSlidingIntervalMs() != 0) {
            log.warn("⚠️ aggregation.window-size-ms ({}) is not a multiple of aggregation.sliding-interval-ms ({})",
                    properties.getWindowSizeMs(), properties.getSlidingIntervalMs());
        }
        if (properties.getHighWaterMark() < properties.getBatchSize()) {
            log.warn("⚠️ aggregation.high-water-mark ({}) is below batch-size ({}); batches will flush early",
                    properties.getHighWaterMark(), properties.getBatchSize());
        }
        return errors;
    }

    private void logConfigurationSummary() {
        log.info("📋 Configuration Summary:");
        log.info("  Batch Size: {}, Fan Out: {}, High Water Mark: {}",
                properties.getBatchSize(), properties.getFanOut(), properties.getHighWaterMark());
        log.info("  Window Size: {}ms, Sliding Interval: {}ms",
                properties.getWindowSizeMs(), properties.getSlidingIntervalMs());
        log.info("  Pools: source={}, chunk={}, queueCapacity={}",
                properties.getSourcePoolSize(), properties.getChunkPoolSize(), properties.getQueueCapacity());
    }
}
