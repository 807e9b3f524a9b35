package com.kotsin.aggregation.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ProcessingOptions - Validation Tests")
class ProcessingOptionsTest {

    // ========== DEFAULTS ==========

    @Test
    @DisplayName("Should apply default fan-out and high-water mark")
    void testDefaults() {
        ProcessingOptions options = ProcessingOptions.of(100, 1000, 500);

        assertEquals(100, options.getBatchSize());
        assertEquals(1000, options.windowSizeMs());
        assertEquals(500, options.slidingIntervalMs());
        assertEquals(ProcessingConstants.DEFAULT_FAN_OUT, options.getFanOut());
        assertEquals(ProcessingConstants.DEFAULT_HIGH_WATER_MARK, options.getHighWaterMark());
    }

    @Test
    @DisplayName("Should bound the number of windows covering one instant")
    void testMaxWindows() {
        assertEquals(3, ProcessingOptions.of(1, 1000, 500).maxWindows());
        assertEquals(2, ProcessingOptions.of(1, 1000, 1000).maxWindows());
        assertEquals(4, ProcessingOptions.of(1, 1000, 400).maxWindows());
    }

    // ========== REJECTION TESTS ==========

    @Test
    @DisplayName("Should reject non-positive batch size")
    void testInvalidBatchSize() {
        assertThrows(IllegalArgumentException.class, () -> ProcessingOptions.of(0, 1000, 500));
        assertThrows(IllegalArgumentException.class, () -> ProcessingOptions.of(-5, 1000, 500));
    }

    @Test
    @DisplayName("Should reject non-positive durations")
    void testInvalidDurations() {
        assertThrows(IllegalArgumentException.class, () -> ProcessingOptions.of(10, 0, 500));
        assertThrows(IllegalArgumentException.class, () -> ProcessingOptions.of(10, 1000, 0));
        assertThrows(NullPointerException.class, () -> ProcessingOptions.builder()
                .batchSize(10)
                .slidingInterval(Duration.ofMillis(500))
                .build());
    }

    @Test
    @DisplayName("Should reject non-positive fan-out and high-water mark")
    void testInvalidFanOut() {
        assertThrows(IllegalArgumentException.class, () -> ProcessingOptions.builder()
                .batchSize(10)
                .windowSize(Duration.ofMillis(1000))
                .slidingInterval(Duration.ofMillis(500))
                .fanOut(0)
                .build());
        assertThrows(IllegalArgumentException.class, () -> ProcessingOptions.builder()
                .batchSize(10)
                .windowSize(Duration.ofMillis(1000))
                .slidingInterval(Duration.ofMillis(500))
                .highWaterMark(-1)
                .build());
    }

    @Test
    @DisplayName("Properties should convert into equivalent options")
    void testPropertiesToOptions() {
        AggregationProperties properties = new AggregationProperties();
        properties.setBatchSize(7);
        properties.setFanOut(2);

        ProcessingOptions options = properties.toOptions();

        assertEquals(7, options.getBatchSize());
        assertEquals(2, options.getFanOut());
        assertEquals(ProcessingConstants.DEFAULT_WINDOW_SIZE, options.getWindowSize());
    }

    // ========== CONSTANTS ==========

    @Test
    @DisplayName("Constants should not be instantiable")
    void testConstantsUtilityClass() {
        assertThrows(InvocationTargetException.class, () -> {
            Constructor<ProcessingConstants> constructor = ProcessingConstants.class.getDeclaredConstructor();
            constructor.setAccessible(true);
            constructor.newInstance();
        });
    }

    @Test
    @DisplayName("Default window should be a multiple of the sliding interval")
    void testDefaultWindowAlignment() {
        assertEquals(0, ProcessingConstants.DEFAULT_WINDOW_SIZE.toMillis()
                % ProcessingConstants.DEFAULT_SLIDING_INTERVAL.toMillis());
    }
}
