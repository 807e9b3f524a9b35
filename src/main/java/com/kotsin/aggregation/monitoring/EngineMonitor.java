package com.kotsin.aggregation.monitoring;

import com.kotsin.aggregation.engine.DataEngine;
import com.kotsin.aggregation.metrics.StreamMetrics;
import com.kotsin.aggregation.model.EngineStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.util.HashMap;
import java.util.Map;

/**
 * Periodic engine and heap report.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EngineMonitor {

    private static final double HEAP_CRITICAL_PERCENT = 90;
    private static final double HEAP_WARNING_PERCENT = 80;

    private final DataEngine engine;

    private final MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();
    private final long startTime = System.currentTimeMillis();

    @Scheduled(fixedRateString = "${aggregation.monitor-interval-ms:60000}")
    public void reportMetrics() {
        EngineStatus status = engine.getStatus();
        double heapUsedPercent = heapUsedPercent();

        log.info("📊 Engine: status={}, activeSessions={}, trackedWindows={}, aggregations={}",
                status.getStatus(), status.getActiveSessions(), status.getTrackedWindows(), status.getAggregationCount());
        log.info("📈 Stream Metrics: {}", status.getMetrics());
        log.info("Memory: Usage={}%", String.format("%.2f", heapUsedPercent));

        if (heapUsedPercent > HEAP_CRITICAL_PERCENT) {
            log.error("🚨 ALERT [CRITICAL]: Heap memory usage {}%", String.format("%.2f", heapUsedPercent));
        } else if (heapUsedPercent > HEAP_WARNING_PERCENT) {
            log.warn("⚠️ ALERT [WARNING]: Heap memory usage {}%", String.format("%.2f", heapUsedPercent));
        }
        if (!engine.getMetrics().isHealthy()) {
            log.error("🚨 ALERT [CRITICAL]: Most sources are failing - {}", status.getMetrics());
        }
    }

    public boolean isSystemHealthy() {
        return !engine.isCleanedUp()
                && heapUsedPercent() <= HEAP_CRITICAL_PERCENT
                && engine.getMetrics().isHealthy();
    }

    public Map<String, Object> getSystemMetrics() {
        StreamMetrics metrics = engine.getMetrics();
        Map<String, Object> out = new HashMap<>();
        out.put("memory.heap.usage.percent", heapUsedPercent());
        out.put("stream.metrics", metrics.getMetrics());
        out.put("system.healthy", isSystemHealthy());
        out.put("system.uptime.seconds", (System.currentTimeMillis() - startTime) / 1000);
        return out;
    }

    private double heapUsedPercent() {
        MemoryUsage heap = memoryBean.getHeapMemoryUsage();
        long max = heap.getMax() > 0 ? heap.getMax() : heap.getCommitted();
        return (double) heap.getUsed() / max * 100;
    }
}
