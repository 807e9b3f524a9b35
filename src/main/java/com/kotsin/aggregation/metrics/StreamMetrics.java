package com.kotsin.aggregation.metrics;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Engine-wide counters. Not a Spring bean: each engine owns one.
 */
public class StreamMetrics {
    private final AtomicLong recordsIngested = new AtomicLong(0);
    private final AtomicLong batchesEmitted = new AtomicLong(0);
    private final AtomicLong recordsBatched = new AtomicLong(0);
    private final AtomicLong failedChunks = new AtomicLong(0);
    private final AtomicLong aggregationsEmitted = new AtomicLong(0);
    private final AtomicLong sourcesSucceeded = new AtomicLong(0);
    private final AtomicLong sourcesFailed = new AtomicLong(0);

    public void incRecordsIngested() { recordsIngested.incrementAndGet(); }
    public void incBatchEmit(int records, int failed) {
        batchesEmitted.incrementAndGet();
        recordsBatched.addAndGet(records);
        failedChunks.addAndGet(failed);
    }
    public void incAggregationEmit() { aggregationsEmitted.incrementAndGet(); }
    public void incSourceSucceeded() { sourcesSucceeded.incrementAndGet(); }
    public void incSourceFailed() { sourcesFailed.incrementAndGet(); }

    public long getRecordsIngested() { return recordsIngested.get(); }
    public long getBatchesEmitted() { return batchesEmitted.get(); }
    public long getRecordsBatched() { return recordsBatched.get(); }
    public long getFailedChunks() { return failedChunks.get(); }
    public long getAggregationsEmitted() { return aggregationsEmitted.get(); }
    public long getSourcesSucceeded() { return sourcesSucceeded.get(); }
    public long getSourcesFailed() { return sourcesFailed.get(); }

    /**
     * Healthy while no more than half of the finished sources failed.
     */
    public boolean isHealthy() {
        long failed = sourcesFailed.get();
        long total = failed + sourcesSucceeded.get();
        return total == 0 || failed * 2 <= total;
    }

    public Map<String, Long> getMetrics() {
        Map<String, Long> out = new LinkedHashMap<>();
        out.put("recordsIngested", recordsIngested.get());
        out.put("batchesEmitted", batchesEmitted.get());
        out.put("recordsBatched", recordsBatched.get());
        out.put("failedChunks", failedChunks.get());
        out.put("aggregationsEmitted", aggregationsEmitted.get());
        out.put("sourcesSucceeded", sourcesSucceeded.get());
        out.put("sourcesFailed", sourcesFailed.get());
        return out;
    }
}
