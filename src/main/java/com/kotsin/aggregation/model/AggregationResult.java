package com.kotsin.aggregation.model;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of one window emitted on an aggregation tick.
 */
@Value
public class AggregationResult {

    /** Start time of the window (epoch millis, aligned to the sliding interval). */
    long timestamp;

    /** Number of records in the window when the snapshot was taken. */
    int count;

    /** Group key to per-group statistics, in first-seen group order. */
    Map<String, GroupStatistics> data;

    public AggregationResult(long timestamp, int count, Map<String, GroupStatistics> data) {
        this.timestamp = timestamp;
        this.count = count;
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
