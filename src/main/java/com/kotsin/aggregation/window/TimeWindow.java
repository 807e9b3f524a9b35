package com.kotsin.aggregation.window;

import com.kotsin.aggregation.model.DataRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A bucket of record copies keyed by its aligned start time.
 * Not thread-safe; owned by {@link SlidingWindowAggregator}.
 */
final class TimeWindow {

    private final long startTime;
    private final List<DataRecord> records = new ArrayList<>();

    TimeWindow(long startTime) {
        this.startTime = startTime;
    }

    long getStartTime() {
        return startTime;
    }

    void add(DataRecord record) {
        records.add(record);
    }

    int size() {
        return records.size();
    }

    long ageAt(long now) {
        return now - startTime;
    }

    List<DataRecord> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(records));
    }

    @Override
    public String toString() {
        return String.format("Window{start=%d, records=%d}", startTime, records.size());
    }
}
