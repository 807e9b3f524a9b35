package com.kotsin.aggregation.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Bounded, ordered group of stamped records emitted downstream as one unit.
 */
@Value
@Builder
public class RecordBatch {

    long sequence;

    @Singular
    List<DataRecord> records;

    /** Sub-chunks the batch was split into. */
    int chunkCount;

    /** Sub-chunks dropped because their processing failed. */
    int failedChunks;

    long emittedAt;

    public int size() {
        return records.size();
    }
}
