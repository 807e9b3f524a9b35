package com.kotsin.aggregation.batch;

import com.kotsin.aggregation.model.DataRecord;

/**
 * Per-record processing step applied inside a batch sub-chunk.
 */
@FunctionalInterface
public interface RecordStamper {

    DataRecord stamp(DataRecord record, long processedAt);

    /** Adds {@link DataRecord#STAMP_FIELD} to a copy of the record. */
    RecordStamper TIMESTAMP = (record, processedAt) -> record.stamped(processedAt);
}
