package com.kotsin.aggregation.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a source that reached end-of-input successfully.
 */
@Value
@Builder
public class SourceReport {
    String sourceName;
    long recordsProcessed;
    long batchesEmitted;
    long durationMs;
}
