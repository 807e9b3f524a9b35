package com.kotsin.aggregation.batch;

import com.kotsin.aggregation.model.RecordBatch;

@FunctionalInterface
public interface BatchListener {
    void onBatch(RecordBatch batch);
}
