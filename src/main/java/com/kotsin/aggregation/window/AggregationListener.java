package com.kotsin.aggregation.window;

import com.kotsin.aggregation.model.AggregationResult;

@FunctionalInterface
public interface AggregationListener {
    void onAggregation(AggregationResult result);
}
