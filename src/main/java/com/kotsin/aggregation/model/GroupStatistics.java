package com.kotsin.aggregation.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Statistics for one group of records inside a window.
 *
 * Serialized flat, e.g. {@code {"count":2,"value_sum":30.0,"value_avg":15.0,...}}.
 */
@EqualsAndHashCode
@ToString
public final class GroupStatistics {

    public static final String SUM = "_sum";
    public static final String AVG = "_avg";
    public static final String MAX = "_max";
    public static final String MIN = "_min";

    private final int count;
    private final Map<String, Double> metrics;

    public GroupStatistics(int count, Map<String, Double> metrics) {
        this.count = count;
        this.metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }

    @JsonProperty("count")
    public int getCount() {
        return count;
    }

    /**
     * Metric values keyed {@code <field>_sum|_avg|_max|_min}.
     */
    @JsonAnyGetter
    public Map<String, Double> getMetrics() {
        return metrics;
    }

    public Double getSum(String field) {
        return metrics.get(field + SUM);
    }

    public Double getAvg(String field) {
        return metrics.get(field + AVG);
    }

    public Double getMax(String field) {
        return metrics.get(field + MAX);
    }

    public Double getMin(String field) {
        return metrics.get(field + MIN);
    }

    public boolean hasStatisticsFor(String field) {
        return metrics.containsKey(field + SUM);
    }
}
