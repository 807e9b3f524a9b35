package com.kotsin.aggregation.window;

import com.kotsin.aggregation.model.DataRecord;
import com.kotsin.aggregation.model.FieldValue;
import com.kotsin.aggregation.model.GroupStatistics;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Groups the records of one window and computes per-group statistics.
 *
 * Textual fields form the group key ({@code field:value} pairs joined by {@code |})
 * and numeric fields are measured. Unlike a key over every non-timestamp field,
 * this lets {@code {category:A, value:10}} and {@code {category:A, value:20}} fall
 * into one {@code category:A} group. Which fields are measured is decided by the
 * first record of each group; later occurrences that are missing, not numeric,
 * NaN or infinite are skipped.
 */
public final class GroupStatisticsCalculator {

    public static final String KEY_SEPARATOR = "|";

    /** Key used when a record has no textual fields. */
    public static final String UNGROUPED_KEY = "*";

    private GroupStatisticsCalculator() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static Map<String, GroupStatistics> aggregate(List<DataRecord> records) {
        Map<String, List<DataRecord>> groups = new LinkedHashMap<>();
        for (DataRecord record : records) {
            groups.computeIfAbsent(groupKey(record), k -> new ArrayList<>()).add(record);
        }

        Map<String, GroupStatistics> result = new LinkedHashMap<>();
        groups.forEach((key, groupRecords) -> result.put(key, groupStatistics(groupRecords)));
        return result;
    }

    public static String groupKey(DataRecord record) {
        String key = record.fields().entrySet().stream()
                .filter(e -> !DataRecord.STAMP_FIELD.equals(e.getKey()))
                .filter(e -> !e.getValue().isNumeric())
                .map(e -> e.getKey() + ":" + e.getValue())
                .collect(Collectors.joining(KEY_SEPARATOR));
        return key.isEmpty() ? UNGROUPED_KEY : key;
    }

    static GroupStatistics groupStatistics(List<DataRecord> group) {
        Map<String, Double> metrics = new LinkedHashMap<>();

        for (String field : numericFields(group.get(0))) {
            double sum = 0;
            double max = Double.NEGATIVE_INFINITY;
            double min = Double.POSITIVE_INFINITY;
            int numericCount = 0;

            for (DataRecord record : group) {
                FieldValue value = record.get(field).orElse(null);
                if (value == null || !value.isFinite()) {
                    continue;
                }
                double v = value.asDouble();
                sum += v;
                max = Math.max(max, v);
                min = Math.min(min, v);
                numericCount++;
            }

            if (numericCount > 0) {
                metrics.put(field + GroupStatistics.SUM, sum);
                metrics.put(field + GroupStatistics.AVG, sum / numericCount);
                metrics.put(field + GroupStatistics.MAX, max);
                metrics.put(field + GroupStatistics.MIN, min);
            }
        }

        return new GroupStatistics(group.size(), metrics);
    }

    private static List<String> numericFields(DataRecord first) {
        return first.fields().entrySet().stream()
                .filter(e -> !DataRecord.STAMP_FIELD.equals(e.getKey()))
                .filter(e -> e.getValue().isNumeric())
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }
}
