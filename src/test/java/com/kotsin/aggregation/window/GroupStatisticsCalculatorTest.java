package com.kotsin.aggregation.window;

import com.kotsin.aggregation.model.DataRecord;
import com.kotsin.aggregation.model.FieldValue;
import com.kotsin.aggregation.model.GroupStatistics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GroupStatisticsCalculator")
class GroupStatisticsCalculatorTest {

    // ========== GROUPING TESTS ==========

    @Test
    @DisplayName("Should group by textual fields and measure numeric ones")
    void testCategoryGroups() {
        List<DataRecord> records = List.of(
                DataRecord.of("category", "A", "value", 10),
                DataRecord.of("category", "A", "value", 20),
                DataRecord.of("category", "B", "value", 30));

        Map<String, GroupStatistics> groups = GroupStatisticsCalculator.aggregate(records);

        assertEquals(2, groups.size());

        GroupStatistics a = groups.get("category:A");
        assertNotNull(a);
        assertEquals(2, a.getCount());
        assertEquals(30.0, a.getSum("value"));
        assertEquals(15.0, a.getAvg("value"));
        assertEquals(10.0, a.getMin("value"));
        assertEquals(20.0, a.getMax("value"));

        GroupStatistics b = groups.get("category:B");
        assertEquals(1, b.getCount());
        assertEquals(30.0, b.getSum("value"));
    }

    @Test
    @DisplayName("Should join several textual fields in natural order")
    void testCompositeKey() {
        DataRecord record = DataRecord.of("region", "eu", "value", 1, "tier", "gold");

        assertEquals("region:eu|tier:gold", GroupStatisticsCalculator.groupKey(record));
    }

    @Test
    @DisplayName("Records without textual fields should share the ungrouped key")
    void testUngroupedKey() {
        DataRecord record = DataRecord.of("id", 1, "value", 2);

        assertEquals(GroupStatisticsCalculator.UNGROUPED_KEY, GroupStatisticsCalculator.groupKey(record));
    }

    @Test
    @DisplayName("The processing timestamp should never become part of the key or a measure")
    void testTimestampIgnored() {
        DataRecord stamped = DataRecord.of("category", "A", "value", 5).stamped(123L);
        stamped.put(DataRecord.STAMP_FIELD, FieldValue.of("2024-01-01"));

        assertEquals("category:A", GroupStatisticsCalculator.groupKey(stamped));
        GroupStatistics stats = GroupStatisticsCalculator.groupStatistics(List.of(stamped));
        assertFalse(stats.hasStatisticsFor(DataRecord.STAMP_FIELD));
    }

    // ========== MISSING / MIXED FIELD TESTS ==========

    @Test
    @DisplayName("Missing and non-numeric occurrences should be skipped, not counted")
    void testMissingFieldsSkipped() {
        List<DataRecord> group = List.of(
                DataRecord.of("value", 10, "other", 1),
                DataRecord.of("other", 2),
                DataRecord.of("value", 30));

        GroupStatistics stats = GroupStatisticsCalculator.groupStatistics(group);

        assertEquals(3, stats.getCount());
        assertEquals(40.0, stats.getSum("value"));
        assertEquals(20.0, stats.getAvg("value"));
        assertEquals(3.0, stats.getSum("other"));
        assertEquals(1.5, stats.getAvg("other"));
    }

    @Test
    @DisplayName("Numeric fields are chosen from the first record of the group")
    void testNumericFieldsFromFirstRecord() {
        List<DataRecord> group = List.of(
                DataRecord.of("value", 10),
                DataRecord.of("value", 20, "late", 99));

        GroupStatistics stats = GroupStatisticsCalculator.groupStatistics(group);

        assertTrue(stats.hasStatisticsFor("value"));
        assertFalse(stats.hasStatisticsFor("late"));
    }

    @Test
    @DisplayName("NaN and infinite values should be skipped like non-numeric ones")
    void testNonFiniteSkipped() {
        List<DataRecord> group = List.of(
                DataRecord.of("value", 10),
                DataRecord.of("value", Double.NaN),
                DataRecord.of("value", Double.POSITIVE_INFINITY),
                DataRecord.of("value", 30));

        GroupStatistics stats = GroupStatisticsCalculator.groupStatistics(group);

        assertEquals(4, stats.getCount());
        assertEquals(40.0, stats.getSum("value"));
        assertEquals(20.0, stats.getAvg("value"));
        assertEquals(30.0, stats.getMax("value"));
        assertEquals(10.0, stats.getMin("value"));
    }

    @Test
    @DisplayName("A group whose only value is NaN should have no statistics for that field")
    void testOnlyNaN() {
        GroupStatistics stats = GroupStatisticsCalculator.groupStatistics(List.of(DataRecord.of("value", Double.NaN)));

        assertEquals(1, stats.getCount());
        assertFalse(stats.hasStatisticsFor("value"));
    }

    @Test
    @DisplayName("Negative values should produce correct max and min")
    void testNegativeValues() {
        List<DataRecord> group = List.of(DataRecord.of("v", -5), DataRecord.of("v", -1));

        GroupStatistics stats = GroupStatisticsCalculator.groupStatistics(group);

        assertEquals(-1.0, stats.getMax("v"));
        assertEquals(-5.0, stats.getMin("v"));
    }

    @Test
    @DisplayName("No records should produce no groups")
    void testEmpty() {
        assertTrue(GroupStatisticsCalculator.aggregate(List.of()).isEmpty());
    }
}
