package com.kotsin.aggregation.util;

import com.kotsin.aggregation.exception.RecordValidationException;
import com.kotsin.aggregation.model.DataRecord;
import com.kotsin.aggregation.model.FieldValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RecordValidator - Defensive Tests")
class RecordValidatorTest {

    // ========== ACCEPTED SHAPES ==========

    @Test
    @DisplayName("Should convert a map of numbers and strings, keeping field order")
    void testToRecord_Map() {
        Map<String, Object> decoded = new LinkedHashMap<>();
        decoded.put("category", "A");
        decoded.put("value", 10);
        decoded.put("parsed", FieldValue.of(2.5));

        DataRecord record = RecordValidator.toRecord(decoded);

        assertEquals(List.of("category", "value", "parsed"), List.copyOf(record.fields().keySet()));
        assertFalse(record.get("category").orElseThrow().isNumeric());
        assertEquals(10.0, record.get("value").orElseThrow().asDouble());
        assertEquals(2.5, record.get("parsed").orElseThrow().asDouble());
    }

    @Test
    @DisplayName("Should pass a DataRecord through unchanged")
    void testToRecord_DataRecord() {
        DataRecord record = DataRecord.of("id", 1);
        assertSame(record, RecordValidator.toRecord(record));
    }

    @Test
    @DisplayName("An empty mapping is still a mapping")
    void testToRecord_EmptyMap() {
        assertTrue(RecordValidator.toRecord(Map.of()).isEmpty());
    }

    // ========== REJECTED SHAPES ==========

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {"not a record", ""})
    @DisplayName("Should reject null and non-mapping values")
    void testToRecord_NotAMapping(String value) {
        assertThrows(RecordValidationException.class, () -> RecordValidator.toRecord(value));
        assertFalse(RecordValidator.isValid(value));
    }

    @Test
    @DisplayName("Should reject non-string field names")
    void testToRecord_NonStringKey() {
        Map<Object, Object> decoded = new HashMap<>();
        decoded.put(1, "x");

        assertThrows(RecordValidationException.class, () -> RecordValidator.toRecord(decoded));
    }

    @Test
    @DisplayName("Should reject nested or null field values")
    void testToRecord_BadValue() {
        Map<String, Object> nested = new HashMap<>();
        nested.put("inner", Map.of("a", 1));
        Map<String, Object> withNull = new HashMap<>();
        withNull.put("missing", null);

        assertThrows(RecordValidationException.class, () -> RecordValidator.toRecord(nested));
        assertThrows(RecordValidationException.class, () -> RecordValidator.toRecord(withNull));
        assertThrows(RecordValidationException.class, () -> RecordValidator.toRecord(List.of(1, 2)));
    }

    @Test
    @DisplayName("Validity check should agree with conversion")
    void testIsValid() {
        assertTrue(RecordValidator.isValid(Map.of("id", 1)));
    }
}
