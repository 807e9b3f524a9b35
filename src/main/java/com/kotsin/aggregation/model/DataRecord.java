package com.kotsin.aggregation.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered, schema-less mapping from field name to {@link FieldValue}.
 *
 * Records are mutable so that downstream stages may enrich them; anything that
 * retains a record beyond a call (windows, batches) keeps a {@link #copy()}.
 */
@EqualsAndHashCode
public final class DataRecord {

    /** Field added by the batcher when a record is processed. */
    public static final String STAMP_FIELD = "timestamp";

    private final LinkedHashMap<String, FieldValue> fields;

    public DataRecord() {
        this.fields = new LinkedHashMap<>();
    }

    private DataRecord(LinkedHashMap<String, FieldValue> fields) {
        this.fields = fields;
    }

    /**
     * Convenience factory from alternating field names and values.
     * Numbers become numeric fields, everything else is rendered as text.
     */
    public static DataRecord of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected field/value pairs, got " + keyValues.length + " arguments");
        }
        DataRecord record = new DataRecord();
        for (int i = 0; i < keyValues.length; i += 2) {
            String field = String.valueOf(keyValues[i]);
            Object value = keyValues[i + 1];
            if (value instanceof Number) {
                record.put(field, ((Number) value).doubleValue());
            } else {
                record.put(field, String.valueOf(value));
            }
        }
        return record;
    }

    public DataRecord put(String field, FieldValue value) {
        fields.put(field, value);
        return this;
    }

    public DataRecord put(String field, double value) {
        return put(field, FieldValue.of(value));
    }

    public DataRecord put(String field, String value) {
        return put(field, FieldValue.of(value));
    }

    public Optional<FieldValue> get(String field) {
        return Optional.ofNullable(fields.get(field));
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    /**
     * Read-only view in natural (insertion) field order.
     */
    public Map<String, FieldValue> fields() {
        return Collections.unmodifiableMap(fields);
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public DataRecord copy() {
        return new DataRecord(new LinkedHashMap<>(fields));
    }

    /**
     * Copy of this record carrying the processing timestamp.
     */
    public DataRecord stamped(long epochMillis) {
        return copy().put(STAMP_FIELD, epochMillis);
    }

    @JsonValue
    public Map<String, FieldValue> toJson() {
        return fields();
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
