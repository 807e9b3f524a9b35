package com.kotsin.aggregation.util;

import com.kotsin.aggregation.exception.RecordValidationException;
import com.kotsin.aggregation.model.DataRecord;
import com.kotsin.aggregation.model.FieldValue;

import java.util.Map;
import java.util.Objects;

/**
 * Checks that a decoded value is a field mapping and converts it to a {@link DataRecord}.
 *
 * Only structure is checked: string keys, numeric or textual values. No schema.
 */
public final class RecordValidator {

    private RecordValidator() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static DataRecord toRecord(Object decoded) {
        if (Objects.isNull(decoded)) {
            throw new RecordValidationException("Invalid record format: null value");
        }
        if (decoded instanceof DataRecord) {
            return (DataRecord) decoded;
        }
        if (!(decoded instanceof Map)) {
            throw new RecordValidationException("Invalid record format: expected a field mapping but got "
                    + decoded.getClass().getSimpleName());
        }

        DataRecord record = new DataRecord();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) decoded).entrySet()) {
            if (!(entry.getKey() instanceof String)) {
                throw new RecordValidationException("Invalid record format: field name " + entry.getKey()
                        + " is not a string");
            }
            record.put((String) entry.getKey(), toFieldValue((String) entry.getKey(), entry.getValue()));
        }
        return record;
    }

    public static boolean isValid(Object decoded) {
        try {
            toRecord(decoded);
            return true;
        } catch (RecordValidationException e) {
            return false;
        }
    }

    private static FieldValue toFieldValue(String field, Object value) {
        if (value instanceof FieldValue) {
            return (FieldValue) value;
        }
        if (value instanceof Number) {
            return FieldValue.of(((Number) value).doubleValue());
        }
        if (value instanceof CharSequence) {
            return FieldValue.of(value.toString());
        }
        throw new RecordValidationException("Invalid record format: field '" + field + "' holds "
                + (value == null ? "null" : value.getClass().getSimpleName()));
    }
}
