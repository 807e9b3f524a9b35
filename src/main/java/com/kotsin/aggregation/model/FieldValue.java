package com.kotsin.aggregation.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A single record cell: either numeric or textual.
 *
 * Numeric-ness is a property of the value itself, never of the column it came from.
 */
@EqualsAndHashCode
public final class FieldValue {

    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private final Double number;
    private final String text;

    private FieldValue(Double number, String text) {
        this.number = number;
        this.text = text;
    }

    public static FieldValue of(double number) {
        return new FieldValue(number, null);
    }

    public static FieldValue of(String text) {
        return new FieldValue(null, Objects.requireNonNull(text, "text"));
    }

    /**
     * Casts a raw decoded cell: numeric literals become numbers, anything else stays text.
     */
    public static FieldValue parse(String raw) {
        if (raw == null) {
            return of("");
        }
        String trimmed = raw.trim();
        if (NUMBER.matcher(trimmed).matches()) {
            return of(Double.parseDouble(trimmed));
        }
        return of(raw);
    }

    public boolean isNumeric() {
        return number != null;
    }

    /**
     * A numeric value that can take part in statistics; NaN and infinities cannot.
     */
    public boolean isFinite() {
        return number != null && Double.isFinite(number);
    }

    public double asDouble() {
        if (number == null) {
            throw new IllegalStateException("Not a numeric value: " + text);
        }
        return number;
    }

    public String asText() {
        return toString();
    }

    @JsonValue
    public Object toJson() {
        if (number == null) {
            return text;
        }
        return isIntegral(number) ? (Object) number.longValue() : number;
    }

    @Override
    public String toString() {
        if (number == null) {
            return text;
        }
        return isIntegral(number) ? Long.toString(number.longValue()) : Double.toString(number);
    }

    private static boolean isIntegral(double value) {
        return !Double.isInfinite(value) && value == Math.rint(value) && Math.abs(value) < 1e15;
    }
}
