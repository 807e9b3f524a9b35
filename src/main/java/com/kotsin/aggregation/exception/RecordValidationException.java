package com.kotsin.aggregation.exception;

/**
 * A decoded value is not a field-mapping record.
 */
public class RecordValidationException extends StreamProcessingException {

    public RecordValidationException(String message) {
        super(message);
    }

}
