package com.kotsin.aggregation.exception;

/**
 * Base class for every failure raised while ingesting, batching or aggregating records.
 */
public class StreamProcessingException extends RuntimeException {

    public StreamProcessingException(String message) {
        super(message);
    }

    public StreamProcessingException(String message, Throwable cause) {
        super(message, cause);
    }

}
