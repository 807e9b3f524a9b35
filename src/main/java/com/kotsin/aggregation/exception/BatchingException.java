package com.kotsin.aggregation.exception;

/**
 * Fatal error reported by a record batcher stream. Aborts the batcher instance.
 */
public class BatchingException extends StreamProcessingException {

    public BatchingException(String message) {
        super(message);
    }

    public BatchingException(String message, Throwable cause) {
        super(message, cause);
    }

}
