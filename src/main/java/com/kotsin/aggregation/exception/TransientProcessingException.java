package com.kotsin.aggregation.exception;

/**
 * Failure inside a batch sub-chunk or a window aggregation pass.
 * Logged and absorbed; never surfaces to callers.
 */
public class TransientProcessingException extends StreamProcessingException {

    public TransientProcessingException(String message, Throwable cause) {
        super(message, cause);
    }

}
