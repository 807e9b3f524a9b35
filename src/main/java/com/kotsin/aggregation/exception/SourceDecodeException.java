package com.kotsin.aggregation.exception;

/**
 * Malformed external input. Fatal to the owning source session only.
 */
public class SourceDecodeException extends StreamProcessingException {

    public SourceDecodeException(String message) {
        super(message);
    }

    public SourceDecodeException(String message, Throwable cause) {
        super(message, cause);
    }

}
