package com.kotsin.aggregation.exception;

/**
 * Failure while releasing session resources during teardown. Best effort only.
 */
public class ResourceCleanupException extends StreamProcessingException {

    public ResourceCleanupException(String message, Throwable cause) {
        super(message, cause);
    }

}
