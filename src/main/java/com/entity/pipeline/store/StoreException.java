package com.entity.pipeline.store;

/**
 * Unchecked wrapper for database failures. Treated as fatal by the pipeline stages.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
