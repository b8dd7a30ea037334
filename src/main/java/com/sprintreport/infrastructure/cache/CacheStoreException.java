package com.sprintreport.infrastructure.cache;

/**
 * The cache store could not be reached or rejected the operation.
 */
public class CacheStoreException extends RuntimeException {

    public CacheStoreException(String message) {
        super(message);
    }

    public CacheStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
