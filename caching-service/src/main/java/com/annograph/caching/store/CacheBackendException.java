package com.annograph.caching.store;

public class CacheBackendException extends RuntimeException {

    public CacheBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
