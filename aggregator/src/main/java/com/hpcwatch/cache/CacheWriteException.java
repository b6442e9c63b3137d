package com.hpcwatch.cache;

public class CacheWriteException extends RuntimeException {

    public CacheWriteException(String key, Throwable cause) {
        super("Failed to write cache entry '" + key + "': " + cause.getMessage(), cause);
    }
}
