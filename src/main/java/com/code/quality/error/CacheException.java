package com.code.quality.error;

import java.util.List;

/**
 * Raised inside the cache layer when an entry is corrupted or unreadable.
 * Never escapes a cache lookup: callers see a miss instead.
 */
public class CacheException extends CodeQualityException {

    public CacheException(String message) {
        this(message, null);
    }

    public CacheException(String message, Throwable cause) {
        super(ErrorKind.CACHE, message, List.of("Clear the analysis cache if the problem persists"), cause);
    }
}
