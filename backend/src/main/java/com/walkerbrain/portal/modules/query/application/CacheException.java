package com.walkerbrain.portal.modules.query.application;

/**
 * Internal cache failure. Readers fall back to a live fetch; it never reaches a client.
 */
public class CacheException extends RuntimeException {

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
