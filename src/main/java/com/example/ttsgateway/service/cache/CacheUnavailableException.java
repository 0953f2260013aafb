package com.example.ttsgateway.service.cache;

/**
 * Raised by a {@link KeyValueStore} when the backing store cannot be reached. Never fatal to a request.
 */
public class CacheUnavailableException extends RuntimeException {

    public CacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
